package com.clawweb.core.crawler;

import com.clawweb.core.model.CrawlConfig;
import com.clawweb.core.model.FetchResult;
import com.clawweb.core.model.FetchStatus;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Flow;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HttpPageFetcher: 로컬 HttpServer 대상")
class HttpPageFetcherTest {

    static HttpServer s;
    static String base;

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        base = "http://127.0.0.1:" + s.getAddress().getPort();

        s.createContext("/links", ex -> html(ex,
                "<html><body>"
                + "<a href=\"/a\">a</a>"
                + "<a name=\"no-href\">anchor only</a>"
                + "<a href=\"http://other.example/b\">b</a>"
                + "<a href=\"a\">a again (relative)</a>"
                + "<a href=\"/a#frag\">a with fragment</a>"
                + "<a href=\"//cdn.example/c\">c</a>"
                + "<a href=\"mailto:x@example.com\">mail</a>"
                + "</body></html>"));

        s.createContext("/doc.pdf", ex -> respond(ex, 200, "application/pdf", "%PDF-1.4 <a href=\"/x\">".getBytes(StandardCharsets.UTF_8)));
        s.createContext("/xhtml", ex -> respond(ex, 200, "application/xhtml+xml", "<a href=\"/x\">x</a>".getBytes(StandardCharsets.UTF_8)));
        s.createContext("/plain", ex -> respond(ex, 200, null, "<a href=\"/x\">x</a>".getBytes(StandardCharsets.UTF_8)));
        s.createContext("/latin", ex -> respond(ex, 200, "Text/HTML; charset=ISO-8859-1", "<p>café</p><a href=\"/ok\">ok</a>".getBytes(StandardCharsets.ISO_8859_1)));
        s.createContext("/broken-bytes", ex -> {
            ByteArrayOutputStream b = new ByteArrayOutputStream();
            b.writeBytes("<p>".getBytes(StandardCharsets.UTF_8));
            b.write(0xFF);
            b.write(0xFE);
            b.writeBytes("</p><a href=\"/still-here\">x</a>".getBytes(StandardCharsets.UTF_8));
            respond(ex, 200, "text/html", b.toByteArray());
        });
        s.createContext("/missing", ex -> respond(ex, 404, "text/html", "<a href=\"/x\">not found</a>".getBytes(StandardCharsets.UTF_8)));
        s.createContext("/boom", ex -> respond(ex, 500, "text/html", "oops".getBytes(StandardCharsets.UTF_8)));

        // /old → 302 → /sub/page ; 상대 링크는 /old 기준으로 풀려야 함
        s.createContext("/old", ex -> {
            ex.getResponseHeaders().add("Location", "/sub/page");
            ex.sendResponseHeaders(302, -1);
            ex.close();
        });
        s.createContext("/sub/page", ex -> html(ex, "<a href=\"x\">x</a>"));

        s.start();
    }

    @AfterAll
    static void down() {
        if (s != null) s.stop(0);
    }

    private final HttpPageFetcher fetcher = new HttpPageFetcher(new CrawlConfig().setTarget(base).setTimeoutMs(5_000));

    @Test
    void extracts_resolved_links_in_document_order_without_duplicates() {
        FetchResult r = fetcher.fetch(base + "/links");

        assertThat(r.getStatus()).isEqualTo(FetchStatus.OK);
        assertThat(r.getStatusCode()).isEqualTo(200);
        assertThat(r.getOutLinks()).containsExactly(
                base + "/a",
                "http://other.example/b",
                base + "/a#frag",               // fragment 정리는 크롤러 몫
                "http://cdn.example/c",
                "mailto:x@example.com");
    }

    @Test
    void non_html_content_types_yield_no_links() {
        FetchResult pdf = fetcher.fetch(base + "/doc.pdf");
        assertThat(pdf.getStatus()).isEqualTo(FetchStatus.NON_HTML);
        assertThat(pdf.getContentType()).isEqualTo("application/pdf");
        assertThat(pdf.getOutLinks()).isEmpty();

        // 정확히 text/html 만 허용
        assertThat(fetcher.fetch(base + "/xhtml").getStatus()).isEqualTo(FetchStatus.NON_HTML);
        assertThat(fetcher.fetch(base + "/plain").getStatus()).isEqualTo(FetchStatus.NON_HTML);
    }

    @Test
    void media_type_check_ignores_case_and_parameters() {
        FetchResult r = fetcher.fetch(base + "/latin");
        assertThat(r.getStatus()).isEqualTo(FetchStatus.OK);
        assertThat(r.getOutLinks()).containsExactly(base + "/ok");
    }

    @Test
    void undecodable_bytes_do_not_fail_the_fetch() {
        FetchResult r = fetcher.fetch(base + "/broken-bytes");
        assertThat(r.isOk()).isTrue();
        assertThat(r.getOutLinks()).containsExactly(base + "/still-here");
    }

    @Test
    void http_errors_are_reported_as_results() {
        FetchResult notFound = fetcher.fetch(base + "/missing");
        assertThat(notFound.getStatus()).isEqualTo(FetchStatus.HTTP_ERROR);
        assertThat(notFound.getStatusCode()).isEqualTo(404);
        assertThat(notFound.getOutLinks()).isEmpty();

        assertThat(fetcher.fetch(base + "/boom").getStatusCode()).isEqualTo(500);
    }

    @Test
    @DisplayName("리다이렉트 후에도 상대 링크는 원래 요청 URL 기준")
    void relative_links_resolve_against_requested_url_after_redirect() {
        FetchResult r = fetcher.fetch(base + "/old");
        assertThat(r.isOk()).isTrue();
        assertThat(r.getOutLinks()).containsExactly(base + "/x");
    }

    @Test
    void invalid_and_non_http_urls() {
        assertThat(fetcher.fetch("http://exa mple.com/").getStatus()).isEqualTo(FetchStatus.INVALID_URL);
        assertThat(fetcher.fetch("mailto:x@example.com").getStatus()).isEqualTo(FetchStatus.INVALID_URL);
    }

    @Test
    void connection_failure_is_a_transport_error() throws Exception {
        // 바인드 후 즉시 닫은 포트 → 연결 거부
        int port;
        try (ServerSocket ss = new ServerSocket(0)) {
            port = ss.getLocalPort();
        }

        FetchResult r = fetcher.fetch("http://127.0.0.1:" + port + "/");
        assertThat(r.getStatus()).isEqualTo(FetchStatus.TRANSPORT_ERROR);
        assertThat(r.getStatusCode()).isEqualTo(-1);
        assertThat(r.getError()).isNotBlank();
    }

    @Test
    void media_type_helper() {
        assertThat(HttpPageFetcher.mediaType("text/html; charset=utf-8")).isEqualTo("text/html");
        assertThat(HttpPageFetcher.mediaType(" TEXT/HTML ")).isEqualTo("text/html");
        assertThat(HttpPageFetcher.mediaType(null)).isNull();
    }

    @Test
    @DisplayName("비 HTML / 4xx 응답 본문은 버퍼링하지 않고 버림")
    void body_is_buffered_only_for_successful_html() throws Exception {
        byte[] payload = "%PDF-1.4 ...".getBytes(StandardCharsets.UTF_8);

        assertThat(drain(responseHead(200, "application/pdf"), payload)).isNull();
        assertThat(drain(responseHead(200, null), payload)).isNull();
        assertThat(drain(responseHead(404, "text/html"), payload)).isNull();
        assertThat(drain(responseHead(200, "text/html; charset=utf-8"), payload)).containsExactly(payload);
    }

    // ---------- helpers ----------
    private static HttpResponse.ResponseInfo responseHead(int code, String contentType) {
        Map<String, List<String>> h = contentType == null ? Map.of() : Map.of("Content-Type", List.of(contentType));
        HttpHeaders headers = HttpHeaders.of(h, (k, v) -> true);
        return new HttpResponse.ResponseInfo() {
            @Override public int statusCode() { return code; }
            @Override public HttpHeaders headers() { return headers; }
            @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
        };
    }

    /** 본문 구독자에 payload 를 흘려보내고 최종 body 를 꺼낸다 */
    private static byte[] drain(HttpResponse.ResponseInfo head, byte[] payload) throws Exception {
        HttpResponse.BodySubscriber<byte[]> sub = HttpPageFetcher.HTML_BODY_ONLY.apply(head);
        sub.onSubscribe(new Flow.Subscription() {
            @Override public void request(long n) {}
            @Override public void cancel() {}
        });
        sub.onNext(List.of(ByteBuffer.wrap(payload)));
        sub.onComplete();
        return sub.getBody().toCompletableFuture().get();
    }

    private static void html(HttpExchange ex, String body) throws IOException {
        respond(ex, 200, "text/html; charset=utf-8", body.getBytes(StandardCharsets.UTF_8));
    }

    private static void respond(HttpExchange ex, int code, String contentType, byte[] body) throws IOException {
        if (contentType != null) ex.getResponseHeaders().add("Content-Type", contentType);
        ex.sendResponseHeaders(code, body.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(body);
        }
    }
}
