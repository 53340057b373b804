package com.clawweb.core.crawler;

import com.clawweb.core.model.CrawlConfig;
import com.clawweb.core.model.FetchResult;
import com.clawweb.core.model.FetchStatus;
import com.clawweb.core.util.UrlResolver;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 기본 fetcher: java.net.http 로 GET → Content-Type 확인 → UTF-8 디코드 → jsoup 으로 a[href] 수집.
 * <p>
 * 리다이렉트는 HttpClient 가 따라가지만, 상대 링크는 최종 응답 URL 이 아니라
 * 원래 요청한 URL 기준으로 resolve 한다.
 */
public class HttpPageFetcher implements PageFetcher {
    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);

    static final String HTML = "text/html";

    /** 상태/헤더를 먼저 보고 2xx·3xx 의 text/html 일 때만 본문을 버퍼링. 나머지는 읽고 버림 */
    static final HttpResponse.BodyHandler<byte[]> HTML_BODY_ONLY = info -> {
        String ct = info.headers().firstValue("Content-Type").orElse(null);
        if (info.statusCode() < 400 && HTML.equals(mediaType(ct))) {
            return HttpResponse.BodySubscribers.ofByteArray();
        }
        return HttpResponse.BodySubscribers.<byte[]>replacing(null);
    };

    private final HttpClient client;
    private final Duration timeout;
    private final String userAgent;

    public HttpPageFetcher(CrawlConfig config) {
        this(config, HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build());
    }

    public HttpPageFetcher(CrawlConfig config, HttpClient client) {
        Objects.requireNonNull(config, "config");
        this.client = Objects.requireNonNull(client, "client");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
    }

    @Override
    public FetchResult fetch(String url) {
        Objects.requireNonNull(url, "url");

        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,*/*;q=0.8")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            LOG.warn("ERROR: invalid url '{}' ({})", url, e.getMessage());
            return FetchResult.failed(url, FetchStatus.INVALID_URL, -1, e.getMessage());
        }

        HttpResponse<byte[]> resp;
        try {
            resp = client.send(req, HTML_BODY_ONLY);
        } catch (IOException e) {
            LOG.warn("ERROR: <urlopen error {}> for '{}'", e, url);
            return FetchResult.failed(url, FetchStatus.TRANSPORT_ERROR, -1, String.valueOf(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("ERROR: interrupted while fetching '{}'", url);
            return FetchResult.failed(url, FetchStatus.TRANSPORT_ERROR, -1, "interrupted");
        }

        int code = resp.statusCode();
        if (code >= 400) {
            LOG.warn("ERROR: HTTP Error {} for '{}'", code, url);
            return FetchResult.failed(url, FetchStatus.HTTP_ERROR, code, "HTTP Error " + code);
        }

        String contentType = resp.headers().firstValue("Content-Type").orElse(null);
        if (!HTML.equals(mediaType(contentType))) {
            LOG.info("Not interested in files of type {} ({})", contentType, url);
            return FetchResult.nonHtml(url, code, contentType);
        }

        byte[] body = resp.body();
        if (body == null) body = new byte[0];
        // String(byte[], UTF_8) 는 잘못된 바이트열을 U+FFFD 로 치환한다
        String html = new String(body, StandardCharsets.UTF_8);
        return FetchResult.ok(url, code, contentType, extractLinks(url, html));
    }

    /** 문서 순서대로, 중복 없이. href 없는 a 는 건너뜀. */
    static List<String> extractLinks(String pageUrl, String html) {
        Document doc = Jsoup.parse(html);
        Set<String> out = new LinkedHashSet<>();
        for (Element a : doc.select("a")) {
            if (!a.hasAttr("href")) continue;
            String href = a.attr("href");
            Optional<String> abs = UrlResolver.resolve(pageUrl, href);
            if (abs.isPresent()) {
                out.add(abs.get());
            } else {
                LOG.debug("Unresolvable href '{}' on {}", href, pageUrl);
            }
        }
        return new ArrayList<>(out);
    }

    /** "Text/HTML; charset=utf-8" → "text/html". null 이면 null */
    static String mediaType(String contentType) {
        if (contentType == null) return null;
        int semi = contentType.indexOf(';');
        String base = semi < 0 ? contentType : contentType.substring(0, semi);
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
