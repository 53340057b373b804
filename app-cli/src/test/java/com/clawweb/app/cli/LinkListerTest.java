package com.clawweb.app.cli;

import com.clawweb.core.model.FetchResult;
import com.clawweb.core.model.FetchStatus;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LinkListerTest {

    @Test
    void numbers_only_urls_containing_http() {
        FetchResult page = FetchResult.ok("http://example.com/", 200, "text/html", List.of(
                "http://example.com/a",
                "mailto:someone@example.com",
                "https://other.example/b",
                "javascript:void(0)",
                "ftp://files.example/http-mirror"));   // 부분 문자열 검사라 포함됨

        assertThat(LinkLister.format(page)).containsExactly(
                "1. http://example.com/a",
                "2. https://other.example/b",
                "3. ftp://files.example/http-mirror");
    }

    @Test
    void failed_fetch_prints_nothing() {
        StringWriter sw = new StringWriter();
        LinkLister lister = new LinkLister(url -> FetchResult.failed(url, FetchStatus.HTTP_ERROR, 404, "Not Found"));

        int n = lister.list("http://example.com/missing", new PrintWriter(sw));

        assertThat(n).isZero();
        assertThat(sw.toString()).isEmpty();
    }

    @Test
    void list_writes_one_line_per_link() {
        StringWriter sw = new StringWriter();
        LinkLister lister = new LinkLister(url ->
                FetchResult.ok(url, 200, "text/html", List.of(url + "x", url + "y")));

        int n = lister.list("http://example.com/", new PrintWriter(sw));

        assertThat(n).isEqualTo(2);
        assertThat(sw.toString().lines()).containsExactly("1. http://example.com/x", "2. http://example.com/y");
    }
}
