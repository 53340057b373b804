package com.clawweb.app.cli;

import com.clawweb.core.crawler.PageFetcher;
import com.clawweb.core.model.FetchResult;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * --links 모드: 루트 한 페이지만 fetch 해서 outbound URL 을 번호 붙여 출력.
 * "http" 부분 문자열이 있는 URL 만 (scheme 검사가 아니라 문자열 포함 여부).
 */
public final class LinkLister {
    private final PageFetcher fetcher;

    public LinkLister(PageFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    /** @return 출력한 줄 수 */
    public int list(String url, PrintWriter out) {
        List<String> lines = format(fetcher.fetch(url));
        for (String line : lines) out.println(line);
        out.flush();
        return lines.size();
    }

    static List<String> format(FetchResult page) {
        List<String> lines = new ArrayList<>();
        int j = 1;
        for (String u : page.getOutLinks()) {
            if (u.contains("http")) lines.add((j++) + ". " + u);
        }
        return lines;
    }
}
