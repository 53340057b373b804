package com.clawweb.core.crawler;

import com.clawweb.core.api.ICrawler;
import com.clawweb.core.filter.FilterChain;
import com.clawweb.core.model.CrawlConfig;
import com.clawweb.core.model.CrawlResult;
import com.clawweb.core.model.FetchResult;
import com.clawweb.core.model.Link;
import com.clawweb.core.util.StructuredLog;
import com.clawweb.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * BFS 기반 단일 호스트 Crawler
 * - 프런티어(FIFO), urlsSeen / visited / remembered 집합, 카운터를 소유
 * - follow 필터 통과 시에만 fetch, report 필터 통과 시에만 링크 기록
 * - 페이지 단위 실패는 그 항목만 버리고 계속 진행
 * 인스턴스 하나당 crawl() 1회.
 */
public class Crawler implements ICrawler {
    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    private final CrawlConfig config;
    private final PageFetcher fetcher;
    private final FilterChain followFilters;
    private final FilterChain reportFilters;

    private final Set<String> urlsSeen = new LinkedHashSet<>();
    private final Set<String> visitedLinks = new LinkedHashSet<>();
    private final Set<String> urlsRemembered = new LinkedHashSet<>();
    private final Set<Link> linksRemembered = new LinkedHashSet<>();
    private int numLinks;
    private int numFollowed;
    private boolean used;

    public Crawler(CrawlConfig config) {
        this(config, new HttpPageFetcher(config));
    }

    public Crawler(CrawlConfig config, PageFetcher fetcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        config.validate();
        // visited 필터는 이 인스턴스의 방문 집합을 그대로 본다
        this.followFilters = FilterChain.forFollowing(config, Collections.unmodifiableSet(visitedLinks));
        this.reportFilters = FilterChain.forReporting(config);
    }

    @Override
    public CrawlResult crawl() {
        if (used) throw new IllegalStateException("Crawler instances are single-use");
        used = true;

        String root = config.getTarget();
        int maxDepth = config.getMaxDepth();
        SLOG.info("crawl.start", "root", root, "maxDepth", maxDepth);

        Deque<Node> q = new ArrayDeque<>();
        urlsSeen.add(root);
        q.addLast(new Node(root, 0));

        while (!q.isEmpty()) {
            Node cur = q.pollFirst();
            if (cur.depth > maxDepth) continue;

            try {
                visit(cur, q);
            } catch (RuntimeException e) {
                // 이 항목만 포기, 루프는 계속
                LOG.error("ERROR: Can't process url '{}' ({})", cur.url, e.toString(), e);
            }
        }

        SLOG.info("crawl.done", "root", root, "found", numLinks, "followed", numFollowed,
                "edges", linksRemembered.size());
        return result();
    }

    private void visit(Node cur, Deque<Node> q) {
        List<String> rejectedBy = followFilters.rejecting(cur.url);
        if (!rejectedBy.isEmpty()) {
            if (cur.depth == 0) {
                LOG.warn("Whoops! Starting URL {} rejected by the following filters: {}", cur.url, rejectedBy);
            }
            return;
        }

        visitedLinks.add(cur.url);
        numFollowed++;

        FetchResult page = fetcher.fetch(cur.url);
        if (!page.isOk()) {
            LOG.debug("No links from {}: {}", cur.url, page);
            return;
        }

        for (String raw : page.getOutLinks()) {
            String linkUrl = UrlNormalizer.normalize(raw);

            if (urlsSeen.add(linkUrl)) {
                q.addLast(new Node(linkUrl, cur.depth + 1));
            }

            // 발견 기록은 실제 fetch 여부와 무관
            if (reportFilters.acceptsAll(linkUrl)) {
                numLinks++;
                urlsRemembered.add(linkUrl);
                linksRemembered.add(Link.href(cur.url, linkUrl));
            }
        }
    }

    // ---------- 결과 / 상태 조회 ----------

    public CrawlResult result() {
        return new CrawlResult(config.getTarget(), config.getMaxDepth(), numLinks, numFollowed,
                new ArrayList<>(visitedLinks), new ArrayList<>(urlsRemembered), new ArrayList<>(linksRemembered));
    }

    public int getNumLinks() { return numLinks; }
    public int getNumFollowed() { return numFollowed; }
    public Set<String> getUrlsSeen() { return Collections.unmodifiableSet(urlsSeen); }
    public Set<String> getVisitedLinks() { return Collections.unmodifiableSet(visitedLinks); }
    public Set<String> getUrlsRemembered() { return Collections.unmodifiableSet(urlsRemembered); }
    public Set<Link> getLinksRemembered() { return Collections.unmodifiableSet(linksRemembered); }

    private static final class Node {
        final String url; final int depth;
        Node(String u, int d) { this.url = u; this.depth = d; }
    }
}
