package com.clawweb.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상): 순수 설정 보관용.
 * 인스턴스마다 독립적이며, 컬렉션 필드는 항상 불변 사본으로 보관한다.
 */
public final class CrawlConfig {

    public static final int DEFAULT_MAX_DEPTH = 30;
    public static final String DEFAULT_USER_AGENT = "ClawWeb/0.1 (+crawler)";

    // ---------- 기본 필드 ----------
    private String target;                        // 루트 URL (필수)
    private int maxDepth = DEFAULT_MAX_DEPTH;     // BFS 최대 깊이 (루트 = 0)
    private boolean sameHostOnly = true;          // host-locking
    private String confinePrefix;                 // null 이면 제한 없음
    private List<String> excludePrefixes = List.of();

    /** false 면 report 필터를 비워 발견된 링크를 전부 기록 (CLI 미노출, 라이브러리 옵션) */
    private boolean reportFiltering = true;

    private Duration timeout = Duration.ofSeconds(30); // 연결/요청 타임아웃
    private boolean followRedirects = true;
    private String userAgent = DEFAULT_USER_AGENT;

    // ---------- getters ----------
    public String getTarget() { return target; }
    public int getMaxDepth() { return maxDepth; }
    public boolean isSameHostOnly() { return sameHostOnly; }
    public String getConfinePrefix() { return confinePrefix; }
    public List<String> getExcludePrefixes() { return excludePrefixes; }
    public boolean isReportFiltering() { return reportFiltering; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }

    // ---------- fluent setters ----------
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setSameHostOnly(boolean v) { this.sameHostOnly = v; return this; }

    public CrawlConfig setConfinePrefix(String prefix) {
        this.confinePrefix = (prefix == null || prefix.isEmpty()) ? null : prefix;
        return this;
    }

    /** 호출자 리스트와 공유하지 않도록 사본 보관. null 원소는 허용하지 않음. */
    public CrawlConfig setExcludePrefixes(List<String> prefixes) {
        this.excludePrefixes = (prefixes == null) ? List.of() : List.copyOf(prefixes);
        return this;
    }

    public CrawlConfig setReportFiltering(boolean v) { this.reportFiltering = v; return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }

    public CrawlConfig setUserAgent(String ua) {
        this.userAgent = (ua == null || ua.isBlank()) ? DEFAULT_USER_AGENT : ua;
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        if (target.isBlank()) throw new IllegalArgumentException("target must not be blank");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        Objects.requireNonNull(excludePrefixes, "excludePrefixes");
    }

    public static CrawlConfig defaults() { return new CrawlConfig(); }

    @Override
    public String toString() {
        return "CrawlConfig{target=" + target + ", maxDepth=" + maxDepth
                + ", sameHostOnly=" + sameHostOnly + ", confinePrefix=" + confinePrefix
                + ", excludePrefixes=" + excludePrefixes + ", reportFiltering=" + reportFiltering + '}';
    }
}
