package com.clawweb.core.filter;

import com.clawweb.core.model.CrawlConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** 순서 있는 필터 목록의 논리 AND. 빈 체인은 모든 URL 을 통과시킨다. */
public final class FilterChain {
    private final List<UrlFilter> filters;

    public FilterChain(List<UrlFilter> filters) {
        this.filters = List.copyOf(filters);
    }

    public static FilterChain empty() {
        return new FilterChain(List.of());
    }

    /** fetch 여부: prefix → exclude → visited → (host) */
    public static FilterChain forFollowing(CrawlConfig cfg, Set<String> visited) {
        List<UrlFilter> fs = new ArrayList<>();
        fs.add(new PrefixFilter(cfg.getConfinePrefix()));
        fs.add(new ExclusionFilter(cfg.getExcludePrefixes()));
        fs.add(new VisitedFilter(visited));
        if (cfg.isSameHostOnly()) fs.add(HostFilter.forRoot(cfg.getTarget()));
        return new FilterChain(fs);
    }

    /** 기록 여부: prefix → (host). reportFiltering=false 면 빈 체인 */
    public static FilterChain forReporting(CrawlConfig cfg) {
        if (!cfg.isReportFiltering()) return empty();
        List<UrlFilter> fs = new ArrayList<>();
        fs.add(new PrefixFilter(cfg.getConfinePrefix()));
        if (cfg.isSameHostOnly()) fs.add(HostFilter.forRoot(cfg.getTarget()));
        return new FilterChain(fs);
    }

    public boolean acceptsAll(String url) {
        for (UrlFilter f : filters) {
            if (!f.accepts(url)) return false;
        }
        return true;
    }

    /** 통과하지 못한 필터 이름(체인 순서). 비어 있으면 전부 통과. */
    public List<String> rejecting(String url) {
        List<String> out = new ArrayList<>();
        for (UrlFilter f : filters) {
            if (!f.accepts(url)) out.add(f.name());
        }
        return out;
    }

    public List<UrlFilter> filters() { return filters; }

    public boolean isEmpty() { return filters.isEmpty(); }
}
