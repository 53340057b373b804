package com.clawweb.core.filter;

import java.util.Objects;
import java.util.Set;

/**
 * not-already-visited: 크롤러가 소유한 방문 집합을 읽기 전용으로 참조.
 * 집합은 크롤 진행 중 계속 커지므로 사본이 아니라 뷰를 받는다.
 */
public final class VisitedFilter implements UrlFilter {
    private final Set<String> visited;

    public VisitedFilter(Set<String> visited) {
        this.visited = Objects.requireNonNull(visited, "visited");
    }

    @Override public String name() { return "not-visited"; }

    @Override
    public FilterVerdict evaluate(String url) {
        return FilterVerdict.of(!visited.contains(url));
    }
}
