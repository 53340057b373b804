package com.clawweb.core.model;

import java.util.List;

/**
 * 크롤 1회의 최종 산출물 스냅샷.
 *
 * @param visited    실제 fetch 한 URL (방문 순서)
 * @param remembered report 필터를 통과한 발견 URL (발견 순서, 중복 없음)
 * @param links      report 필터를 통과한 간선 (발견 순서, 중복 없음)
 */
public record CrawlResult(String root,
                          int maxDepth,
                          int numLinks,
                          int numFollowed,
                          List<String> visited,
                          List<String> remembered,
                          List<Link> links) {

    public CrawlResult {
        visited = List.copyOf(visited);
        remembered = List.copyOf(remembered);
        links = List.copyOf(links);
    }
}
