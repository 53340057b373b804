package com.clawweb.app.export;

import com.clawweb.core.model.CrawlResult;
import com.clawweb.core.model.Link;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** 링크 그래프 JSON 파일 포맷 (v=1) */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LinkGraphDocument {
    public String v = "1";          // 스키마 버전
    public String root;
    public int maxDepth;
    public Instant generatedAt;
    public int found;               // num_links
    public int followed;            // num_followed
    public List<Edge> links = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Edge {
        public String source;
        public String destination;
        public String type;

        public Edge() {}

        Edge(Link l) {
            this.source = l.source();
            this.destination = l.destination();
            this.type = l.type();
        }
    }

    public static LinkGraphDocument of(CrawlResult r, Instant generatedAt) {
        LinkGraphDocument d = new LinkGraphDocument();
        d.root = r.root();
        d.maxDepth = r.maxDepth();
        d.generatedAt = generatedAt;
        d.found = r.numLinks();
        d.followed = r.numFollowed();
        for (Link l : r.links()) d.links.add(new Edge(l));
        return d;
    }
}
