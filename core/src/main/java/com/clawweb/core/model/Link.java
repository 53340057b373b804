package com.clawweb.core.model;

import java.util.Objects;

/**
 * 방문 페이지 → 참조 URL 간선. (source, destination, type) 세 값이 같으면 같은 링크.
 */
public record Link(String source, String destination, String type) {

    /** 현재 유일한 링크 타입: a[href] */
    public static final String HREF = "href";

    public Link {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(type, "type");
    }

    public static Link href(String source, String destination) {
        return new Link(source, destination, HREF);
    }

    @Override
    public String toString() {
        return source + " -> " + destination;
    }
}
