package com.clawweb.core.util;

/** 프런티어 중복 제거용 URL 정규화 유틸 */
public final class UrlNormalizer {
    private UrlNormalizer(){}

    /**
     * 정규화 규칙: fragment 제거(첫 '#' 이후 전부).
     * 그 외(host 대소문자, 기본 포트, 경로)는 건드리지 않는다. null → null.
     */
    public static String normalize(String url) {
        if (url == null) return null;
        int hash = url.indexOf('#');
        return hash < 0 ? url : url.substring(0, hash);
    }
}
