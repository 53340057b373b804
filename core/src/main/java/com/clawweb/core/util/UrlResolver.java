package com.clawweb.core.util;

import org.jsoup.nodes.Element;

import java.util.Optional;

/** href 원문 → 절대 URL 변환 (HTML 이스케이프 후 base 기준 resolve) */
public final class UrlResolver {
    private UrlResolver(){}

    /**
     * 1) href 텍스트를 HTML 이스케이프(&amp;, &lt;, &gt;, &quot;, &#x27; 다섯 개만)
     * 2) 원래 요청한 페이지 URL(base) 기준으로 jsoup abs:href 와 같은 방식으로 resolve
     *    - 상대경로, ?query 만 있는 참조, //host 형태, 이미 절대인 URL
     *    - 루트 위로 올라가는 ../ 는 제거
     * 3) mailto:, javascript: 처럼 자체 scheme 을 가진 참조는 그대로 유지
     *
     * @return resolve 불가하면 empty
     */
    public static Optional<String> resolve(String base, String href) {
        if (base == null || href == null) return Optional.empty();
        Element a = new Element("a").attr("href", escape(href));
        a.setBaseUri(base);
        String abs = a.absUrl("href");
        return abs.isEmpty() ? Optional.empty() : Optional.of(abs);
    }

    static String escape(String href) {
        StringBuilder sb = new StringBuilder(href.length() + 16);
        for (int i = 0; i < href.length(); i++) {
            char c = href.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#x27;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
