package com.clawweb.core.filter;

/** within-confine-prefix: prefix 가 설정된 경우에만 startsWith 검사 */
public final class PrefixFilter implements UrlFilter {
    private final String prefix;

    public PrefixFilter(String prefix) {
        this.prefix = (prefix == null || prefix.isEmpty()) ? null : prefix;
    }

    @Override public String name() { return "within-confine-prefix"; }

    @Override
    public FilterVerdict evaluate(String url) {
        if (prefix == null) return FilterVerdict.ACCEPT;
        return FilterVerdict.of(url != null && url.startsWith(prefix));
    }
}
