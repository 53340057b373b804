package com.clawweb.core.filter;

import java.util.List;

/** not-excluded: 제외 prefix 중 하나라도 일치하면 거부 */
public final class ExclusionFilter implements UrlFilter {
    private final List<String> prefixes;

    public ExclusionFilter(List<String> prefixes) {
        this.prefixes = (prefixes == null) ? List.of() : List.copyOf(prefixes);
    }

    @Override public String name() { return "not-excluded"; }

    @Override
    public FilterVerdict evaluate(String url) {
        if (url == null) return FilterVerdict.REJECT;
        for (String p : prefixes) {
            if (url.startsWith(p)) return FilterVerdict.REJECT;
        }
        return FilterVerdict.ACCEPT;
    }
}
