package com.clawweb.core.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.util.Locale;
import java.util.Objects;

/**
 * same-host: 후보 URL 의 hostname 이 루트 hostname 과 같아야 통과.
 * <ul>
 *   <li>hostname 은 소문자로 맞춘 뒤 정확히 비교</li>
 *   <li>host 가 없는 URL(mailto:, javascript: ...)은 REJECT</li>
 *   <li>파싱 실패 시 ERROR + 로그, 크롤은 계속</li>
 * </ul>
 */
public final class HostFilter implements UrlFilter {
    private static final Logger LOG = LoggerFactory.getLogger(HostFilter.class);

    private final String rootHost;

    public HostFilter(String rootHost) {
        this.rootHost = rootHost == null ? null : rootHost.toLowerCase(Locale.ROOT);
    }

    /** 루트 URL 에서 host 를 뽑아 생성. 루트에 host 가 없으면 모든 URL 을 거부하는 필터가 된다. */
    public static HostFilter forRoot(String rootUrl) {
        String host = null;
        try {
            host = hostOf(Objects.requireNonNull(rootUrl, "rootUrl"));
        } catch (MalformedURLException e) {
            LOG.warn("Can't extract host from root url '{}' ({})", rootUrl, e.getMessage());
        }
        return new HostFilter(host);
    }

    public String getRootHost() { return rootHost; }

    @Override public String name() { return "same-host"; }

    @Override
    public FilterVerdict evaluate(String url) {
        if (url == null) return FilterVerdict.REJECT;
        try {
            String host = hostOf(url);
            return FilterVerdict.of(host != null && host.equals(rootHost));
        } catch (MalformedURLException e) {
            LOG.warn("ERROR: Can't process url '{}' ({})", url, e.getMessage());
            return FilterVerdict.ERROR;
        }
    }

    /**
     * URI 로 먼저 시도(opaque scheme 은 host=null), 실패하면 관대한 java.net.URL 로 재시도.
     * 둘 다 실패해야 MalformedURLException.
     */
    static String hostOf(String url) throws MalformedURLException {
        String host;
        try {
            URI u = URI.create(url);
            host = u.getHost();
            // '_' 등으로 server-based 파싱이 안 되는 authority
            if (host == null && u.getRawAuthority() != null) host = new URL(url).getHost();
        } catch (IllegalArgumentException notUri) {
            host = new URL(url).getHost();
        }
        if (host == null || host.isEmpty()) return null;
        return host.toLowerCase(Locale.ROOT);
    }
}
