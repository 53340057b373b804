package com.clawweb.core.model;

import java.util.List;
import java.util.Objects;

/** 페이지 1건 fetch 결과(불변). outLinks 는 문서 순서, 중복 없음. */
public final class FetchResult {
    private final String url;
    private final FetchStatus status;
    private final int statusCode;
    private final String contentType;
    private final List<String> outLinks;
    private final String error;

    private FetchResult(String url, FetchStatus status, int statusCode, String contentType,
                        List<String> outLinks, String error) {
        this.url = Objects.requireNonNull(url, "url");
        this.status = Objects.requireNonNull(status, "status");
        this.statusCode = statusCode;
        this.contentType = contentType;
        this.outLinks = List.copyOf(outLinks);
        this.error = error;
    }

    public static FetchResult ok(String url, int statusCode, String contentType, List<String> outLinks) {
        return new FetchResult(url, FetchStatus.OK, statusCode, contentType, outLinks, null);
    }

    public static FetchResult nonHtml(String url, int statusCode, String contentType) {
        return new FetchResult(url, FetchStatus.NON_HTML, statusCode, contentType, List.of(),
                "Not interested in files of type " + contentType);
    }

    public static FetchResult failed(String url, FetchStatus status, int statusCode, String error) {
        if (status == FetchStatus.OK) throw new IllegalArgumentException("failed() requires a non-OK status");
        return new FetchResult(url, status, statusCode, null, List.of(), error);
    }

    public String getUrl() { return url; }
    public FetchStatus getStatus() { return status; }
    /** HTTP 상태 코드. 응답을 못 받았으면 -1 */
    public int getStatusCode() { return statusCode; }
    public String getContentType() { return contentType; }
    public List<String> getOutLinks() { return outLinks; }
    public String getError() { return error; }

    public boolean isOk() { return status == FetchStatus.OK; }

    @Override
    public String toString() {
        return "FetchResult{" + status + ' ' + url + (error == null ? "" : " (" + error + ")") + '}';
    }
}
