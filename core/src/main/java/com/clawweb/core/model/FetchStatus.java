package com.clawweb.core.model;

/** 단일 페이지 fetch 결과 종류. OK 이외는 모두 "링크 0개"로 취급. */
public enum FetchStatus {
    OK,
    /** Content-Type 이 정확히 text/html 이 아님 */
    NON_HTML,
    /** 4xx/5xx */
    HTTP_ERROR,
    /** DNS/연결/타임아웃/IO */
    TRANSPORT_ERROR,
    /** URL 파싱 불가 또는 http(s) 가 아닌 scheme */
    INVALID_URL
}
