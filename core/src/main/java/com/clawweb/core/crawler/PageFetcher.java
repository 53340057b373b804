package com.clawweb.core.crawler;

import com.clawweb.core.model.FetchResult;

/** 페이지 1건을 가져와 절대 URL 목록을 추출하는 전략 인터페이스. */
public interface PageFetcher {
    /**
     * url 을 GET 하고 문서 순서대로(중복 없이) outbound URL 을 돌려준다.
     * 예상 가능한 실패(비 HTML, 4xx/5xx, 연결 오류)는 예외가 아니라 결과 상태로 표현.
     */
    FetchResult fetch(String url);
}
