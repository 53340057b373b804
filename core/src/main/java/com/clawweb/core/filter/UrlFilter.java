package com.clawweb.core.filter;

/**
 * URL 단위 판정 전략. FilterChain 에서 AND 로 결합된다.
 * 구현체는 평가 실패를 예외로 던지지 말고 {@link FilterVerdict#ERROR} 로 돌려준다.
 */
public interface UrlFilter {

    /** 진단 메시지에 쓰이는 고정 이름 */
    String name();

    FilterVerdict evaluate(String url);

    default boolean accepts(String url) {
        return evaluate(url) == FilterVerdict.ACCEPT;
    }
}
