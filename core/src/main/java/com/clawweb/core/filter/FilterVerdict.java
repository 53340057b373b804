package com.clawweb.core.filter;

/** 필터 판정. ERROR 는 평가 자체가 실패한 경우이며 REJECT 와 동일하게 취급(fail-closed). */
public enum FilterVerdict {
    ACCEPT,
    REJECT,
    ERROR;

    public static FilterVerdict of(boolean accepted) {
        return accepted ? ACCEPT : REJECT;
    }
}
