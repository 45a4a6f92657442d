package com.webchunker.core.model;

/** 링크 허용 판정 결과. ADMITTED 외에는 모두 거부 사유 */
public enum Admission {
    ADMITTED,
    UNSUPPORTED_SCHEME,
    OTHER_HOST,
    BLOCKED_EXTENSION,
    PATH_NOT_ALLOWED;

    public boolean isAdmitted() { return this == ADMITTED; }
}
