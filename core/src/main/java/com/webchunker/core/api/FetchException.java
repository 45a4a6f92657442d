package com.webchunker.core.api;

import java.net.URI;

/** 페이지 fetch 실패(타임아웃, 연결 오류, 비성공 상태, HTML 아님). 크롤 전체에는 치명적이지 않음. */
public class FetchException extends Exception {
    private final URI url;
    private final int statusCode;

    public FetchException(URI url, String message, Throwable cause) {
        this(url, -1, message, cause);
    }

    public FetchException(URI url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    public URI getUrl() { return url; }

    /** HTTP 상태 코드. 전송 단계 실패처럼 모르면 -1 */
    public int getStatusCode() { return statusCode; }
}
