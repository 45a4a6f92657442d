// PageFetcher.java
package com.webchunker.core.api;

import org.jsoup.nodes.Document;

import java.net.URI;

/** 페이지 1건을 가져와 파싱하는 전략 인터페이스. */
@FunctionalInterface
public interface PageFetcher {
    /**
     * 단일 GET 후 파싱된 문서를 반환.
     * 비성공 상태/전송 오류는 FetchException. 호출자(크롤러)가 건너뛰고 계속 진행.
     */
    Document fetch(URI url) throws FetchException;
}
