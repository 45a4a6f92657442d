package com.webchunker.core.crawler;

import org.jsoup.nodes.Document;

import java.net.URI;
import java.util.Set;

/** 파싱된 페이지에서 절대 URL을 추출하는 전략 인터페이스. */
@FunctionalInterface
public interface LinkExtractor {
    /**
     * 문서 순서를 유지한 절대 URI 집합(중복 제거, fragment 제거)을 반환.
     * 허용 정책(도메인/확장자/경로)은 호출자가 적용.
     */
    Set<URI> extract(Document doc);
}
