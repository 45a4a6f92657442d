// ICrawler.java
package com.webchunker.core.api;

import com.webchunker.core.model.CrawlResult;

import java.net.URI;

/** 크롤러 최소 계약: seed에서 maxDepth hop까지 순회해 청크 목록을 돌려준다. */
public interface ICrawler extends AutoCloseable {
    CrawlResult crawl(URI seed, int maxDepth);
    @Override default void close() throws Exception {}
}
