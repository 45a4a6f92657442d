package com.webchunker.core.crawler;

import com.webchunker.core.model.FrontierEntry;

@FunctionalInterface
public interface CrawlListener {
    /**
     * 페이지 1건 처리 직후 호출 (크롤 스레드에서 동기 호출).
     * @param entry    처리한 (URL, depth)
     * @param fetched  false면 fetch 실패로 건너뜀
     * @param chunks   이 페이지에서 나온 청크 수
     * @param visited  지금까지 방문 처리한 URL 수
     * @param queued   프런티어 대기 수
     */
    void onPage(FrontierEntry entry, boolean fetched, int chunks, int visited, int queued);

    CrawlListener NONE = (e, f, c, v, q) -> {};
}
