package com.webchunker.core.crawler;

import org.jsoup.nodes.Document;
import org.jsoup.select.Elements;

/**
 * 본문이 아닌 노드(스크립트/스타일/noscript/iframe/svg) 제거.
 * 세그먼트·링크 추출 전에 1회 적용. 두 번 적용해도 결과 동일.
 */
public final class NoiseFilter {
    private NoiseFilter() {}

    public static final String NOISE_SELECTOR = "script, style, noscript, iframe, svg";

    /** @return 제거된 노드 수 */
    public static int strip(Document doc) {
        if (doc == null) return 0;
        Elements noise = doc.select(NOISE_SELECTOR);
        int n = noise.size();
        noise.remove();
        return n;
    }
}
