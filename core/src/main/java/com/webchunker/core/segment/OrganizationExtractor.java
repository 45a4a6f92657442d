package com.webchunker.core.segment;

import com.webchunker.core.model.CrawlConfig;
import org.jsoup.nodes.Document;

/**
 * 페이지의 조직명 추출 전략. 못 찾으면 null.
 * 규칙(고정 라벨, 부분 문자열 탐색 등)은 엔진 밖에서 주입한다.
 */
@FunctionalInterface
public interface OrganizationExtractor {
    String extract(Document doc);

    OrganizationExtractor NONE = doc -> null;

    /** 페이지와 무관한 고정 라벨 */
    static OrganizationExtractor fixed(String label) {
        return doc -> label;
    }

    /** 설정 → 전략: label이 marker보다 우선, 둘 다 없으면 NONE */
    static OrganizationExtractor from(CrawlConfig.Organization cfg) {
        if (cfg == null) return NONE;
        if (cfg.getLabel() != null) return fixed(cfg.getLabel());
        if (cfg.getMarker() != null) return new MarkerOrganizationExtractor(cfg.getMarker());
        return NONE;
    }
}
