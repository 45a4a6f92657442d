package com.webchunker.core.segment;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Objects;

/**
 * footer/address/p 중 marker 문자열(예: "Co., Ltd")을 포함한 첫 요소의 텍스트를 조직명으로 사용.
 */
public final class MarkerOrganizationExtractor implements OrganizationExtractor {

    public static final String DEFAULT_MARKER = "Co., Ltd";
    public static final String DEFAULT_SCOPE = "footer, address, p";

    private final String marker;
    private final String scopeSelector;

    public MarkerOrganizationExtractor(String marker) {
        this(marker, DEFAULT_SCOPE);
    }

    public MarkerOrganizationExtractor(String marker, String scopeSelector) {
        this.marker = Objects.requireNonNull(marker, "marker");
        this.scopeSelector = Objects.requireNonNull(scopeSelector, "scopeSelector");
    }

    @Override
    public String extract(Document doc) {
        if (doc == null) return null;
        for (Element el : doc.select(scopeSelector)) {
            String text = el.text();
            if (text.contains(marker)) return text.trim();
        }
        return null;
    }

    public String getMarker() { return marker; }
}
