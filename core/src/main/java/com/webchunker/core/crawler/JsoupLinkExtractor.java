package com.webchunker.core.crawler;

import com.webchunker.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.Set;

/** 기본 JSoup 기반 링크 추출기: a[href] → abs:href, http/https만 */
public class JsoupLinkExtractor implements LinkExtractor {

    @Override
    public Set<URI> extract(Document doc) {
        Set<URI> out = new LinkedHashSet<>();
        if (doc == null) return out;

        for (Element a : doc.select("a[href]")) {
            // baseUri가 없으면 abs:href는 빈 문자열
            String abs = a.absUrl("href");
            if (abs.isBlank()) continue;
            URI u = UrlUtils.parse(abs);
            if (u == null || !UrlUtils.isHttp(u)) continue;
            out.add(u);
        }
        return out;
    }
}
