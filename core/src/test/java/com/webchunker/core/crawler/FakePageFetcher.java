package com.webchunker.core.crawler;

import com.webchunker.core.api.FetchException;
import com.webchunker.core.api.PageFetcher;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 네트워크 없이 URL → HTML 맵으로 응답하는 fetcher. 미등록 URL은 404 */
public final class FakePageFetcher implements PageFetcher {
    private final Map<String, String> pages = new LinkedHashMap<>();
    private final Map<String, Integer> failures = new LinkedHashMap<>();
    private final List<URI> requests = new ArrayList<>();

    public FakePageFetcher page(String url, String html) {
        pages.put(url, html);
        return this;
    }

    public FakePageFetcher fail(String url, int status) {
        failures.put(url, status);
        return this;
    }

    @Override
    public Document fetch(URI url) throws FetchException {
        requests.add(url);
        String key = url.toString();
        Integer status = failures.get(key);
        if (status != null) throw new FetchException(url, status, "HTTP " + status, null);
        String html = pages.get(key);
        if (html == null) throw new FetchException(url, 404, "HTTP 404", null);
        return Jsoup.parse(html, key);
    }

    /** fetch 호출 순서(중복 포함) */
    public List<URI> requests() { return requests; }

    public long requestCount(String url) {
        return requests.stream().filter(u -> u.toString().equals(url)).count();
    }
}
