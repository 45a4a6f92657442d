package com.webchunker.core.crawler;

import com.webchunker.core.api.FetchException;
import com.webchunker.core.api.PageFetcher;
import com.webchunker.core.model.CrawlConfig;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.Objects;

/** 기본 JSoup 기반 fetcher: 단일 GET(재시도 없음) → Document */
public class JsoupPageFetcher implements PageFetcher {
    private final int timeoutMs;
    private final String userAgent;
    private final boolean followRedirects;

    public JsoupPageFetcher(CrawlConfig config) {
        this(config.getTimeoutMs(), config.getUserAgent(), config.isFollowRedirects());
    }

    public JsoupPageFetcher(long timeoutMs, String userAgent, boolean followRedirects) {
        // jsoup timeout은 int 필요 → 안전 캐스팅
        long clamped = Math.max(1, Math.min(Integer.MAX_VALUE, timeoutMs));
        this.timeoutMs = (int) clamped;
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.followRedirects = followRedirects;
    }

    @Override
    public Document fetch(URI url) throws FetchException {
        Objects.requireNonNull(url, "url");
        try {
            return Jsoup.connect(url.toString())
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .followRedirects(followRedirects)
                    .get();
        } catch (HttpStatusException e) {
            throw new FetchException(url, e.getStatusCode(), "HTTP " + e.getStatusCode(), e);
        } catch (UnsupportedMimeTypeException e) {
            throw new FetchException(url, "not HTML: " + e.getMimeType(), e);
        } catch (SocketTimeoutException e) {
            throw new FetchException(url, "timeout after " + timeoutMs + "ms", e);
        } catch (IOException e) {
            throw new FetchException(url, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            // jsoup: 잘못된 URL/프로토콜
            throw new FetchException(url, "malformed URL: " + e.getMessage(), e);
        }
    }

    public int getTimeoutMs() { return timeoutMs; }
    public String getUserAgent() { return userAgent; }
}
