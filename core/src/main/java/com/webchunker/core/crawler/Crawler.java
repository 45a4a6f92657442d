package com.webchunker.core.crawler;

import com.webchunker.core.api.FetchException;
import com.webchunker.core.api.ICrawler;
import com.webchunker.core.api.PageFetcher;
import com.webchunker.core.model.Admission;
import com.webchunker.core.model.CrawlConfig;
import com.webchunker.core.model.CrawlResult;
import com.webchunker.core.model.FrontierEntry;
import com.webchunker.core.segment.ContentSegmenter;
import com.webchunker.core.segment.ContentSegmenter.Segmentation;
import com.webchunker.core.util.StructuredLog;
import com.webchunker.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.util.Objects;

/**
 * BFS 기반 Crawler
 * - 명시적 FIFO 프런티어(재귀 없음), maxDepth / maxPages / 방문 집합으로 종료 보장
 * - 페이지마다: fetch → 노이즈 제거 → 세그먼트(+표) → 링크 추출/허용 판정 → 큐
 * - fetch 실패는 해당 URL만 건너뛰고 계속
 * - 상태는 crawl() 호출마다 새 CrawlSession에 보관 → 인스턴스 재사용/동시 호출 안전
 */
public class Crawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    private final CrawlConfig config;
    private final PageFetcher fetcher;
    private final LinkExtractor linkExtractor;
    private final ContentSegmenter segmenter;
    private final Clock clock;
    private volatile CrawlListener listener = CrawlListener.NONE;

    public Crawler(CrawlConfig config) {
        this(config, new JsoupPageFetcher(config));
    }

    public Crawler(CrawlConfig config, PageFetcher fetcher) {
        this(config, fetcher, new JsoupLinkExtractor(), new ContentSegmenter(config), Clock.systemUTC());
    }

    public Crawler(CrawlConfig config, PageFetcher fetcher, LinkExtractor linkExtractor,
                   ContentSegmenter segmenter, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.linkExtractor = Objects.requireNonNull(linkExtractor, "linkExtractor");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** 체이닝용: 페이지별 진행 콜백 */
    public Crawler withListener(CrawlListener l) {
        this.listener = (l != null ? l : CrawlListener.NONE);
        return this;
    }

    /** 설정의 target / maxDepth로 크롤 */
    public CrawlResult crawl() {
        URI seed = UrlUtils.parse(config.getTarget());
        if (seed == null || !UrlUtils.isHttp(seed))
            throw new IllegalArgumentException("target is not an http(s) URL: " + config.getTarget());
        return crawl(seed, config.getMaxDepth());
    }

    @Override
    public CrawlResult crawl(URI seedUri, int maxDepth) {
        Objects.requireNonNull(seedUri, "seed");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");

        URI seed = UrlUtils.normalize(seedUri);
        LinkPolicy policy = LinkPolicy.forSeed(seed, config.getPolicy());
        CrawlSession s = new CrawlSession(seed, maxDepth, policy, clock.instant());

        LOG.info("Crawl start: seed={}, maxDepth={}, maxPages={}", seed, maxDepth,
                config.hasPageCap() ? config.getMaxPages() : "unlimited");
        SLOG.info("crawl-start", "seed", seed, "maxDepth", maxDepth, "maxPages", config.getMaxPages());

        Admission seedVerdict = policy.judgeSeed(seed);
        if (!seedVerdict.isAdmitted()) {
            s.rejectSeed(seedVerdict);
            LOG.warn("Skipped (seed rejected: {}): {}", seedVerdict, seed);
            SLOG.warn("seed-rejected", "seed", seed, "reason", seedVerdict);
        }

        while (s.hasNext()) {
            FrontierEntry cur = s.next();
            if (s.shouldDiscard(cur)) continue;

            if (config.hasPageCap() && s.visitedCount() >= config.getMaxPages()) {
                LOG.info("Page cap reached ({}), {} entries left in frontier", config.getMaxPages(), s.queuedCount() + 1);
                break;
            }

            s.markVisited(cur.uri()); // fetch 전에 방문 처리 → 실패해도 재시도 없음
            visit(s, cur);
        }

        CrawlResult result = s.finish(clock.instant());
        var st = result.getStats();
        LOG.info("Crawl done. pages={}, failed={}, chunks={}, linksRejected={}",
                st.pagesFetched, st.pagesFailed, st.chunksEmitted, st.linksRejectedTotal());
        SLOG.info("crawl-done",
                "seed", seed,
                "pages", st.pagesFetched,
                "failed", st.pagesFailed,
                "chunks", st.chunksEmitted,
                "tables", st.tableChunks,
                "shortDropped", st.shortTextsDropped);
        return result;
    }

    private void visit(CrawlSession s, FrontierEntry cur) {
        LOG.debug("Fetching {} (depth {})", cur.uri(), cur.depth());

        Document doc;
        try {
            doc = fetcher.fetch(cur.uri());
        } catch (FetchException e) {
            s.markFailed(cur.uri());
            LOG.warn("Skipped (error): {} -> {}", cur.uri(), e.getMessage());
            SLOG.warn("page-failed", "url", cur.uri(), "depth", cur.depth(),
                    "status", e.getStatusCode(), "reason", e.getMessage());
            listener.onPage(cur, false, 0, s.visitedCount(), s.queuedCount());
            return;
        }

        NoiseFilter.strip(doc);

        Segmentation seg = segmenter.segment(doc, cur.uri(), clock.instant());
        s.addChunks(seg.chunks());
        s.stats().shortTextsDropped(seg.droppedShort());

        // maxDepth 페이지의 자식은 어차피 버려지므로 추출 생략
        int queued = 0;
        if (cur.depth() < s.getMaxDepth()) {
            queued = s.offerLinks(cur, linkExtractor.extract(doc));
        }

        SLOG.debug("page-fetched", "url", cur.uri(), "depth", cur.depth(),
                "chunks", seg.chunks().size(), "queued", queued);
        listener.onPage(cur, true, seg.chunks().size(), s.visitedCount(), s.queuedCount());
    }

    public CrawlConfig getConfig() { return config; }
}
