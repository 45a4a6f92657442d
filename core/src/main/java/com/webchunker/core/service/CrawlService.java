package com.webchunker.core.service;

import com.webchunker.core.crawler.CrawlListener;
import com.webchunker.core.crawler.Crawler;
import com.webchunker.core.model.CrawlConfig;
import com.webchunker.core.model.CrawlResult;
import com.webchunker.core.service.export.ExportCoordinator;
import com.webchunker.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 오케스트레이터:
 *  - 설정 검증 → crawl → 보고서 내보내기
 *  - 기본 구현체(Crawler/ExportCoordinator), DI 생성자는 테스트 주입용
 */
public final class CrawlService {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlService.class);

    private final CrawlConfig config;
    private final Crawler crawler;
    private final ExportCoordinator exports;

    /** 실행 결과: 크롤 결과 + 기록된 보고서 경로 */
    public record Outcome(CrawlResult result, List<Path> reports) {
        public int chunkCount() { return result.getChunks().size(); }
    }

    public CrawlService(CrawlConfig config) {
        this(config, new Crawler(validated(config)), new ExportCoordinator());
    }

    /** DI/테스트용 */
    public CrawlService(CrawlConfig config, Crawler crawler, ExportCoordinator exports) {
        this.config = validated(config);
        this.crawler = Objects.requireNonNull(crawler, "crawler");
        this.exports = Objects.requireNonNull(exports, "exports");
    }

    public Outcome run() throws IOException {
        return run(CrawlListener.NONE);
    }

    /** 빈 결과도 정상 종료: 보고서는 (빈 내용으로) 기록된다 */
    public Outcome run(CrawlListener listener) throws IOException {
        LOG.info("Run start: target={}, maxDepth={}, formats={}",
                config.getTarget(), config.getMaxDepth(), config.getOutputFormats());

        CrawlResult result = crawler.withListener(listener).crawl();
        List<Path> reports = exports.exportAll(config.getOutputDir(), result, config.getOutputFormats());

        SLOG.info("run-done",
                "target", config.getTarget(),
                "pages", result.getPageCount(),
                "chunks", result.getChunks().size(),
                "reports", reports.size());
        return new Outcome(result, reports);
    }

    public CrawlConfig getConfig() { return config; }

    private static CrawlConfig validated(CrawlConfig cfg) {
        Objects.requireNonNull(cfg, "config");
        cfg.validate();
        return cfg;
    }
}
