package com.webchunker.core.service.export;

import com.webchunker.core.model.Chunk;
import com.webchunker.core.model.CrawlResult;
import com.webchunker.core.model.CrawlStats;
import com.webchunker.core.model.HierarchyContext;

import java.net.URI;
import java.time.Instant;
import java.util.List;

final class ReportFixtures {
    private ReportFixtures() {}

    static final URI SEED = URI.create("https://ex.com/governance");
    static final Instant AT = Instant.parse("2024-05-01T09:00:00Z");

    static Chunk paragraph() {
        return Chunk.builder()
                .sourceUrl(SEED)
                .documentTitle("Governance")
                .organization("Halows Co., Ltd.")
                .documentType("governance_policy")
                .context(HierarchyContext.EMPTY.withHeading(3, "Article 5"))
                .contentType("p")
                .text("The board meets at least four times a year.")
                .chunkId("0123456789abcdef")
                .extractedAt(AT)
                .build();
    }

    static Chunk table() {
        return Chunk.builder()
                .sourceUrl(SEED)
                .documentTitle("Governance")
                .documentType("governance_policy")
                .contentType(Chunk.TABLE)
                .text("A | B\n1 | 2")
                .chunkId("fedcba9876543210")
                .extractedAt(AT)
                .build();
    }

    static CrawlResult result(List<Chunk> chunks) {
        CrawlStats stats = new CrawlStats();
        stats.pageFetched();
        chunks.forEach(stats::chunkEmitted);
        return new CrawlResult(SEED, 1, chunks, List.of(SEED), List.of(), stats.snapshot(), AT, AT.plusSeconds(3));
    }
}
