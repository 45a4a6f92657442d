package com.webchunker.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** 크롤 1회의 결과: 순서가 보존된 청크/방문 목록 + 통계 */
public final class CrawlResult {
    private final URI seed;
    private final int maxDepth;
    private final List<Chunk> chunks;
    private final List<URI> visited;
    private final List<URI> failed;
    private final CrawlStats.Snapshot stats;
    private final Instant startedAt;
    private final Instant finishedAt;

    public CrawlResult(URI seed, int maxDepth, List<Chunk> chunks, List<URI> visited, List<URI> failed,
                       CrawlStats.Snapshot stats, Instant startedAt, Instant finishedAt) {
        this.seed = Objects.requireNonNull(seed, "seed");
        this.maxDepth = maxDepth;
        this.chunks = List.copyOf(chunks);
        this.visited = List.copyOf(visited);
        this.failed = List.copyOf(failed);
        this.stats = Objects.requireNonNull(stats, "stats");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.finishedAt = Objects.requireNonNull(finishedAt, "finishedAt");
    }

    public URI getSeed() { return seed; }
    public int getMaxDepth() { return maxDepth; }
    /** 방문(BFS) 순서 → 페이지 내 순서로 정렬된 청크 */
    public List<Chunk> getChunks() { return chunks; }
    /** 방문 처리된 URL (fetch 실패 포함), 방문 순서 */
    public List<URI> getVisited() { return visited; }
    public List<URI> getFailed() { return failed; }
    public CrawlStats.Snapshot getStats() { return stats; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }

    public int getPageCount() { return visited.size() - failed.size(); }
}
