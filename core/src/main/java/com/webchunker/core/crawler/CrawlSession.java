package com.webchunker.core.crawler;

import com.webchunker.core.model.Admission;
import com.webchunker.core.model.Chunk;
import com.webchunker.core.model.CrawlResult;
import com.webchunker.core.model.CrawlStats;
import com.webchunker.core.model.FrontierEntry;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 크롤 1회분 상태: 방문 집합(단조 증가), FIFO 프런티어, 누적 청크, 통계.
 * crawl() 호출마다 새로 만들어지고 그 호출 안에서만 쓰인다(스레드 세이프 아님).
 */
public final class CrawlSession {

    private final URI seed;
    private final int maxDepth;
    private final LinkPolicy policy;
    private final Instant startedAt;

    private final Set<URI> visited = new LinkedHashSet<>();
    private final List<URI> failed = new ArrayList<>();
    private final Deque<FrontierEntry> frontier = new ArrayDeque<>();
    private final List<Chunk> chunks = new ArrayList<>();
    private final CrawlStats stats = new CrawlStats();

    CrawlSession(URI seed, int maxDepth, LinkPolicy policy, Instant startedAt) {
        this.seed = Objects.requireNonNull(seed, "seed");
        this.maxDepth = maxDepth;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        frontier.addLast(new FrontierEntry(seed, 0));
    }

    boolean hasNext() { return !frontier.isEmpty(); }

    FrontierEntry next() { return frontier.pollFirst(); }

    /** 방문 여부 확인 + 깊이 초과 여부 → 버려야 하면 true */
    boolean shouldDiscard(FrontierEntry e) {
        return visited.contains(e.uri()) || e.depth() > maxDepth;
    }

    void markVisited(URI u) { visited.add(u); }

    void markFailed(URI u) {
        failed.add(u);
        stats.pageFailed();
    }

    void addChunks(Collection<Chunk> page) {
        for (Chunk c : page) {
            chunks.add(c);
            stats.chunkEmitted(c);
        }
        stats.pageFetched();
    }

    /**
     * 후보 링크에 정책 적용 후, 아직 방문하지 않은 것만 depth+1로 큐에 넣는다.
     * 같은 URL이 큐에 여러 번 들어가도 꺼낼 때 방문 집합으로 걸러진다.
     * @return 큐에 넣은 수
     */
    int offerLinks(FrontierEntry from, Collection<URI> candidates) {
        int queued = 0;
        for (URI u : candidates) {
            Admission a = policy.judge(u);
            stats.linkJudged(a);
            if (!a.isAdmitted() || visited.contains(u)) continue;
            frontier.addLast(from.child(u));
            queued++;
        }
        return queued;
    }

    /** seed가 정책에 걸리면 fetch 없이 프런티어를 비운다 */
    void rejectSeed(Admission reason) {
        frontier.clear();
        stats.linkJudged(reason);
    }

    CrawlStats stats() { return stats; }

    CrawlResult finish(Instant finishedAt) {
        return new CrawlResult(seed, maxDepth, chunks, new ArrayList<>(visited), failed,
                stats.snapshot(), startedAt, finishedAt);
    }

    public URI getSeed() { return seed; }
    public int getMaxDepth() { return maxDepth; }
    public int visitedCount() { return visited.size(); }
    public int queuedCount() { return frontier.size(); }
    public int chunkCount() { return chunks.size(); }
}
