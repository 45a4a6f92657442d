package com.webchunker.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 크롤 1회분 텔레메트리 누적기.
 * CrawlSession 소유 → 단일 스레드에서만 갱신되므로 동기화하지 않는다.
 */
public final class CrawlStats {
    private long pagesFetched;
    private long pagesFailed;
    private long linksAdmitted;
    private long chunksEmitted;
    private long tableChunks;
    private long shortTextsDropped;
    private final EnumMap<Admission, Long> rejected = new EnumMap<>(Admission.class);

    public void pageFetched() { pagesFetched++; }
    public void pageFailed() { pagesFailed++; }

    public void linkJudged(Admission a) {
        if (a.isAdmitted()) linksAdmitted++;
        else rejected.merge(a, 1L, Long::sum);
    }

    public void chunkEmitted(Chunk c) {
        chunksEmitted++;
        if (c.isTable()) tableChunks++;
    }

    public void shortTextsDropped(int n) { shortTextsDropped += n; }

    public Snapshot snapshot() {
        return new Snapshot(pagesFetched, pagesFailed, linksAdmitted, chunksEmitted,
                tableChunks, shortTextsDropped, new EnumMap<>(rejected));
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long pagesFetched;
        public final long pagesFailed;
        public final long linksAdmitted;
        public final long chunksEmitted;
        public final long tableChunks;
        public final long shortTextsDropped;
        public final Map<Admission, Long> linksRejected;

        Snapshot(long fetched, long failed, long admitted, long chunks, long tables,
                 long dropped, EnumMap<Admission, Long> rejected) {
            this.pagesFetched = fetched;
            this.pagesFailed = failed;
            this.linksAdmitted = admitted;
            this.chunksEmitted = chunks;
            this.tableChunks = tables;
            this.shortTextsDropped = dropped;
            this.linksRejected = Collections.unmodifiableMap(rejected);
        }

        public long rejected(Admission reason) { return linksRejected.getOrDefault(reason, 0L); }

        public long linksRejectedTotal() {
            long sum = 0;
            for (long v : linksRejected.values()) sum += v;
            return sum;
        }
    }
}
