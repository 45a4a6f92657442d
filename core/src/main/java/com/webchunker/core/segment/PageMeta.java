package com.webchunker.core.segment;

import com.webchunker.core.model.Chunk;
import com.webchunker.core.model.HierarchyContext;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;

/** 한 페이지의 모든 청크에 공통으로 찍히는 메타데이터 */
public record PageMeta(URI url, String title, String organization, String documentType, Instant extractedAt) {

    public static final String UNKNOWN_TITLE = "Unknown";

    public PageMeta {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(documentType, "documentType");
        Objects.requireNonNull(extractedAt, "extractedAt");
    }

    Chunk toChunk(HierarchyContext ctx, String contentType, String text, String chunkId) {
        return Chunk.builder()
                .sourceUrl(url)
                .documentTitle(title)
                .organization(organization)
                .documentType(documentType)
                .context(ctx)
                .contentType(contentType)
                .text(text)
                .chunkId(chunkId)
                .extractedAt(extractedAt)
                .build();
    }
}
