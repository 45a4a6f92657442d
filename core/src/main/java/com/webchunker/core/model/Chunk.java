package com.webchunker.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;

/**
 * 추출된 텍스트 청크 1건 + 구조/출처 메타데이터. 생성 후 불변.
 * chunkId는 text만으로 계산된 값이어야 한다(메타데이터 무관).
 */
public final class Chunk {

    /** 표 청크의 contentType */
    public static final String TABLE = "table";

    private final URI sourceUrl;
    private final String documentTitle;
    private final String organization;
    private final String documentType;
    private final String sectionTitle;
    private final Integer sectionLevel;
    private final String chapter;
    private final String article;
    private final String contentType;
    private final String text;
    private final String chunkId;
    private final Instant extractedAt;

    private Chunk(Builder b) {
        this.sourceUrl = b.sourceUrl;
        this.documentTitle = b.documentTitle;
        this.organization = b.organization;
        this.documentType = b.documentType;
        this.sectionTitle = b.context.getSectionTitle();
        this.sectionLevel = b.context.getSectionLevel();
        this.chapter = b.context.getChapter();
        this.article = b.context.getArticle();
        this.contentType = b.contentType;
        this.text = b.text;
        this.chunkId = b.chunkId;
        this.extractedAt = b.extractedAt;
    }

    public URI getSourceUrl() { return sourceUrl; }
    public String getDocumentTitle() { return documentTitle; }
    /** 조직명. 추출 전략이 못 찾으면 null */
    public String getOrganization() { return organization; }
    public String getDocumentType() { return documentType; }
    public String getSectionTitle() { return sectionTitle; }
    /** heading 랭크 1~4, 첫 heading 전이면 null */
    public Integer getSectionLevel() { return sectionLevel; }
    public String getChapter() { return chapter; }
    public String getArticle() { return article; }
    public String getContentType() { return contentType; }
    public String getText() { return text; }
    public int getCharCount() { return text.length(); }
    public String getChunkId() { return chunkId; }
    public Instant getExtractedAt() { return extractedAt; }

    public boolean isTable() { return TABLE.equals(contentType); }

    /** 청크에 찍힌 계층 컨텍스트 스냅샷 */
    public HierarchyContext getContext() {
        return HierarchyContext.of(sectionTitle, sectionLevel, chapter, article);
    }

    @Override
    public String toString() {
        return "Chunk{" + chunkId + ", " + contentType + ", " + sourceUrl + ", chars=" + text.length() + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI sourceUrl;
        private String documentTitle;
        private String organization;
        private String documentType;
        private HierarchyContext context = HierarchyContext.EMPTY;
        private String contentType;
        private String text;
        private String chunkId;
        private Instant extractedAt;

        public Builder sourceUrl(URI sourceUrl) { this.sourceUrl = sourceUrl; return this; }
        public Builder documentTitle(String documentTitle) { this.documentTitle = documentTitle; return this; }
        public Builder organization(String organization) { this.organization = organization; return this; }
        public Builder documentType(String documentType) { this.documentType = documentType; return this; }
        public Builder context(HierarchyContext context) {
            this.context = (context != null ? context : HierarchyContext.EMPTY);
            return this;
        }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder chunkId(String chunkId) { this.chunkId = chunkId; return this; }
        public Builder extractedAt(Instant extractedAt) { this.extractedAt = extractedAt; return this; }

        public Chunk build() {
            Objects.requireNonNull(sourceUrl, "sourceUrl");
            Objects.requireNonNull(documentTitle, "documentTitle");
            Objects.requireNonNull(contentType, "contentType");
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(chunkId, "chunkId");
            Objects.requireNonNull(extractedAt, "extractedAt");
            return new Chunk(this);
        }
    }
}
