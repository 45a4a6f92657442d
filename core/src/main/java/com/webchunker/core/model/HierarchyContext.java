package com.webchunker.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * 페이지 내 현재 위치의 계층 컨텍스트(섹션/챕터/조항) 불변 스냅샷.
 * 세그멘터는 이 값을 인자/반환값으로 넘기며 갱신한다. 페이지가 바뀌면 EMPTY에서 다시 시작.
 * 중첩 스택 없이 "가장 최근 heading 우선" 모델.
 */
public final class HierarchyContext {

    public static final HierarchyContext EMPTY = new HierarchyContext(null, null, null, null);

    private final String sectionTitle;
    private final Integer sectionLevel;
    private final String chapter;
    private final String article;

    private HierarchyContext(String sectionTitle, Integer sectionLevel, String chapter, String article) {
        this.sectionTitle = sectionTitle;
        this.sectionLevel = sectionLevel;
        this.chapter = chapter;
        this.article = article;
    }

    public static HierarchyContext of(String sectionTitle, Integer sectionLevel, String chapter, String article) {
        if (sectionTitle == null && sectionLevel == null && chapter == null && article == null) return EMPTY;
        return new HierarchyContext(sectionTitle, sectionLevel, chapter, article);
    }

    /**
     * heading 하나를 반영한 새 스냅샷.
     * 섹션은 항상 교체, "chapter"/"article"로 시작하면(대소문자 무시) 해당 라벨도 교체.
     */
    public HierarchyContext withHeading(int level, String text) {
        Objects.requireNonNull(text, "text");
        if (level < 1) throw new IllegalArgumentException("heading level must be >= 1");
        String lower = text.toLowerCase(Locale.ROOT);
        String nextChapter = lower.startsWith("chapter") ? text : chapter;
        String nextArticle = lower.startsWith("article") ? text : article;
        return new HierarchyContext(text, level, nextChapter, nextArticle);
    }

    public String getSectionTitle() { return sectionTitle; }
    public Integer getSectionLevel() { return sectionLevel; }
    public String getChapter() { return chapter; }
    public String getArticle() { return article; }

    public boolean isEmpty() { return this == EMPTY; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HierarchyContext)) return false;
        HierarchyContext that = (HierarchyContext) o;
        return Objects.equals(sectionTitle, that.sectionTitle)
                && Objects.equals(sectionLevel, that.sectionLevel)
                && Objects.equals(chapter, that.chapter)
                && Objects.equals(article, that.article);
    }

    @Override
    public int hashCode() { return Objects.hash(sectionTitle, sectionLevel, chapter, article); }

    @Override
    public String toString() {
        return "HierarchyContext{section=" + sectionTitle + ", level=" + sectionLevel
                + ", chapter=" + chapter + ", article=" + article + "}";
    }
}
