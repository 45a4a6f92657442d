package com.webchunker.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HierarchyContextTest {

    @Test
    void headingsReplaceSectionAndMatchingLabelOnly() {
        var ctx = HierarchyContext.EMPTY
                .withHeading(1, "Chapter 1 General Provisions")
                .withHeading(2, "Article 1 (Purpose)")
                .withHeading(3, "Definitions");

        assertThat(ctx.getChapter()).isEqualTo("Chapter 1 General Provisions");
        assertThat(ctx.getArticle()).isEqualTo("Article 1 (Purpose)");
        assertThat(ctx.getSectionTitle()).isEqualTo("Definitions");
        assertThat(ctx.getSectionLevel()).isEqualTo(3);

        var next = ctx.withHeading(1, "chapter 2 board");
        assertThat(next.getChapter()).isEqualTo("chapter 2 board");
        // 새 장이 시작돼도 이전 조항 라벨은 다음 article heading 전까지 유지
        assertThat(next.getArticle()).isEqualTo("Article 1 (Purpose)");
    }

    @Test
    void immutableSnapshots() {
        var before = HierarchyContext.EMPTY;
        var after = before.withHeading(2, "Article 9");
        assertThat(before.isEmpty()).isTrue();
        assertThat(after).isNotEqualTo(before);
        assertThat(after).isEqualTo(HierarchyContext.of("Article 9", 2, null, "Article 9"));
    }

    @Test
    void ofAllNullIsEmpty() {
        assertThat(HierarchyContext.of(null, null, null, null)).isSameAs(HierarchyContext.EMPTY);
        assertThat(HierarchyContext.of(null, null, null, null).isEmpty()).isTrue();
        assertThat(HierarchyContext.of("Overview", 2, null, null).isEmpty()).isFalse();
        assertThatThrownBy(() -> HierarchyContext.EMPTY.withHeading(0, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
