package com.webchunker.core.util;

import com.webchunker.core.model.CrawlConfig;
import com.webchunker.core.model.CrawlConfig.TableAttribution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @Test
    @DisplayName("전체 키 매핑")
    void fullDocument() throws IOException {
        CrawlConfig cfg = YamlConfigLoader.loadString(String.join("\n",
                "target: https://ex.com/governance",
                "documentType: governance_policy",
                "scope:",
                "  maxDepth: 2",
                "  maxPages: 25",
                "policy:",
                "  allowSubdomains: true",
                "  blockedExtensions: [.PDF, zip]",
                "  allowedPathKeywords: [/Governance, /ir]",
                "segmenter:",
                "  minChunkLength: 30",
                "  includeContainers: true",
                "  tableAttribution: document_order",
                "organization:",
                "  label: Halows Co., Ltd.",
                "fetch:",
                "  timeoutMs: 5000",
                "  userAgent: test-agent",
                "  followRedirects: false",
                "output:",
                "  dir: build/out",
                "  formats: txt, JSON"));

        assertThat(cfg.getTarget()).isEqualTo("https://ex.com/governance");
        assertThat(cfg.getDocumentType()).isEqualTo("governance_policy");
        assertThat(cfg.getMaxDepth()).isEqualTo(2);
        assertThat(cfg.getMaxPages()).isEqualTo(25);
        assertThat(cfg.getPolicy().isAllowSubdomains()).isTrue();
        assertThat(cfg.getPolicy().getBlockedExtensions()).containsExactly("pdf", "zip");
        assertThat(cfg.getPolicy().getAllowedPathKeywords()).containsExactly("/governance", "/ir");
        assertThat(cfg.getSegmenter().getMinChunkLength()).isEqualTo(30);
        assertThat(cfg.getSegmenter().isIncludeContainers()).isTrue();
        assertThat(cfg.getSegmenter().getTableAttribution()).isEqualTo(TableAttribution.DOCUMENT_ORDER);
        assertThat(cfg.getOrganization().getLabel()).isEqualTo("Halows Co., Ltd.");
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(cfg.getUserAgent()).isEqualTo("test-agent");
        assertThat(cfg.isFollowRedirects()).isFalse();
        assertThat(cfg.getOutputDir()).isEqualTo(Path.of("build/out"));
        assertThat(cfg.getOutputFormats()).containsExactly("txt", "json");
    }

    @Test
    @DisplayName("빈 문서 → 기본값")
    void emptyGivesDefaults() throws IOException {
        CrawlConfig cfg = YamlConfigLoader.loadString("");
        assertThat(cfg.getTarget()).isNull();
        assertThat(cfg.getMaxDepth()).isEqualTo(1);
        assertThat(cfg.getSegmenter().getMinChunkLength()).isEqualTo(20);
        assertThat(cfg.getDocumentType()).isEqualTo("web_page");
        assertThat(cfg.getOutputFormats()).containsExactly("txt");
    }

    @Test
    void badValues() {
        assertThatThrownBy(() -> YamlConfigLoader.loadString("scope:\n  maxDepth: deep\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDepth");
        assertThatThrownBy(() -> YamlConfigLoader.loadString("segmenter:\n  tableAttribution: sideways\n"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> YamlConfigLoader.loadString("target: [unclosed"))
                .isInstanceOf(IOException.class);
    }

    @Test
    void fileLoading(@TempDir Path dir) throws IOException {
        Path yml = dir.resolve("crawl.yml");
        Files.writeString(yml, "target: https://ex.com/\nscope:\n  maxDepth: 0\n");
        assertThat(YamlConfigLoader.load(yml).getMaxDepth()).isZero();

        assertThatThrownBy(() -> YamlConfigLoader.load(dir.resolve("missing.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }
}
