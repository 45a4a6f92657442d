package com.webchunker.core.service.export;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ReportNamingTest {

    @Test
    void hostAndSlug() {
        assertThat(ReportNaming.hostOf(URI.create("https://WWW.Ex.com/a"))).isEqualTo("www.ex.com");
        assertThat(ReportNaming.hostOf(null)).isEqualTo("unknown-host");
        assertThat(ReportNaming.slugOf(URI.create("https://ex.com/ir/governance?lang=en")))
                .isEqualTo("ex.com-ir-governance-lang-en");
        assertThat(ReportNaming.slugOf(URI.create("https://ex.com/" + "x".repeat(100)))).hasSizeLessThanOrEqualTo(60);
    }

    @Test
    void pathLayout() {
        Instant t = Instant.parse("2024-05-01T09:00:00Z");
        var ctx = ReportNaming.context(Path.of("out"), URI.create("https://ex.com/"), t);
        Path p = ReportNaming.pathFor(ctx, "txt");
        assertThat(p).isEqualTo(Path.of("out", "reports", "ex.com", "chunks-ex.com-" + ReportNaming.TS_FMT.format(t) + ".txt"));
    }
}
