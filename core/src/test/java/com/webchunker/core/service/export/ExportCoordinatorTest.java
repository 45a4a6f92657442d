package com.webchunker.core.service.export;

import com.webchunker.core.model.CrawlResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.webchunker.core.service.export.ReportFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExportCoordinatorTest {

    @Test
    void exportsEachRequestedFormatInOrder(@TempDir Path tmp) throws Exception {
        var formats = new LinkedHashSet<>(List.of("json", "txt"));
        List<Path> out = new ExportCoordinator().exportAll(tmp, result(List.of(paragraph())), formats);

        assertThat(out).hasSize(2);
        assertThat(out.get(0).toString()).endsWith(".json");
        assertThat(out.get(1).toString()).endsWith(".txt");
        assertThat(out).allMatch(Files::exists);
    }

    @Test
    void unknownFormatRejected(@TempDir Path tmp) {
        assertThatThrownBy(() -> new ExportCoordinator().exportAll(tmp, result(List.of()), Set.of("pdf")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pdf");
    }

    @Test
    void customExporterCanBeRegistered(@TempDir Path tmp) throws Exception {
        ReportExporter csv = new ReportExporter() {
            @Override public String format() { return "csv"; }
            @Override public Path export(Path baseDir, CrawlResult result) throws java.io.IOException {
                return Files.writeString(baseDir.resolve("x.csv"), "id\n");
            }
        };
        List<Path> out = new ExportCoordinator().register(csv).exportAll(tmp, result(List.of()), Set.of("csv"));
        assertThat(out).containsExactly(tmp.resolve("x.csv"));
    }
}
