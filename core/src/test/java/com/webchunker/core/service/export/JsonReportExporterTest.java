package com.webchunker.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.webchunker.core.service.export.ReportFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class JsonReportExporterTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void snakeCaseKeysAndIsoTimestamps() throws Exception {
        JsonNode root = om.readTree(new JsonReportExporter().toJson(result(List.of(paragraph(), table()))));

        JsonNode meta = root.get("meta");
        assertThat(meta.get("report_version").asText()).isEqualTo("1");
        assertThat(meta.get("seed").asText()).isEqualTo("https://ex.com/governance");
        assertThat(meta.get("chunk_count").asInt()).isEqualTo(2);
        assertThat(meta.get("started_at").asText()).isEqualTo("2024-05-01T09:00:00Z");

        JsonNode first = root.get("chunks").get(0);
        assertThat(first.get("chunk_id").asText()).isEqualTo("0123456789abcdef");
        assertThat(first.get("section_level").asInt()).isEqualTo(3);
        assertThat(first.get("char_count").asInt()).isEqualTo(43);
        assertThat(first.get("chapter").isNull()).isTrue();
        assertThat(first.get("extracted_at").asText()).isEqualTo("2024-05-01T09:00:00Z");

        JsonNode second = root.get("chunks").get(1);
        assertThat(second.get("content_type").asText()).isEqualTo("table");
        assertThat(second.get("text").asText()).isEqualTo("A | B\n1 | 2");
    }

    @Test
    void exportWritesJsonNextToText(@TempDir Path tmp) throws Exception {
        var r = result(List.of(paragraph()));
        Path json = new JsonReportExporter().export(tmp, r);
        Path txt = new TextReportExporter().export(tmp, r);

        assertThat(json.getFileName().toString()).endsWith(".json");
        assertThat(json.getParent()).isEqualTo(txt.getParent());
        assertThat(om.readTree(Files.readString(json)).get("chunks")).hasSize(1);
    }
}
