package com.webchunker.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.webchunker.core.model.Chunk;
import com.webchunker.core.model.CrawlResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * 인덱서 적재용 JSON 보고서.
 * - meta: seed/깊이/페이지 수/청크 수/시각
 * - chunks: 텍스트 보고서와 같은 키(snake_case) + text
 */
public class JsonReportExporter implements ReportExporter {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);   // ISO-8601

    @Override
    public String format() { return "json"; }

    @Override
    public Path export(Path baseDir, CrawlResult result) throws IOException {
        var ctx = ReportNaming.context(baseDir, result.getSeed(), result.getStartedAt());
        Files.createDirectories(ReportNaming.reportsDir(ctx));
        Path outFile = ReportNaming.pathFor(ctx, format());
        om.writerWithDefaultPrettyPrinter().writeValue(outFile.toFile(), toReport(result));
        return outFile;
    }

    public String toJson(CrawlResult result) throws IOException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(toReport(result));
    }

    static Report toReport(CrawlResult r) {
        var st = r.getStats();
        Meta meta = new Meta("1", r.getSeed().toString(), r.getMaxDepth(), r.getPageCount(),
                r.getFailed().size(), r.getChunks().size(), r.getStartedAt(), r.getFinishedAt(),
                st.linksRejectedTotal());
        List<Row> rows = r.getChunks().stream().map(JsonReportExporter::row).toList();
        return new Report(meta, rows);
    }

    private static Row row(Chunk c) {
        return new Row(c.getChunkId(), c.getSourceUrl().toString(), c.getDocumentTitle(), c.getOrganization(),
                c.getDocumentType(), c.getSectionTitle(), c.getSectionLevel(), c.getChapter(), c.getArticle(),
                c.getContentType(), c.getCharCount(), c.getExtractedAt(), c.getText());
    }

    // ---- 직렬화 전용 DTO (필드 순서 = 출력 순서) ----
    record Report(Meta meta, List<Row> chunks) {}

    record Meta(String reportVersion, String seed, int maxDepth, int pages, int failedPages, int chunkCount,
                Instant startedAt, Instant finishedAt, long linksRejected) {}

    record Row(String chunkId, String sourceUrl, String documentTitle, String organization, String documentType,
               String sectionTitle, Integer sectionLevel, String chapter, String article, String contentType,
               int charCount, Instant extractedAt, String text) {}
}
