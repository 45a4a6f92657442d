package com.webchunker.core.service.export;

import com.webchunker.core.model.Chunk;
import com.webchunker.core.model.CrawlResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 사람이 읽는 텍스트 보고서.
 * <pre>
 * (빈 줄)
 * ================...(80)
 * CHUNK 1
 * ================...(80)
 * source_url: ...
 * ...
 * extracted_at: ...
 * (빈 줄)
 * CONTENT:
 * 본문
 * </pre>
 */
public class TextReportExporter implements ReportExporter {

    public static final String RULE = "=".repeat(80);

    @Override
    public String format() { return "txt"; }

    @Override
    public Path export(Path baseDir, CrawlResult result) throws IOException {
        var ctx = ReportNaming.context(baseDir, result.getSeed(), result.getStartedAt());
        Files.createDirectories(ReportNaming.reportsDir(ctx));
        Path outFile = ReportNaming.pathFor(ctx, format());
        write(outFile, result.getChunks());
        return outFile;
    }

    /** 경로를 직접 지정해 기록 (빈 목록이면 빈 파일) */
    public void write(Path file, List<Chunk> chunks) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            w.write(render(chunks));
        }
    }

    public static String render(List<Chunk> chunks) {
        StringBuilder sb = new StringBuilder(chunks.size() * 512);
        int i = 1;
        for (Chunk c : chunks) {
            sb.append('\n').append(RULE).append('\n')
              .append("CHUNK ").append(i++).append('\n')
              .append(RULE).append('\n');
            for (var e : metadata(c).entrySet()) {
                sb.append(e.getKey()).append(": ").append(e.getValue()).append('\n');
            }
            sb.append("\nCONTENT:\n")
              .append(c.getText()).append('\n');
        }
        return sb.toString();
    }

    /** text를 제외한 메타데이터, 출력 순서 고정 */
    static Map<String, Object> metadata(Chunk c) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("source_url", c.getSourceUrl());
        m.put("document_title", c.getDocumentTitle());
        m.put("organization", c.getOrganization());
        m.put("document_type", c.getDocumentType());
        m.put("section_title", c.getSectionTitle());
        m.put("section_level", c.getSectionLevel());
        m.put("chapter", c.getChapter());
        m.put("article", c.getArticle());
        m.put("content_type", c.getContentType());
        m.put("char_count", c.getCharCount());
        m.put("chunk_id", c.getChunkId());
        m.put("extracted_at", c.getExtractedAt());
        return m;
    }
}
