package com.webchunker.core.service.export;

import com.webchunker.core.model.CrawlResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** 설정된 형식(txt/json)별 Exporter를 순서대로 실행 */
public final class ExportCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(ExportCoordinator.class);

    private final Map<String, ReportExporter> exporters = new LinkedHashMap<>();

    public ExportCoordinator() {
        register(new TextReportExporter());
        register(new JsonReportExporter());
    }

    /** 형식 키는 exporter.format() */
    public ExportCoordinator register(ReportExporter exporter) {
        exporters.put(exporter.format(), exporter);
        return this;
    }

    /** formats: 소문자 {"txt","json"}. 모르는 형식은 IllegalArgumentException */
    public List<Path> exportAll(Path baseDir, CrawlResult result, Set<String> formats) throws IOException {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(formats, "formats");

        List<Path> written = new ArrayList<>();
        for (String f : formats) {
            ReportExporter ex = exporters.get(f);
            if (ex == null) throw new IllegalArgumentException("unsupported output format: " + f);
            Path p = ex.export(baseDir, result);
            LOG.info("[Export] {} -> {}", f, p.toAbsolutePath());
            written.add(p);
        }
        return written;
    }
}
