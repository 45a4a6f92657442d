package com.webchunker.core.service.export;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** 보고서 경로 규칙: {baseDir}/reports/{host}/chunks-{slug}-{yyyyMMdd-HHmm}.{ext} */
public final class ReportNaming {
    private ReportNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmm").withZone(ZoneId.systemDefault());

    public record ReportContext(Path baseDir, String host, String slug, Instant startedAt) {}

    public static ReportContext context(Path baseDir, URI seed, Instant startedAt) {
        Path out = (baseDir == null ? Paths.get("out") : baseDir);
        return new ReportContext(out, hostOf(seed), slugOf(seed), startedAt == null ? Instant.now() : startedAt);
    }

    public static Path reportsDir(ReportContext ctx) { return ctx.baseDir().resolve("reports").resolve(ctx.host()); }

    public static Path pathFor(ReportContext ctx, String ext) {
        return reportsDir(ctx).resolve(filePrefix(ctx) + "." + ext);
    }

    public static String filePrefix(ReportContext ctx) {
        return "chunks-" + ctx.slug() + "-" + TS_FMT.format(ctx.startedAt());
    }

    // ===== helpers =====
    static String hostOf(URI seed) {
        String h = (seed == null) ? null : seed.getHost();
        if (h == null || h.isBlank()) return "unknown-host";
        return h.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", "-");
    }

    static String slugOf(URI seed) {
        if (seed == null) return "no-url";
        String s = seed.toString().toLowerCase(Locale.ROOT).replaceFirst("^https?://", "");
        s = s.replaceAll("[^a-z0-9._/-]", "-").replace('/', '-').replaceAll("-{2,}", "-");
        if (s.length() > 60) s = s.substring(0, 60);
        s = s.replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "no-url" : s;
    }
}
