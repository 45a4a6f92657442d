package com.webchunker.app.cli;

import com.webchunker.core.model.CrawlConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 명령행 인자:
 * <pre>
 *   [--config crawl.yml] [--depth N] [--max-pages N] [--out DIR] [--format txt,json] [seedUrl]
 * </pre>
 * 지정된 값만 CrawlConfig 위에 덮어쓴다(YAML &lt; CLI).
 */
public final class CliOptions {

    public static final String USAGE =
            "usage: webchunker [--config crawl.yml] [--depth N] [--max-pages N] [--out DIR] [--format txt,json] [seedUrl]";

    private Path configFile;
    private Integer depth;
    private Integer maxPages;
    private Path outDir;
    private List<String> formats;
    private String seedUrl;
    private boolean help;

    private CliOptions() {}

    /** @throws IllegalArgumentException 알 수 없는 옵션/값 누락/숫자 아님 */
    public static CliOptions parse(String... args) {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-h", "--help" -> o.help = true;
                case "-c", "--config" -> o.configFile = Path.of(value(args, ++i, a));
                case "-d", "--depth" -> o.depth = intValue(args, ++i, a);
                case "--max-pages" -> o.maxPages = intValue(args, ++i, a);
                case "-o", "--out" -> o.outDir = Path.of(value(args, ++i, a));
                case "-f", "--format" -> o.formats = Arrays.asList(value(args, ++i, a).split("\\s*,\\s*"));
                default -> {
                    if (a.startsWith("-")) throw new IllegalArgumentException("unknown option: " + a);
                    if (o.seedUrl != null) throw new IllegalArgumentException("only one seed URL allowed: " + a);
                    o.seedUrl = a.trim();
                }
            }
        }
        return o;
    }

    /** CLI 값 덮어쓰기. seed는 별도(프롬프트 가능성) */
    public CrawlConfig applyTo(CrawlConfig cfg) {
        if (depth != null) cfg.setMaxDepth(depth);
        if (maxPages != null) cfg.setMaxPages(maxPages);
        if (outDir != null) cfg.setOutputDir(outDir);
        if (formats != null) cfg.setOutputFormats(new ArrayList<>(formats));
        if (seedUrl != null) cfg.setTarget(seedUrl);
        return cfg;
    }

    private static String value(String[] args, int i, String opt) {
        if (i >= args.length) throw new IllegalArgumentException(opt + " requires a value");
        return args[i];
    }

    private static int intValue(String[] args, int i, String opt) {
        String v = value(args, i, opt);
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(opt + " expects an integer, got '" + v + "'", e);
        }
    }

    public Path getConfigFile() { return configFile; }
    public Integer getDepth() { return depth; }
    public Integer getMaxPages() { return maxPages; }
    public Path getOutDir() { return outDir; }
    public List<String> getFormats() { return formats; }
    public String getSeedUrl() { return seedUrl; }
    public boolean isHelp() { return help; }
}
