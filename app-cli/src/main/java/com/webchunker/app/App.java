package com.webchunker.app;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.webchunker.app.cli.CliOptions;
import com.webchunker.app.logging.LogSetup;
import com.webchunker.core.model.CrawlConfig;
import com.webchunker.core.service.CrawlService;
import com.webchunker.core.util.YamlConfigLoader;

/**
 * 명령행 진입점.
 * 종료 코드: 0 정상 / 1 실행 실패(보고서 기록 등) / 2 사용법 오류
 */
public final class App {
    private static final Logger LOG = Logger.getLogger(App.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String PROMPT = "Enter the URL of the document to extract: ";

    private App() {}

    public static void main(String[] args) {
        // 전역 uncaught 핸들러
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "\n==== Uncaught: " + t.getName() + " ====", e));

        System.exit(run(args, System.in, System.out, System.err, true));
    }

    /** 테스트 가능 진입점. initLogging=false면 JUL 전역 설정을 건드리지 않는다 */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err, boolean initLogging) {
        CliOptions opts;
        CrawlConfig cfg;
        try {
            opts = CliOptions.parse(args);
            if (opts.isHelp()) {
                out.println(CliOptions.USAGE);
                return EXIT_OK;
            }
            cfg = opts.applyTo(loadConfig(opts.getConfigFile()));
            if (cfg.getTarget() == null || cfg.getTarget().isBlank()) {
                cfg.setTarget(prompt(in, out));
            }
            cfg.validate();
        } catch (IllegalArgumentException | NullPointerException e) {
            err.println("error: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (initLogging) {
            // 로그 초기화 (-Dwc.out.dir 없으면 output.dir)
            Path outRoot = Path.of(System.getProperty("wc.out.dir", cfg.getOutputDir().toString()));
            LogSetup.init(outRoot.resolve("logs"));
        }

        try {
            CrawlService.Outcome outcome = new CrawlService(cfg).run((entry, fetched, chunks, visited, queued) ->
                    out.printf("[%s] depth=%d %s chunks=%d (visited=%d, queued=%d)%n",
                            fetched ? "ok" : "skip", entry.depth(), entry.uri(), chunks, visited, queued));

            out.println();
            out.println("Extracted " + outcome.chunkCount() + " content chunks");
            for (Path p : outcome.reports()) {
                out.println("Report: " + p.toAbsolutePath());
            }
            return EXIT_OK;
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Report export failed", e);
            err.println("error: could not write report: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /** --config 우선, 없으면 작업 디렉터리의 crawl.yml, 그것도 없으면 기본값 */
    static CrawlConfig loadConfig(Path configFile) throws IOException {
        if (configFile != null) return YamlConfigLoader.load(configFile);
        Path def = Path.of(YamlConfigLoader.DEFAULT_FILE);
        if (Files.isRegularFile(def)) return YamlConfigLoader.load(def);
        return CrawlConfig.defaults();
    }

    private static String prompt(InputStream in, PrintStream out) throws IOException {
        out.print(PROMPT);
        out.flush();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line = reader.readLine();
        if (line == null || line.isBlank()) throw new IllegalArgumentException("no URL given");
        return line.trim();
    }
}
