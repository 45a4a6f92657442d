package com.webchunker.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("App: 종료 코드와 프롬프트")
class AppTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        return App.run(args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                false);
    }

    @Test
    void helpExitsZero() {
        assertThat(run("", "--help")).isEqualTo(App.EXIT_OK);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("usage:");
    }

    @Test
    @DisplayName("seed 없이 실행 → 프롬프트, 빈 입력이면 사용법 오류(2)")
    void promptsWhenNoSeed(@TempDir Path tmp) throws Exception {
        Path yml = tmp.resolve("empty.yml");
        Files.writeString(yml, "output:\n  dir: " + tmp.toString().replace('\\', '/') + "\n");

        int code = run("\n", "--config", yml.toString());

        assertThat(code).isEqualTo(App.EXIT_USAGE);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains(App.PROMPT);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("no URL given");
    }

    @Test
    void badOptionsExitTwo() {
        assertThat(run("", "--depth", "x", "https://ex.com/")).isEqualTo(App.EXIT_USAGE);
        assertThat(run("", "--format", "pdf", "https://ex.com/")).isEqualTo(App.EXIT_USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("unsupported format");
    }

    @Test
    void missingConfigFileExitTwo(@TempDir Path tmp) {
        assertThat(run("", "--config", tmp.resolve("nope.yml").toString(), "https://ex.com/"))
                .isEqualTo(App.EXIT_USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("not found");
    }

    @Test
    void loadConfigReadsGivenFile(@TempDir Path tmp) throws Exception {
        Path yml = tmp.resolve("c.yml");
        Files.writeString(yml, "scope:\n  maxDepth: 4\n");
        assertThat(App.loadConfig(yml).getMaxDepth()).isEqualTo(4);
    }

    @Test
    @DisplayName("scheme 없는 seed → 사용법 오류(2), 크롤 시작 전 거부")
    void seedWithoutSchemeExitTwo(@TempDir Path tmp) {
        assertThat(run("", "--out", tmp.toString(), "example.com")).isEqualTo(App.EXIT_USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8))
                .contains("not an http(s) URL: example.com")
                .contains("usage:");
    }
}
