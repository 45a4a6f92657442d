package com.webchunker.core.crawler;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.webchunker.core.model.Chunk;
import com.webchunker.core.model.CrawlConfig;
import com.webchunker.core.model.CrawlResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Crawler + JsoupPageFetcher: 로컬 HTTP 서버 대상 end-to-end")
class CrawlerHttpIntegrationTest {

    private HttpServer server;
    private String base;

    private static final Map<String, String> PAGES = Map.of(
            "/", "<html><head><title>Governance</title><script>var x = 'not content at all';</script></head><body>"
                    + "<h2>Article 5</h2><p>The board meets at least four times a year.</p>"
                    + "<a href=\"/ethics\">ethics</a><a href=\"/gone\">gone</a><a href=\"/annual.pdf\">pdf</a>"
                    + "<footer>Example Co., Ltd. All rights reserved.</footer></body></html>",
            "/ethics", "<html><head><title>Ethics</title></head><body>"
                    + "<h1>Code of Conduct</h1><li>Employees must report conflicts of interest.</li>"
                    + "</body></html>");

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private void handle(HttpExchange ex) throws IOException {
        String path = ex.getRequestURI().getPath();
        String html = PAGES.get(path);
        byte[] body = (html == null ? "not found" : html).getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", html == null ? "text/plain" : "text/html; charset=utf-8");
        ex.sendResponseHeaders(html == null ? 404 : 200, body.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(body);
        }
    }

    @Test
    @DisplayName("2페이지 사이트: 404는 건너뛰고, pdf는 요청하지 않으며, 스크립트 텍스트는 제외")
    void twoPageSite() {
        var cfg = CrawlConfig.defaults()
                .setTarget(base + "/")
                .setMaxDepth(1)
                .setTimeoutMs(5_000);
        cfg.getOrganization().setMarker("Co., Ltd");

        CrawlResult r = new Crawler(cfg).crawl();

        assertThat(r.getChunks()).extracting(Chunk::getText).containsExactly(
                "The board meets at least four times a year.",
                "Employees must report conflicts of interest.");
        assertThat(r.getChunks()).noneMatch(c -> c.getText().contains("not content"));

        Chunk first = r.getChunks().get(0);
        assertThat(first.getDocumentTitle()).isEqualTo("Governance");
        assertThat(first.getArticle()).isEqualTo("Article 5");
        assertThat(first.getSectionLevel()).isEqualTo(2);
        assertThat(first.getOrganization()).isEqualTo("Example Co., Ltd. All rights reserved.");

        Chunk second = r.getChunks().get(1);
        assertThat(second.getContentType()).isEqualTo("li");
        assertThat(second.getSectionTitle()).isEqualTo("Code of Conduct");
        assertThat(second.getArticle()).isNull();

        assertThat(r.getFailed()).containsExactly(URI.create(base + "/gone"));
        assertThat(r.getVisited()).doesNotContain(URI.create(base + "/annual.pdf"));
    }
}
