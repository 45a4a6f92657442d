package com.webchunker.core.crawler;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupLinkExtractorTest {

    @Test
    void resolvesNormalizesAndDedupsInDocumentOrder() {
        var doc = Jsoup.parse("<a href=\"b\">b</a><a href=\"/a#frag\">a</a><a href=\"HTTPS://EX.COM:443/a\">a2</a>"
                + "<a href=\"javascript:void(0)\">js</a><a href=\"mailto:x@ex.com\">mail</a>"
                + "<a name=\"anchor\">no href</a>", "https://ex.com/dir/page");

        assertThat(new JsoupLinkExtractor().extract(doc)).containsExactly(
                URI.create("https://ex.com/dir/b"),
                URI.create("https://ex.com/a"));
    }
}
