package com.webchunker.core.util;

import com.webchunker.core.model.CrawlConfig;
import com.webchunker.core.model.CrawlConfig.TableAttribution;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml을 읽어 CrawlConfig로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com/governance"
 * documentType: governance_policy
 * scope:
 *   maxDepth: 1
 *   maxPages: 25
 * policy:
 *   allowSubdomains: false
 *   blockedExtensions: [pdf, jpg, ...]
 *   allowedPathKeywords: ["/governance", "/ir"]
 * segmenter:
 *   minChunkLength: 20
 *   includeContainers: false
 *   tableAttribution: AFTER_CONTENT | DOCUMENT_ORDER
 * organization:
 *   label: "Halows Co., Ltd."      # 또는 marker: "Co., Ltd"
 * fetch:
 *   timeoutMs: 15000
 *   userAgent: "Mozilla/5.0 (WebChunker/1.0)"
 *   followRedirects: true
 * output:
 *   dir: "out"
 *   formats: [txt, json]
 *
 * target은 CLI 인자로 줄 수 있으므로 여기서는 validate()를 호출하지 않는다.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static final String DEFAULT_FILE = "crawl.yml";

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromRoot(parse(in, yamlPath.toString()));
        }
    }

    /** 테스트/임베드용: YAML 문자열에서 직접 로드 */
    public static CrawlConfig loadString(String yamlText) throws IOException {
        try (Reader r = new StringReader(yamlText == null ? "" : yamlText)) {
            return fromRoot(parse(r, "<string>"));
        }
    }

    private static Object parse(Object source, String name) throws IOException {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        try {
            return (source instanceof InputStream in) ? yaml.load(in) : yaml.load((Reader) source);
        } catch (YAMLException e) {
            throw new IOException("invalid YAML in " + name + ": " + e.getMessage(), e);
        }
    }

    private static CrawlConfig fromRoot(Object root) {
        CrawlConfig cfg = CrawlConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        // 1) 평면 키
        setString(map, "target", cfg::setTarget);
        setString(map, "documentType", cfg::setDocumentType);

        // 2) scope.*
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setInt(scope, "maxDepth", cfg::setMaxDepth);
            setInt(scope, "maxPages", cfg::setMaxPages);
        }

        // 3) policy.*
        Map<String, Object> policy = getMap(map, "policy");
        if (policy != null) {
            var p = cfg.getPolicy();
            setBoolean(policy, "allowSubdomains", p::setAllowSubdomains);
            setStringList(policy, "blockedExtensions", p::setBlockedExtensions);
            setStringList(policy, "allowedPathKeywords", p::setAllowedPathKeywords);
        }

        // 4) segmenter.*
        Map<String, Object> seg = getMap(map, "segmenter");
        if (seg != null) {
            var s = cfg.getSegmenter();
            setInt(seg, "minChunkLength", s::setMinChunkLength);
            setBoolean(seg, "includeContainers", s::setIncludeContainers);
            setEnum(seg, "tableAttribution", TableAttribution.class, s::setTableAttribution);
        }

        // 5) organization.*
        Map<String, Object> org = getMap(map, "organization");
        if (org != null) {
            var o = cfg.getOrganization();
            setString(org, "label", o::setLabel);
            setString(org, "marker", o::setMarker);
        }

        // 6) fetch.*
        Map<String, Object> fetch = getMap(map, "fetch");
        if (fetch != null) {
            setIntAsDurationMs(fetch, "timeoutMs", cfg::setTimeout);
            setString(fetch, "userAgent", cfg::setUserAgent);
            setBoolean(fetch, "followRedirects", cfg::setFollowRedirects);
        }

        // 7) output.*
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
            setStringList(output, "formats", cfg::setOutputFormats);
        }
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    /** YAML 리스트 또는 "a,b,c" 문자열. 빈 리스트도 그대로 전달(allow-list 끄기 용도) */
    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        if (!map.containsKey(key)) return;
        Object v = map.get(key);
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else if (v != null) {
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) {
            try {
                setter.accept(Integer.parseInt(String.valueOf(v).trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer: " + v, e);
            }
        }
    }

    private static void setIntAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms;
        try {
            ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException(key + ": unknown value '" + s + "', expected one of "
                + Arrays.toString(type.getEnumConstants()));
    }
}
