package com.webchunker.core.model;

import com.webchunker.core.util.UrlUtils;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 크롤 설정 (crawl.yml 매핑 대상). 순수 설정 보관용.
 * 하위 섹션(policy/segmenter/fetch/organization)은 YAML 구조와 1:1로 대응한다.
 */
public final class CrawlConfig {

    /** 블록 확장자 기본값(문서/이미지/압축) */
    public static final List<String> DEFAULT_BLOCKED_EXTENSIONS =
            List.of("pdf", "jpg", "jpeg", "png", "gif", "zip", "doc", "docx", "xls", "xlsx");

    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (WebChunker/1.0)";

    /** 표(table) 청크를 어느 시점의 계층 컨텍스트로 귀속시킬지 */
    public enum TableAttribution {
        /** 본문 선형 패스 이후 처리 → 페이지의 마지막 heading 컨텍스트 사용 (기존 동작) */
        AFTER_CONTENT,
        /** 문서 순서대로 처리 → 표가 실제로 위치한 지점의 컨텍스트 사용 */
        DOCUMENT_ORDER
    }

    /** 링크 허용 정책: YAML `policy:` 섹션 */
    public static final class Policy {
        /** false면 seed host와 정확히 같은 host만 허용 (서브도메인 거부) */
        private boolean allowSubdomains = false;
        private List<String> blockedExtensions = DEFAULT_BLOCKED_EXTENSIONS;
        /** 비어 있으면 경로 키워드 검사 없음 */
        private List<String> allowedPathKeywords = List.of();

        public boolean isAllowSubdomains() { return allowSubdomains; }
        public Policy setAllowSubdomains(boolean v) { this.allowSubdomains = v; return this; }

        public List<String> getBlockedExtensions() { return blockedExtensions; }
        public Policy setBlockedExtensions(List<String> exts) {
            this.blockedExtensions = (exts == null) ? List.of() : normalizeExtensions(exts);
            return this;
        }

        public List<String> getAllowedPathKeywords() { return allowedPathKeywords; }
        public Policy setAllowedPathKeywords(List<String> keywords) {
            this.allowedPathKeywords = (keywords == null) ? List.of() : lowerAll(keywords);
            return this;
        }
    }

    /** 세그멘터 설정: YAML `segmenter:` 섹션 */
    public static final class Segmenter {
        private int minChunkLength = 20;
        /** div/span 같은 범용 컨테이너도 청크 후보로 볼지 (기본 false) */
        private boolean includeContainers = false;
        private TableAttribution tableAttribution = TableAttribution.AFTER_CONTENT;

        public int getMinChunkLength() { return minChunkLength; }
        public Segmenter setMinChunkLength(int v) { this.minChunkLength = v; return this; }

        public boolean isIncludeContainers() { return includeContainers; }
        public Segmenter setIncludeContainers(boolean v) { this.includeContainers = v; return this; }

        public TableAttribution getTableAttribution() { return tableAttribution; }
        public Segmenter setTableAttribution(TableAttribution v) {
            this.tableAttribution = (v != null ? v : TableAttribution.AFTER_CONTENT);
            return this;
        }
    }

    /** 조직명 추출 설정: label(고정값)이 marker(부분 문자열 탐색)보다 우선 */
    public static final class Organization {
        private String label;
        private String marker;

        public String getLabel() { return label; }
        public Organization setLabel(String label) { this.label = blankToNull(label); return this; }

        public String getMarker() { return marker; }
        public Organization setMarker(String marker) { this.marker = blankToNull(marker); return this; }
    }

    // ---------- 기본 필드 ----------
    private String target;                 // 시작 URL
    private int maxDepth = 1;
    private int maxPages = 0;              // 0 이하 = 무제한
    private String documentType = "web_page";

    private Duration timeout = Duration.ofSeconds(15);
    private String userAgent = DEFAULT_USER_AGENT;
    private boolean followRedirects = true;

    private Path outputDir = Path.of("out");
    private Set<String> outputFormats = new LinkedHashSet<>(List.of("txt"));

    private Policy policy = new Policy();
    private Segmenter segmenter = new Segmenter();
    private Organization organization = new Organization();

    // ---------- getters ----------
    public String getTarget() { return target; }
    public int getMaxDepth() { return maxDepth; }
    public int getMaxPages() { return maxPages; }
    public boolean hasPageCap() { return maxPages > 0; }
    public String getDocumentType() { return documentType; }
    public Duration getTimeout() { return timeout; }
    public String getUserAgent() { return userAgent; }
    public boolean isFollowRedirects() { return followRedirects; }
    public Path getOutputDir() { return outputDir; }
    public Set<String> getOutputFormats() { return outputFormats; }
    public Policy getPolicy() { return policy; }
    public Segmenter getSegmenter() { return segmenter; }
    public Organization getOrganization() { return organization; }

    // ---------- fluent setters ----------
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public CrawlConfig setDocumentType(String documentType) { this.documentType = documentType; return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }

    /** "txt", "json" (대소문자 무시). null/빈 값이면 txt만 */
    public CrawlConfig setOutputFormats(List<String> formats) {
        Set<String> out = new LinkedHashSet<>();
        if (formats != null) {
            for (String f : formats) {
                if (f != null && !f.isBlank()) out.add(f.trim().toLowerCase(Locale.ROOT));
            }
        }
        if (out.isEmpty()) out.add("txt");
        this.outputFormats = out;
        return this;
    }

    public CrawlConfig setPolicy(Policy policy) { this.policy = (policy != null ? policy : new Policy()); return this; }
    public CrawlConfig setSegmenter(Segmenter s) { this.segmenter = (s != null ? s : new Segmenter()); return this; }
    public CrawlConfig setOrganization(Organization o) { this.organization = (o != null ? o : new Organization()); return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        if (target.isBlank()) throw new IllegalArgumentException("target must not be blank");
        if (!UrlUtils.isHttp(UrlUtils.parse(target)))
            throw new IllegalArgumentException("target is not an http(s) URL: " + target);
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        Objects.requireNonNull(userAgent, "userAgent");
        Objects.requireNonNull(documentType, "documentType");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(outputFormats, "outputFormats");
        for (String f : outputFormats) {
            if (!f.equals("txt") && !f.equals("json"))
                throw new IllegalArgumentException("output.formats: unsupported format '" + f + "'");
        }

        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(segmenter, "segmenter");
        Objects.requireNonNull(organization, "organization");
        if (segmenter.getMinChunkLength() < 1)
            throw new IllegalArgumentException("segmenter.minChunkLength must be >= 1");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    /** ".PDF" / "pdf" → "pdf" */
    private static List<String> normalizeExtensions(List<String> exts) {
        List<String> out = new ArrayList<>();
        for (String e : exts) {
            if (e == null || e.isBlank()) continue;
            String s = e.trim().toLowerCase(Locale.ROOT);
            if (s.startsWith(".")) s = s.substring(1);
            if (!s.isEmpty()) out.add(s);
        }
        return List.copyOf(out);
    }

    private static List<String> lowerAll(List<String> in) {
        List<String> out = new ArrayList<>();
        for (String s : in) {
            if (s != null && !s.isBlank()) out.add(s.trim().toLowerCase(Locale.ROOT));
        }
        return List.copyOf(out);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
