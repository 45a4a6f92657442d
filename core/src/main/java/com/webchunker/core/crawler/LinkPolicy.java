package com.webchunker.core.crawler;

import com.webchunker.core.model.Admission;
import com.webchunker.core.model.CrawlConfig;
import com.webchunker.core.util.UrlUtils;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 후보 링크 허용 정책 (큐 넣기 직전 적용).
 * 판정 순서: scheme → host → 블록 확장자 → 경로 키워드(설정된 경우만)
 */
public final class LinkPolicy {

    private final URI base;
    private final boolean allowSubdomains;
    private final List<String> blockedSuffixes;   // ".pdf" 형태
    private final List<String> pathKeywords;

    public LinkPolicy(URI base, boolean allowSubdomains, List<String> blockedExtensions, List<String> pathKeywords) {
        this.base = Objects.requireNonNull(base, "base");
        this.allowSubdomains = allowSubdomains;
        this.blockedSuffixes = Objects.requireNonNull(blockedExtensions, "blockedExtensions").stream()
                .map(e -> "." + e.toLowerCase(Locale.ROOT))
                .toList();
        this.pathKeywords = Objects.requireNonNull(pathKeywords, "pathKeywords").stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
    }

    public static LinkPolicy forSeed(URI seed, CrawlConfig.Policy cfg) {
        return new LinkPolicy(seed, cfg.isAllowSubdomains(), cfg.getBlockedExtensions(), cfg.getAllowedPathKeywords());
    }

    public Admission judge(URI candidate) {
        if (!UrlUtils.isHttp(candidate)) return Admission.UNSUPPORTED_SCHEME;

        boolean hostOk = allowSubdomains
                ? UrlUtils.sameHostOrSubdomain(base, candidate)
                : UrlUtils.sameHost(base, candidate);
        if (!hostOk) return Admission.OTHER_HOST;

        if (hasBlockedExtension(candidate)) return Admission.BLOCKED_EXTENSION;

        String path = lowerPath(candidate);
        if (!pathKeywords.isEmpty()) {
            boolean hit = false;
            for (String k : pathKeywords) {
                if (path.contains(k)) { hit = true; break; }
            }
            if (!hit) return Admission.PATH_NOT_ALLOWED;
        }
        return Admission.ADMITTED;
    }

    public boolean allows(URI candidate) { return judge(candidate).isAdmitted(); }

    /**
     * seed 판정: scheme + 블록 확장자만.
     * host는 seed 자신이 기준이고, 경로 키워드는 seed에 적용하지 않는다.
     */
    public Admission judgeSeed(URI seed) {
        if (!UrlUtils.isHttp(seed)) return Admission.UNSUPPORTED_SCHEME;
        return hasBlockedExtension(seed) ? Admission.BLOCKED_EXTENSION : Admission.ADMITTED;
    }

    private boolean hasBlockedExtension(URI u) {
        String path = lowerPath(u);
        for (String suffix : blockedSuffixes) {
            if (path.endsWith(suffix)) return true;
        }
        return false;
    }

    private static String lowerPath(URI u) {
        return u.getPath() == null ? "" : u.getPath().toLowerCase(Locale.ROOT);
    }
}
