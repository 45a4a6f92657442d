package com.webchunker.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화 + host 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈 경로를 "/"로
     * 경로/쿼리 원문은 그대로 둔다(대소문자 구분 서버 고려).
     */
    public static URI normalize(URI u) {
        if (u == null) return null;
        if (u.getScheme() == null || u.getHost() == null) return stripFragment(u);

        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        String host = u.getHost().toLowerCase(Locale.ROOT);
        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) port = -1;

        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        String query = u.getRawQuery();

        StringBuilder sb = new StringBuilder(scheme).append("://");
        if (u.getRawUserInfo() != null) sb.append(u.getRawUserInfo()).append('@');
        sb.append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        if (query != null) sb.append('?').append(query);
        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            return stripFragment(u);
        }
    }

    /** 문자열 → 정규화 URI. 파싱 불가면 null */
    public static URI parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return normalize(new URI(raw.trim()));
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** "#" 이후 제거 */
    public static URI stripFragment(URI u) {
        if (u == null || u.getRawFragment() == null) return u;
        String s = u.toString();
        int i = s.indexOf('#');
        return URI.create(i >= 0 ? s.substring(0, i) : s);
    }

    public static String host(URI u) {
        return (u == null || u.getHost() == null) ? "" : u.getHost().toLowerCase(Locale.ROOT);
    }

    /** host 완전 일치(소문자 비교) */
    public static boolean sameHost(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = host(a);
        return !ha.isEmpty() && ha.equals(host(b));
    }

    /** candidate가 base host 자신이거나 그 서브도메인인지 */
    public static boolean sameHostOrSubdomain(URI base, URI candidate) {
        String hb = host(base);
        String hc = host(candidate);
        if (hb.isEmpty() || hc.isEmpty()) return false;
        return hc.equals(hb) || hc.endsWith("." + hb);
    }

    public static boolean isHttp(URI u) {
        if (u == null || u.getScheme() == null) return false;
        String s = u.getScheme();
        return s.equalsIgnoreCase("http") || s.equalsIgnoreCase("https");
    }
}
