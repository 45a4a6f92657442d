package com.webchunker.core.segment;

import java.util.regex.Pattern;

/** 화면 텍스트 정규화: NBSP 포함 연속 공백 → 공백 1개, 앞뒤 trim */
final class TextNormalizer {
    private TextNormalizer() {}

    private static final Pattern WS = Pattern.compile("[\\s\\u00A0]+");

    static String normalize(String s) {
        if (s == null || s.isEmpty()) return "";
        return WS.matcher(s).replaceAll(" ").trim();
    }
}
