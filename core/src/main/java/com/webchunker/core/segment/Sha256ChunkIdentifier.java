package com.webchunker.core.segment;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/** SHA-256(UTF-8) 소문자 hex의 앞 16자. */
public final class Sha256ChunkIdentifier implements ChunkIdentifier {

    public static final int ID_LENGTH = 16;

    @Override
    public String identify(String text) {
        Objects.requireNonNull(text, "text");
        byte[] digest = sha256().digest(text.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest).substring(0, ID_LENGTH);
    }

    // MessageDigest는 스레드 세이프가 아니므로 호출마다 새로 얻는다
    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // 모든 JRE에 필수 포함
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
