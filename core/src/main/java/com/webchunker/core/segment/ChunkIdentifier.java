package com.webchunker.core.segment;

/**
 * 청크 텍스트 → 고정 길이 식별자.
 * 결정적이어야 하며 입력은 텍스트뿐(URL/시각 등 메타데이터 금지):
 * 여러 페이지에 반복되는 동일 문구는 같은 ID로 모인다.
 */
@FunctionalInterface
public interface ChunkIdentifier {
    String identify(String text);

    ChunkIdentifier DEFAULT = new Sha256ChunkIdentifier();
}
