package com.webchunker.core.segment;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class Sha256ChunkIdentifierTest {

    private final Sha256ChunkIdentifier id = new Sha256ChunkIdentifier();

    @Test
    void knownDigestPrefix() {
        // sha256("hello") = 2cf24dba5fb0a30e26e83b2ac5b9e29e...
        assertThat(id.identify("hello")).isEqualTo("2cf24dba5fb0a30e");
    }

    @Test
    void deterministicAndSixteenLowerHex() {
        String a = id.identify("같은 텍스트는 같은 ID");
        assertThat(a).isEqualTo(id.identify("같은 텍스트는 같은 ID"));
        assertThat(a).hasSize(Sha256ChunkIdentifier.ID_LENGTH).matches("[0-9a-f]{16}");
        assertThat(a).isNotEqualTo(id.identify("같은 텍스트는 같은 ID."));
    }
}
