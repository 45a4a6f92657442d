package com.webchunker.core.model;

import java.net.URI;
import java.util.Objects;

/** 프런티어 대기 항목: (정규화된 URL, seed로부터의 hop 수) */
public record FrontierEntry(URI uri, int depth) {
    public FrontierEntry {
        Objects.requireNonNull(uri, "uri");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }

    public FrontierEntry child(URI next) { return new FrontierEntry(next, depth + 1); }
}
