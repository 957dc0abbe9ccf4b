package com.datasheetrag.ingest;

/**
 * A contiguous span {@code [start, end)} of a source text. {@link #text()} is the span
 * with surrounding whitespace trimmed, so it may be shorter than {@link #length()}.
 */
public record TextChunk(String text, int start, int end, int index, int totalSourceLength, ChunkMetadata metadata) {

    public int length() {
        return end - start;
    }
}
