package com.datasheetrag.ingest;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits long text into overlapping character windows that prefer to end on a
 * sentence boundary.
 *
 * <p>Each window is at most {@code maxSize} characters. When a window does not reach
 * the end of the text, its end is pulled back to just after the latest sentence
 * delimiter found in its trailing {@value #SENTENCE_WINDOW} characters (but never
 * before {@code start + minSize}). The next window starts {@code overlap} characters
 * before the previous end, and always at least {@code minSize} characters after the
 * previous start, so the cursor strictly advances.</p>
 */
public class Chunker {
    private static final Logger log = LoggerFactory.getLogger(Chunker.class);
    static final int SENTENCE_WINDOW = 200;
    private static final String[] SENTENCE_DELIMITERS = { ". ", "! ", "? ", ".\n", "!\n", "?\n" };

    public static final int DEFAULT_MIN_SIZE = 1000;
    public static final int DEFAULT_MAX_SIZE = 2000;
    public static final int DEFAULT_OVERLAP = 200;

    private final int minSize;
    private final int maxSize;
    private final int overlap;

    public Chunker() {
        this(DEFAULT_MIN_SIZE, DEFAULT_MAX_SIZE, DEFAULT_OVERLAP);
    }

    public Chunker(int minSize, int maxSize, int overlap) {
        if (minSize <= 0 || maxSize < minSize) {
            throw new IllegalArgumentException("Require 0 < minSize <= maxSize, got min=" + minSize + " max=" + maxSize);
        }
        if (overlap < 0 || overlap >= maxSize) {
            throw new IllegalArgumentException("Require 0 <= overlap < maxSize, got overlap=" + overlap);
        }
        this.minSize = minSize;
        this.maxSize = maxSize;
        this.overlap = overlap;
    }

    public List<TextChunk> chunk(String text, ChunkMetadata sourceMetadata) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        ChunkMetadata base = sourceMetadata == null ? ChunkMetadata.empty() : sourceMetadata;
        int length = text.length();
        List<TextChunk> chunks = new ArrayList<>();

        int start = 0;
        int chunkIndex = 0;
        while (start < length) {
            int end = Math.min(start + maxSize, length);
            if (end < length) {
                int searchStart = Math.max(start + minSize, end - SENTENCE_WINDOW);
                int sentenceEnd = latestSentenceEnd(text, searchStart, end);
                if (sentenceEnd > 0) {
                    end = sentenceEnd;
                }
            }

            String chunkText = text.substring(start, end).strip();
            boolean reachesEnd = end >= length;
            if (!chunkText.isEmpty() && (chunkText.length() >= minSize || reachesEnd)) {
                ChunkMetadata metadata = base.withChunk(chunkIndex, start, end, chunkText.length(), length);
                chunks.add(new TextChunk(chunkText, start, end, chunkIndex, length, metadata));
                chunkIndex++;
            }

            int nextStart = Math.max(start + minSize, end - overlap);
            if (nextStart <= start) {
                nextStart = start + minSize;
            }
            start = nextStart;
        }
        log.debug("Created {} text chunks from {} characters", chunks.size(), length);
        return chunks;
    }

    public int minSize() {
        return minSize;
    }

    public int maxSize() {
        return maxSize;
    }

    public int overlap() {
        return overlap;
    }

    /**
     * Returns the position just after the latest delimiter lying entirely within
     * {@code [from, to)}, or -1 when there is none.
     */
    private static int latestSentenceEnd(String text, int from, int to) {
        int best = -1;
        for (String delimiter : SENTENCE_DELIMITERS) {
            int pos = text.lastIndexOf(delimiter, to - delimiter.length());
            if (pos >= from && pos + delimiter.length() > best) {
                best = pos + delimiter.length();
            }
        }
        return best;
    }
}
