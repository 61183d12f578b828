package com.openrangelabs.donpetre.pipeline.processor.file;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into fixed-size character windows that overlap by {@code overlap} characters.
 *
 * <p>Windows advance by {@code chunkSize - overlap}; the last window ends at the end of the
 * text, so no window is entirely contained in its predecessor.
 */
public class TextChunker {

    private final int chunkSize;
    private final int overlap;

    public TextChunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunk_size must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("chunk_overlap must be in [0, chunk_size)");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    /**
     * @return the chunks of {@code text}, empty when it is blank
     */
    public List<Chunk> chunk(String text) {
        List<Chunk> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return chunks;
        }
        int step = chunkSize - overlap;
        int start = 0;
        while (true) {
            int end = Math.min(start + chunkSize, text.length());
            chunks.add(new Chunk(chunks.size(), start, end, text.substring(start, end)));
            if (end == text.length()) {
                return chunks;
            }
            start += step;
        }
    }

    public int getChunkSize() { return chunkSize; }
    public int getOverlap() { return overlap; }

    /**
     * One window of the source text; {@code end} is exclusive.
     */
    public static final class Chunk {

        private final int index;
        private final int start;
        private final int end;
        private final String content;

        Chunk(int index, int start, int end, String content) {
            this.index = index;
            this.start = start;
            this.end = end;
            this.content = content;
        }

        public int getIndex() { return index; }
        public int getStart() { return start; }
        public int getEnd() { return end; }
        public String getContent() { return content; }
    }
}
