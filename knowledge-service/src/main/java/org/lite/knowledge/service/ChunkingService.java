package org.lite.knowledge.service;

import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.knowledge.config.ChunkingProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into overlapping fixed-size character windows.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChunkingService {

    // Preferred window boundaries, strongest first. A hard cut is the last resort.
    private static final String[] SEPARATORS = {"\n\n", "\n", " "};

    private final ChunkingProperties chunkingProperties;

    /**
     * Chunk text with the configured size and overlap
     */
    public List<ChunkResult> chunk(String text) {
        return chunk(text, chunkingProperties.getChunkSize(), chunkingProperties.getChunkOverlap());
    }

    /**
     * Chunk text into windows of at most {@code chunkSize} characters.
     * Each window after the first starts exactly {@code overlap} characters before the previous
     * window ended, so dropping the first {@code overlap} characters of every later chunk and
     * concatenating rebuilds the input.
     * @param text The text to chunk
     * @param chunkSize Maximum characters per chunk
     * @param overlap Characters shared by consecutive chunks, must be smaller than chunkSize
     * @return List of text chunks in document order
     */
    public List<ChunkResult> chunk(String text, int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "Chunk overlap must be in [0, chunkSize), got overlap=" + overlap + ", chunkSize=" + chunkSize);
        }
        if (text == null || text.isBlank()) {
            return new ArrayList<>();
        }

        List<ChunkResult> chunks = new ArrayList<>();
        int length = text.length();
        int start = 0;
        int chunkIndex = 0;

        while (true) {
            int end = length - start <= chunkSize
                    ? length
                    : findWindowEnd(text, start, start + chunkSize, overlap);

            chunks.add(ChunkResult.builder()
                    .text(text.substring(start, end))
                    .startPosition(start)
                    .endPosition(end)
                    .chunkIndex(chunkIndex++)
                    .build());

            if (end >= length) {
                break;
            }
            start = end - overlap;
        }

        log.info("Chunked text of {} chars into {} chunks (chunkSize: {}, overlap: {})",
                length, chunks.size(), chunkSize, overlap);
        return chunks;
    }

    /**
     * Latest separator boundary inside (start + overlap, limit], falling back to limit.
     * Ends at or before start + overlap are rejected so that the next window always advances.
     */
    private int findWindowEnd(String text, int start, int limit, int overlap) {
        int minEnd = start + overlap + 1;
        for (String separator : SEPARATORS) {
            int index = text.lastIndexOf(separator, limit - separator.length());
            if (index >= 0) {
                int end = index + separator.length();
                if (end >= minEnd) {
                    return end;
                }
            }
        }
        return limit;
    }

    @Data
    @lombok.Builder
    @lombok.NoArgsConstructor
    @lombok.AllArgsConstructor
    public static class ChunkResult {
        private String text;
        private Integer startPosition;
        private Integer endPosition;
        private Integer chunkIndex;
    }
}
