package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lite.knowledge.config.ChunkingProperties;
import org.lite.knowledge.service.ChunkingService;
import org.lite.knowledge.service.ChunkingService.ChunkResult;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChunkingServiceTest {

    private ChunkingService chunkingService;

    @BeforeEach
    void setUp() {
        chunkingService = new ChunkingService(new ChunkingProperties());
    }

    @Test
    void testChunk_TextWithoutSeparatorsIsHardCut() {
        // Given
        String text = "x".repeat(2200);

        // When
        List<ChunkResult> chunks = chunkingService.chunk(text);

        // Then
        assertEquals(3, chunks.size());
        assertEquals(0, chunks.get(0).getStartPosition());
        assertEquals(1000, chunks.get(0).getEndPosition());
        assertEquals(800, chunks.get(1).getStartPosition());
        assertEquals(1800, chunks.get(1).getEndPosition());
        assertEquals(1600, chunks.get(2).getStartPosition());
        assertEquals(600, chunks.get(2).getText().length());
    }

    @Test
    void testChunk_PrefersParagraphBreak() {
        // Given
        String text = "a".repeat(600) + "\n\n" + "b".repeat(600);

        // When
        List<ChunkResult> chunks = chunkingService.chunk(text, 1000, 200);

        // Then
        assertEquals(2, chunks.size());
        assertEquals("a".repeat(600) + "\n\n", chunks.get(0).getText());
        assertEquals(402, chunks.get(1).getStartPosition());
        assertTrue(chunks.get(1).getText().endsWith("b".repeat(600)));
    }

    @Test
    void testChunk_ConsecutiveChunksOverlapAndRebuildText() {
        // Given
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < 300; i++) {
            builder.append("word").append(i).append(i % 17 == 0 ? "\n" : " ");
            if (i % 50 == 0) {
                builder.append("\n");
            }
        }
        String text = builder.toString();
        int size = 120;
        int overlap = 30;

        // When
        List<ChunkResult> chunks = chunkingService.chunk(text, size, overlap);

        // Then
        StringBuilder rebuilt = new StringBuilder(chunks.get(0).getText());
        for (int i = 1; i < chunks.size(); i++) {
            String previous = chunks.get(i - 1).getText();
            String current = chunks.get(i).getText();
            assertTrue(current.length() <= size);
            assertEquals(previous.substring(previous.length() - overlap), current.substring(0, overlap));
            assertEquals(i, chunks.get(i).getChunkIndex());
            rebuilt.append(current.substring(overlap));
        }
        assertEquals(text, rebuilt.toString());
    }

    @Test
    void testChunk_ShortTextIsSingleChunk() {
        // When
        List<ChunkResult> chunks = chunkingService.chunk("short text");

        // Then
        assertEquals(1, chunks.size());
        assertEquals("short text", chunks.get(0).getText());
    }

    @Test
    void testChunk_BlankTextYieldsNoChunks() {
        assertTrue(chunkingService.chunk("").isEmpty());
        assertTrue(chunkingService.chunk("   \n  ").isEmpty());
        assertTrue(chunkingService.chunk(null).isEmpty());
    }

    @Test
    void testChunk_InvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> chunkingService.chunk("text", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> chunkingService.chunk("text", 100, -1));
        assertThrows(IllegalArgumentException.class, () -> chunkingService.chunk("text", 100, 100));
    }
}
