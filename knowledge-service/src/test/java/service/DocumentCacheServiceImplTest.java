package service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lite.knowledge.config.DocumentCacheProperties;
import org.lite.knowledge.dto.CacheStats;
import org.lite.knowledge.enums.CachedFileType;
import org.lite.knowledge.exception.CacheFullException;
import org.lite.knowledge.exception.CachedDocumentNotFoundException;
import org.lite.knowledge.model.CachedDocument;
import org.lite.knowledge.service.impl.DocumentCacheServiceImpl;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentCacheServiceImplTest {

    private MutableClock clock;
    private DocumentCacheProperties properties;
    private DocumentCacheServiceImpl cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        properties = new DocumentCacheProperties();
        properties.setMaxDocuments(2);
        cache = new DocumentCacheServiceImpl(properties, clock);
    }

    @AfterEach
    void tearDown() {
        cache.shutdown();
    }

    @Test
    void testStore_ComputesStatsAndFileType() {
        // Given
        String key = cache.store("hello world\nfoo", "Notes.TXT", 2048, 12.5).block();

        // When / Then
        StepVerifier.create(cache.get(key))
                .assertNext(document -> {
                    assertEquals("Notes.TXT", document.getFilename());
                    assertEquals(CachedFileType.TXT, document.getFileType());
                    assertEquals(15, document.getTextStats().chars());
                    assertEquals(3, document.getTextStats().words());
                    assertEquals(2, document.getTextStats().lines());
                    assertEquals(clock.instant().plus(Duration.ofMinutes(30)), document.getExpiresAt());
                })
                .verifyComplete();
    }

    @Test
    void testStore_UnknownExtension() {
        String key = cache.store("data", "archive.zip", 4, 0).block();

        assertEquals(CachedFileType.UNKNOWN, cache.get(key).block().getFileType());
    }

    @Test
    void testGet_ExpiredEntryIsRemoved() {
        // Given
        String key = cache.store("text", "a.txt", 4, 1).block();
        clock.advance(Duration.ofMinutes(30));

        // When / Then
        StepVerifier.create(cache.get(key)).verifyComplete();
        StepVerifier.create(cache.stats())
                .assertNext(stats -> assertEquals(0, stats.getCount()))
                .verifyComplete();
    }

    @Test
    void testGet_RefreshesLastAccess() {
        // Given
        String key = cache.store("text", "a.txt", 4, 1).block();
        clock.advance(Duration.ofMinutes(5));

        // When
        CachedDocument document = cache.get(key).block();

        // Then
        assertEquals(clock.instant(), document.getLastAccessedAt());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), document.getCreatedAt());
    }

    @Test
    void testGet_ReturnsSnapshotOfEntry() {
        // Given
        String key = cache.store("text", "a.txt", 4, 1).block();
        clock.advance(Duration.ofMinutes(5));
        CachedDocument first = cache.get(key).block();
        clock.advance(Duration.ofMinutes(5));

        // When
        CachedDocument second = cache.get(key).block();

        // Then
        assertEquals(Instant.parse("2024-05-01T10:05:00Z"), first.getLastAccessedAt());
        assertEquals(Instant.parse("2024-05-01T10:10:00Z"), second.getLastAccessedAt());
        assertNotSame(first, second);
        assertEquals(first.getRawText(), second.getRawText());
    }

    @Test
    void testStore_FullCacheRejectsNewEntries() {
        // Given
        cache.store("one", "1.txt", 3, 1).block();
        cache.store("two", "2.txt", 3, 1).block();

        // When / Then
        StepVerifier.create(cache.store("three", "3.txt", 5, 1))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(CacheFullException.class, error);
                    assertEquals("Cache full: maximum 2 documents allowed", error.getMessage());
                })
                .verify();
    }

    @Test
    void testStore_FullCachePurgesExpiredFirst() {
        // Given
        cache.store("one", "1.txt", 3, 1).block();
        cache.store("two", "2.txt", 3, 1).block();
        clock.advance(Duration.ofMinutes(31));

        // When / Then
        StepVerifier.create(cache.store("three", "3.txt", 5, 1))
                .assertNext(key -> assertNotNull(key))
                .verifyComplete();
        assertEquals(1, cache.list().block().size());
    }

    @Test
    void testList_NewestFirst() {
        // Given
        cache.store("older", "old.txt", 5, 1).block();
        clock.advance(Duration.ofMinutes(1));
        cache.store("newer", "new.pdf", 5, 1).block();

        // When
        List<CachedDocument> documents = cache.list().block();

        // Then
        assertEquals(List.of("new.pdf", "old.txt"), documents.stream().map(CachedDocument::getFilename).toList());
        assertEquals(CachedFileType.PDF, documents.get(0).getFileType());
    }

    @Test
    void testRequire_MissingKey() {
        StepVerifier.create(cache.require("does-not-exist"))
                .expectError(CachedDocumentNotFoundException.class)
                .verify();
    }

    @Test
    void testRemoveAndClear() {
        // Given
        String first = cache.store("one", "1.txt", 3, 1).block();
        cache.store("two", "2.txt", 3, 1).block();

        // When / Then
        StepVerifier.create(cache.remove(first)).expectNext(true).verifyComplete();
        StepVerifier.create(cache.remove(first)).expectNext(false).verifyComplete();
        StepVerifier.create(cache.clear()).expectNext(1).verifyComplete();
        StepVerifier.create(cache.list()).expectNext(List.of()).verifyComplete();
    }

    @Test
    void testRemove_ExpiredEntryIsAbsent() {
        // Given
        String key = cache.store("text", "a.txt", 4, 1).block();
        clock.advance(Duration.ofMinutes(31));

        // When / Then
        StepVerifier.create(cache.remove(key)).expectNext(false).verifyComplete();
        StepVerifier.create(cache.purgeExpired()).expectNext(0).verifyComplete();
        StepVerifier.create(cache.require(key))
                .expectError(CachedDocumentNotFoundException.class)
                .verify();
    }

    @Test
    void testStats_ReportsSizesAndSettings() {
        // Given
        cache.store("x".repeat(1024 * 1024), "big.txt", 3 * 1024 * 1024, 1).block();

        // When
        CacheStats stats = cache.stats().block();

        // Then
        assertEquals(1, stats.getCount());
        assertEquals(2, stats.getMaxCount());
        assertEquals(2.0, stats.getMemoryMB());
        assertEquals(3.0, stats.getTotalFileSizeMB());
        assertEquals(30, stats.getTtlMinutes());
        assertEquals(5, stats.getCleanupIntervalMinutes());
    }

    @Test
    void testPurgeExpired_CountsRemovedEntries() {
        // Given
        cache.store("one", "1.txt", 3, 1).block();
        clock.advance(Duration.ofMinutes(20));
        cache.store("two", "2.txt", 3, 1).block();
        clock.advance(Duration.ofMinutes(15));

        // When / Then
        StepVerifier.create(cache.purgeExpired()).expectNext(1).verifyComplete();
        assertEquals(1, cache.list().block().size());
    }

    @Test
    void testReaper_StartedLazilyAndStoppedOnShutdown() {
        // Given
        assertFalse(cache.isReaperRunning());

        // When
        cache.store("one", "1.txt", 3, 1).block();

        // Then
        assertTrue(cache.isReaperRunning());
        cache.shutdown();
        assertFalse(cache.isReaperRunning());
        cache.shutdown();
    }

    @Test
    void testReaper_PurgesExpiredEntriesSoFullCacheAcceptsAgain() {
        // Given
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        DocumentCacheServiceImpl reapedCache = new DocumentCacheServiceImpl(properties, clock, scheduler);
        try {
            reapedCache.store("one", "1.txt", 3, 1).block();
            reapedCache.store("two", "2.txt", 3, 1).block();
            StepVerifier.create(reapedCache.store("three", "3.txt", 5, 1))
                    .expectError(CacheFullException.class)
                    .verify();

            // When
            clock.advance(Duration.ofMinutes(31));
            scheduler.advanceTimeBy(properties.getCleanupInterval());

            // Then
            StepVerifier.create(reapedCache.purgeExpired()).expectNext(0).verifyComplete();
            assertEquals(0, reapedCache.stats().block().getCount());
            StepVerifier.create(reapedCache.store("three", "3.txt", 5, 1))
                    .assertNext(key -> assertNotNull(key))
                    .verifyComplete();
        } finally {
            reapedCache.shutdown();
            scheduler.dispose();
        }
    }

    @Test
    void testReaper_LeavesLiveEntries() {
        // Given
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        DocumentCacheServiceImpl reapedCache = new DocumentCacheServiceImpl(properties, clock, scheduler);
        try {
            reapedCache.store("old", "old.txt", 3, 1).block();
            clock.advance(Duration.ofMinutes(20));
            reapedCache.store("new", "new.txt", 3, 1).block();

            // When
            clock.advance(Duration.ofMinutes(15));
            scheduler.advanceTimeBy(properties.getCleanupInterval());

            // Then
            List<CachedDocument> documents = reapedCache.list().block();
            assertEquals(List.of("new.txt"), documents.stream().map(CachedDocument::getFilename).toList());
        } finally {
            reapedCache.shutdown();
            scheduler.dispose();
        }
    }
}
