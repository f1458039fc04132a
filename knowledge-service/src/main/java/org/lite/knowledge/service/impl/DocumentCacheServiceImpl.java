package org.lite.knowledge.service.impl;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.lite.knowledge.config.DocumentCacheProperties;
import org.lite.knowledge.dto.CacheStats;
import org.lite.knowledge.enums.CachedFileType;
import org.lite.knowledge.exception.CacheFullException;
import org.lite.knowledge.exception.CachedDocumentNotFoundException;
import org.lite.knowledge.model.CachedDocument;
import org.lite.knowledge.model.TextStats;
import org.lite.knowledge.service.DocumentCacheService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

@Service
@Slf4j
public class DocumentCacheServiceImpl implements DocumentCacheService {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final DocumentCacheProperties properties;
    private final Clock clock;
    private final Scheduler reaperScheduler;

    private final Map<String, CachedDocument> documents = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private Disposable reaper;
    private boolean shutDown;

    @Autowired
    public DocumentCacheServiceImpl(DocumentCacheProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public DocumentCacheServiceImpl(DocumentCacheProperties properties, Clock clock) {
        this(properties, clock, Schedulers.parallel());
    }

    public DocumentCacheServiceImpl(DocumentCacheProperties properties, Clock clock, Scheduler reaperScheduler) {
        this.properties = properties;
        this.clock = clock;
        this.reaperScheduler = reaperScheduler;
        log.info("Document cache initialized: ttl={}m, max={} documents, cleanup every {}m",
                properties.getTtl().toMinutes(), properties.getMaxDocuments(),
                properties.getCleanupInterval().toMinutes());
    }

    @Override
    public Mono<String> store(String text, String filename, long sizeBytes, double processingTimeMs) {
        return Mono.fromCallable(() -> {
            String content = text != null ? text : "";
            lock.lock();
            try {
                if (documents.size() >= properties.getMaxDocuments()) {
                    purgeExpiredLocked();
                    if (documents.size() >= properties.getMaxDocuments()) {
                        log.warn("Document cache is full ({} documents)", documents.size());
                        throw new CacheFullException(properties.getMaxDocuments());
                    }
                }

                Instant now = clock.instant();
                String key = UUID.randomUUID().toString();
                CachedDocument document = CachedDocument.builder()
                        .key(key)
                        .filename(filename)
                        .rawText(content)
                        .fileType(CachedFileType.fromFilename(filename))
                        .sizeBytes(sizeBytes)
                        .textStats(TextStats.of(content))
                        .processingTimeMs(processingTimeMs)
                        .createdAt(now)
                        .expiresAt(now.plus(properties.getTtl()))
                        .lastAccessedAt(now)
                        .build();
                documents.put(key, document);
                startReaperLocked();

                log.info("Cached document {} ({}, {} chars), {} cached", shortKey(key), filename,
                        document.getTextStats().chars(), documents.size());
                return key;
            } finally {
                lock.unlock();
            }
        });
    }

    @Override
    public Mono<CachedDocument> get(String key) {
        return Mono.fromCallable(() -> {
            if (key == null) {
                return null;
            }
            lock.lock();
            try {
                CachedDocument document = documents.get(key);
                if (document == null) {
                    return null;
                }
                Instant now = clock.instant();
                if (document.isExpired(now)) {
                    documents.remove(key);
                    log.info("Cached document {} expired", shortKey(key));
                    return null;
                }
                CachedDocument accessed = document.accessedAt(now);
                documents.put(key, accessed);
                return accessed;
            } finally {
                lock.unlock();
            }
        });
    }

    @Override
    public Mono<CachedDocument> require(String key) {
        return get(key).switchIfEmpty(Mono.error(() -> new CachedDocumentNotFoundException(key)));
    }

    @Override
    public Mono<Boolean> remove(String key) {
        return Mono.fromCallable(() -> {
            lock.lock();
            try {
                CachedDocument removed = key != null ? documents.remove(key) : null;
                if (removed == null) {
                    return false;
                }
                if (removed.isExpired(clock.instant())) {
                    log.info("Cached document {} expired", shortKey(key));
                    return false;
                }
                log.info("Removed cached document {}", shortKey(key));
                return true;
            } finally {
                lock.unlock();
            }
        });
    }

    @Override
    public Mono<List<CachedDocument>> list() {
        return Mono.fromCallable(() -> {
            lock.lock();
            try {
                purgeExpiredLocked();
                List<CachedDocument> live = new ArrayList<>(documents.values());
                live.sort(Comparator.comparing(CachedDocument::getCreatedAt).reversed());
                return live;
            } finally {
                lock.unlock();
            }
        });
    }

    @Override
    public Mono<CacheStats> stats() {
        return Mono.fromCallable(() -> {
            lock.lock();
            try {
                purgeExpiredLocked();
                long textBytes = 0;
                long fileBytes = 0;
                for (CachedDocument document : documents.values()) {
                    // UTF-16 in memory
                    textBytes += (long) document.getRawText().length() * 2;
                    fileBytes += document.getSizeBytes();
                }
                return CacheStats.builder()
                        .count(documents.size())
                        .maxCount(properties.getMaxDocuments())
                        .memoryMB(roundTwoDecimals(textBytes / BYTES_PER_MB))
                        .totalFileSizeMB(roundTwoDecimals(fileBytes / BYTES_PER_MB))
                        .ttlMinutes(properties.getTtl().toMinutes())
                        .cleanupIntervalMinutes(properties.getCleanupInterval().toMinutes())
                        .build();
            } finally {
                lock.unlock();
            }
        });
    }

    @Override
    public Mono<Integer> purgeExpired() {
        return Mono.fromCallable(() -> {
            lock.lock();
            try {
                return purgeExpiredLocked();
            } finally {
                lock.unlock();
            }
        });
    }

    @Override
    public Mono<Integer> clear() {
        return Mono.fromCallable(() -> {
            lock.lock();
            try {
                int count = documents.size();
                documents.clear();
                log.info("Cleared {} cached documents", count);
                return count;
            } finally {
                lock.unlock();
            }
        });
    }

    @Override
    @PreDestroy
    public void shutdown() {
        lock.lock();
        try {
            shutDown = true;
            if (reaper != null && !reaper.isDisposed()) {
                reaper.dispose();
                log.info("Document cache reaper stopped");
            }
            reaper = null;
        } finally {
            lock.unlock();
        }
    }

    public boolean isReaperRunning() {
        lock.lock();
        try {
            return reaper != null && !reaper.isDisposed();
        } finally {
            lock.unlock();
        }
    }

    private void startReaperLocked() {
        if (shutDown || (reaper != null && !reaper.isDisposed())) {
            return;
        }
        reaper = Flux.interval(properties.getCleanupInterval(), properties.getCleanupInterval(), reaperScheduler)
                .subscribe(tick -> {
                    lock.lock();
                    try {
                        int removed = purgeExpiredLocked();
                        if (removed > 0) {
                            log.info("Cache reaper removed {} expired documents", removed);
                        }
                    } finally {
                        lock.unlock();
                    }
                }, error -> log.error("Document cache reaper failed: {}", error.getMessage(), error));
        log.info("Document cache reaper started (every {}m)", properties.getCleanupInterval().toMinutes());
    }

    private int purgeExpiredLocked() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<CachedDocument> iterator = documents.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isExpired(now)) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Purged {} expired documents", removed);
        }
        return removed;
    }

    private static double roundTwoDecimals(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static String shortKey(String key) {
        return key.length() > 8 ? key.substring(0, 8) : key;
    }
}
