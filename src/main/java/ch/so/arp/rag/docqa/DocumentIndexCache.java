package ch.so.arp.rag.docqa;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide cache of built document indexes keyed by document fingerprint.
 * <p>
 * A fingerprint is built at most once: the first caller registers a shared
 * future and starts the build on the build executor, every concurrent caller
 * for the same fingerprint waits on that future. Builds of different
 * fingerprints run in parallel. A failed build is removed again, so the next
 * request retries it, while all callers that waited on it see the same
 * exception.
 * <p>
 * Entries live for the lifetime of the process unless a positive
 * {@code maxDocuments} is configured, in which case completed entries beyond the
 * limit are evicted least recently used first.
 */
public class DocumentIndexCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentIndexCache.class);

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong accessClock = new AtomicLong();
    private final Executor buildExecutor;
    private final int maxDocuments;

    public DocumentIndexCache(Executor buildExecutor) {
        this(buildExecutor, 0);
    }

    public DocumentIndexCache(Executor buildExecutor, int maxDocuments) {
        this.buildExecutor = Objects.requireNonNull(buildExecutor, "buildExecutor");
        if (maxDocuments < 0) {
            throw new IllegalArgumentException("maxDocuments must not be negative");
        }
        this.maxDocuments = maxDocuments;
    }

    /**
     * Returns the cached index for the fingerprint, building it with
     * {@code buildFn} if it is not cached yet. Blocks until the index is
     * available.
     *
     * @throws RuntimeException the exception thrown by {@code buildFn}, unchanged
     */
    public IndexedDocument getOrBuild(String fingerprint, Supplier<IndexedDocument> buildFn) {
        try {
            return getOrBuildAsync(fingerprint, buildFn).join();
        } catch (CompletionException ex) {
            throw unwrap(ex);
        }
    }

    public CompletableFuture<IndexedDocument> getOrBuildAsync(String fingerprint,
            Supplier<IndexedDocument> buildFn) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(buildFn, "buildFn");

        CacheEntry entry = entries.computeIfAbsent(fingerprint, key -> {
            LOGGER.info("No cached index for {}, starting build", key);
            return new CacheEntry(CompletableFuture.supplyAsync(buildFn, buildExecutor));
        });
        entry.touch(accessClock.incrementAndGet());

        CompletableFuture<IndexedDocument> future = entry.future();
        future.whenComplete((document, failure) -> {
            if (failure != null) {
                if (entries.remove(fingerprint, entry)) {
                    LOGGER.warn("Index build for {} failed, it will be retried on the next request: {}",
                            fingerprint, unwrap(failure).getMessage());
                }
            } else {
                evictIfNeeded(fingerprint);
            }
        });
        return future.copy();
    }

    /**
     * @return {@code true} if a successfully built index is cached for the fingerprint
     */
    public boolean contains(String fingerprint) {
        CacheEntry entry = entries.get(fingerprint);
        return entry != null && entry.future().isDone() && !entry.future().isCompletedExceptionally();
    }

    public void invalidate(String fingerprint) {
        if (entries.remove(fingerprint) != null) {
            LOGGER.info("Invalidated cached index for {}", fingerprint);
        }
    }

    public int size() {
        return entries.size();
    }

    private synchronized void evictIfNeeded(String keep) {
        if (maxDocuments == 0) {
            return;
        }
        while (entries.size() > maxDocuments) {
            Map.Entry<String, CacheEntry> eldest = null;
            for (Map.Entry<String, CacheEntry> candidate : entries.entrySet()) {
                CompletableFuture<IndexedDocument> future = candidate.getValue().future();
                if (candidate.getKey().equals(keep) || !future.isDone() || future.isCompletedExceptionally()) {
                    continue;
                }
                if (eldest == null || candidate.getValue().lastAccess() < eldest.getValue().lastAccess()) {
                    eldest = candidate;
                }
            }
            if (eldest == null) {
                return;
            }
            if (entries.remove(eldest.getKey(), eldest.getValue())) {
                LOGGER.info("Evicted cached index for {} (capacity {})", eldest.getKey(), maxDocuments);
            }
        }
    }

    static RuntimeException unwrap(Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Index build failed", cause);
    }

    private static final class CacheEntry {

        private final CompletableFuture<IndexedDocument> future;
        private volatile long lastAccess;

        CacheEntry(CompletableFuture<IndexedDocument> future) {
            this.future = future;
        }

        CompletableFuture<IndexedDocument> future() {
            return future;
        }

        long lastAccess() {
            return lastAccess;
        }

        void touch(long tick) {
            lastAccess = tick;
        }
    }
}
