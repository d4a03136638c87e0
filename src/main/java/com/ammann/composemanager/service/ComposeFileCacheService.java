/* (C)2026 */
package com.ammann.composemanager.service;

import com.ammann.composemanager.config.ComposeDiscoveryConfig;
import com.ammann.composemanager.dto.DiscoveredFileDTO;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;
import org.jboss.logging.Logger;

/**
 * Time-bounded cache in front of {@link ComposeFileScanner}.
 *
 * <p>A fresh entry is served without any locking. On a miss, the first caller takes the lock,
 * re-checks the entry and starts the scan; every caller arriving while that scan runs waits for
 * the same result instead of starting another one. Failed scans are handed to all waiters and
 * are never cached, so the next call retries.
 */
@ApplicationScoped
public class ComposeFileCacheService {

    @Inject ComposeFileScanner scanner;

    @Inject ComposeDiscoveryConfig config;

    @Inject Logger logger;

    Clock clock = Clock.systemUTC();

    private final ReentrantLock lock = new ReentrantLock();

    private volatile CachedScan cached;

    // guarded by lock
    private CompletableFuture<List<DiscoveredFileDTO>> inFlight;

    /**
     * Returns the cached scan result, scanning if the entry is missing or expired.
     *
     * @return the discovered files
     */
    public List<DiscoveredFileDTO> getOrScan() {
        return getOrScan(false);
    }

    /**
     * Returns the discovered compose files.
     *
     * @param bypassCache {@code true} to scan regardless of the cached entry and refresh it
     * @return the discovered files
     * @throws com.ammann.composemanager.exception.ComposeScanException if the scan fails
     */
    public List<DiscoveredFileDTO> getOrScan(boolean bypassCache) {
        if (!bypassCache) {
            CachedScan current = cached;
            if (current != null && current.isFresh(clock.instant())) {
                logger.debugf("Cache HIT: %d compose files", current.files().size());
                return current.files();
            }
        }

        CompletableFuture<List<DiscoveredFileDTO>> scan;
        boolean owner = false;
        lock.lock();
        try {
            if (!bypassCache) {
                CachedScan current = cached;
                if (current != null && current.isFresh(clock.instant())) {
                    logger.debugf(
                            "Cache HIT after lock: %d compose files", current.files().size());
                    return current.files();
                }
            }
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                owner = true;
            }
            scan = inFlight;
        } finally {
            lock.unlock();
        }

        if (owner) {
            return runScan(scan, bypassCache);
        }
        logger.debug("Compose scan already in progress, waiting for its result");
        return await(scan);
    }

    /** Drops the cached entry; the next call scans again. */
    public void invalidate() {
        cached = null;
        logger.info("Compose file cache invalidated");
    }

    private List<DiscoveredFileDTO> runScan(
            CompletableFuture<List<DiscoveredFileDTO>> scan, boolean bypassCache) {
        logger.infof("Cache %s: scanning compose files", bypassCache ? "BYPASS" : "MISS");
        try {
            List<DiscoveredFileDTO> files = List.copyOf(scanner.scan());
            Duration ttl = Duration.ofSeconds(config.cacheDurationSeconds());
            cached = new CachedScan(files, clock.instant().plus(ttl));
            scan.complete(files);
            logger.debugf("Cached %d compose files for %s", files.size(), ttl);
            return files;
        } catch (RuntimeException | Error e) {
            logger.warnf("Compose scan failed, result not cached: %s", e.getMessage());
            scan.completeExceptionally(e);
            throw e;
        } finally {
            lock.lock();
            try {
                if (inFlight == scan) {
                    inFlight = null;
                }
            } finally {
                lock.unlock();
            }
        }
    }

    private static List<DiscoveredFileDTO> await(CompletableFuture<List<DiscoveredFileDTO>> scan) {
        try {
            return scan.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    private record CachedScan(List<DiscoveredFileDTO> files, Instant expiresAt) {

        boolean isFresh(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
