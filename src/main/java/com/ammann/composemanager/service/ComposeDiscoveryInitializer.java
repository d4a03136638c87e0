/* (C)2026 */
package com.ammann.composemanager.service;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Keeps the compose file cache warm.
 *
 * <p>Fills the cache right after startup without delaying it, then rescans periodically so
 * requests rarely pay for a scan. Failed scans are logged; the next access retries.
 */
@ApplicationScoped
public class ComposeDiscoveryInitializer {

    @Inject ComposeFileCacheService cacheService;

    @Inject Logger logger;

    void onStart(@Observes StartupEvent event) {
        Infrastructure.getDefaultWorkerPool().execute(this::initialScan);
    }

    void initialScan() {
        try {
            List<?> files = cacheService.getOrScan(true);
            logger.infof("Initial compose scan found %d files", files.size());
        } catch (Exception e) {
            logger.error("Initial compose scan failed, retrying on next access", e);
        }
    }

    /** Rescans the compose root and replaces the cached result. */
    @Scheduled(every = "${compose.scan-refresh-interval:5m}", delayed = "30s")
    public void refresh() {
        logger.debugf("Refreshing compose file cache...");
        try {
            List<?> files = cacheService.getOrScan(true);
            logger.debugf("Compose file cache refreshed: %d files", files.size());
        } catch (Exception e) {
            logger.error("Error refreshing compose file cache", e);
        }
    }
}
