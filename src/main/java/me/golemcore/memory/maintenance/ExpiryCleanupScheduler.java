package me.golemcore.memory.maintenance;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically removes expired working memory and snapshots. Controlled by
 * {@code memory.maintenance.enabled} and
 * {@code memory.maintenance.cleanup-interval}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExpiryCleanupScheduler {

    private final MemoryMaintenanceService maintenanceService;
    private final MemoryProperties properties;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> cleanupTask;

    @PostConstruct
    public void init() {
        MemoryProperties.MaintenanceProperties maintenance = properties.getMaintenance();
        if (!maintenance.isEnabled()) {
            log.info("[Cleanup] Expiry cleanup disabled");
            return;
        }
        Duration interval = maintenance.getCleanupInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalStateException("memory.maintenance.cleanup-interval must be positive");
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-expiry-cleanup");
            t.setDaemon(true);
            return t;
        });
        long intervalMillis = interval.toMillis();
        cleanupTask = scheduler.scheduleAtFixedRate(
                this::tick,
                intervalMillis,
                intervalMillis,
                TimeUnit.MILLISECONDS);

        log.info("[Cleanup] Started with interval: {}", interval);
    }

    @PreDestroy
    public void shutdown() {
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Cleanup] Shut down");
    }

    boolean isScheduled() {
        return cleanupTask != null && !cleanupTask.isCancelled();
    }

    void tick() {
        try {
            maintenanceService.cleanupExpired();
        } catch (RuntimeException e) {
            log.error("[Cleanup] Expiry sweep failed: {}", e.getMessage(), e);
        }
    }
}
