package me.golemcore.memory.sync;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.ConflictResolutionException;
import me.golemcore.memory.domain.exception.DuplicateMemoryException;
import me.golemcore.memory.domain.exception.MemoryException;
import me.golemcore.memory.domain.exception.MemoryValidationException;
import me.golemcore.memory.domain.exception.SyncAlreadyRunningException;
import me.golemcore.memory.domain.exception.SyncNotRunningException;
import me.golemcore.memory.domain.exception.VersionConflictException;
import me.golemcore.memory.domain.model.ConflictResolution;
import me.golemcore.memory.domain.model.ConflictStrategy;
import me.golemcore.memory.domain.model.LongtermMemory;
import me.golemcore.memory.domain.model.MemoryConflict;
import me.golemcore.memory.domain.model.MemoryFilters;
import me.golemcore.memory.domain.model.MemoryType;
import me.golemcore.memory.domain.model.PendingChange;
import me.golemcore.memory.domain.model.SyncResult;
import me.golemcore.memory.domain.model.SyncState;
import me.golemcore.memory.domain.model.SyncStatus;
import me.golemcore.memory.domain.model.WorkingMemory;
import me.golemcore.memory.domain.service.ConflictResolver;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the memory of one agent instance consistent with the shared store.
 *
 * <p>
 * An instance stages its local edits with
 * {@link #recordLocalChange(String, MemoryType, String, Object, long)}, naming
 * the version each edit was based on. A sync pass pushes every staged edit whose
 * base version still matches the store and turns the others into
 * {@link MemoryConflict}s on the {@link SyncStatus} of the
 * {@code (agentId, instanceId)} pair. Conflicts are settled by
 * {@link #resolveConflicts(String)} using the configured
 * {@link ConflictStrategy}, or bypassed by {@link #forcePush(String)} and
 * {@link #forcePull(String)}.
 *
 * <p>
 * Status transitions per pass: {@code synced -> syncing -> synced | conflict |
 * error}. All status writes for an agent are serialized by a per-agent lock.
 *
 * <p>
 * The optional periodic loop runs on a single daemon thread with a fixed delay
 * between passes; failed passes are logged and retried on the next tick.
 */
@Component
@Slf4j
public class MemorySyncCoordinator {

    private static final int MAX_OVERWRITE_ATTEMPTS = 3;

    private final MemoryRepositoryPort memoryRepository;
    private final ConflictResolver conflictResolver;
    private final MemoryProperties properties;
    private final Clock clock;
    private final String instanceId;

    private final Map<String, Object> agentLocks = new ConcurrentHashMap<>();
    private final Map<String, Map<String, PendingChange>> stagedChanges = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();

    private volatile ConflictStrategy conflictStrategy;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> syncTask;
    private Duration syncInterval;
    private String periodicAgentId;

    public MemorySyncCoordinator(MemoryRepositoryPort memoryRepository, ConflictResolver conflictResolver,
            MemoryProperties properties, Clock clock) {
        this.memoryRepository = memoryRepository;
        this.conflictResolver = conflictResolver;
        this.properties = properties;
        this.clock = clock;
        String configuredId = properties.getSync().getInstanceId();
        this.instanceId = configuredId != null && !configuredId.isBlank()
                ? configuredId.trim()
                : UUID.randomUUID().toString();
        ConflictStrategy configuredStrategy = properties.getSync().getStrategy();
        this.conflictStrategy = configuredStrategy != null ? configuredStrategy : ConflictStrategy.LAST_WRITE_WINS;
    }

    @PostConstruct
    public void init() {
        String agentId = properties.getSync().getAutoStartAgentId();
        if (agentId == null || agentId.isBlank()) {
            log.debug("[Sync] Instance {} ready, periodic sync not auto-started", instanceId);
            return;
        }
        startPeriodicSync(agentId.trim());
    }

    @PreDestroy
    public void shutdown() {
        if (isRunning()) {
            stopPeriodicSync();
        }
        log.info("[Sync] Instance {} shut down", instanceId);
    }

    // ==================== Periodic loop ====================

    public void startPeriodicSync(String agentId) {
        startPeriodicSync(agentId, properties.getSync().getInterval());
    }

    /**
     * Schedule {@link #syncAgent(String)} every {@code interval}.
     *
     * @throws SyncAlreadyRunningException
     *             if this coordinator already runs a periodic loop
     */
    public void startPeriodicSync(String agentId, Duration interval) {
        MemoryValidationException.requireId(agentId, "agentId");
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new MemoryValidationException("sync interval must be positive");
        }

        synchronized (lifecycleLock) {
            if (syncTask != null) {
                throw new SyncAlreadyRunningException(instanceId);
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "memory-sync-" + instanceId);
                t.setDaemon(true);
                return t;
            });
            long intervalMillis = interval.toMillis();
            syncTask = scheduler.scheduleWithFixedDelay(
                    () -> tick(agentId),
                    intervalMillis,
                    intervalMillis,
                    TimeUnit.MILLISECONDS);
            syncInterval = interval;
            periodicAgentId = agentId;
        }
        log.info("[Sync] Started periodic sync for agent {} on instance {} every {}", agentId, instanceId, interval);
    }

    /**
     * Cancel the periodic loop and wait at most one interval for a pass in
     * progress.
     *
     * @throws SyncNotRunningException
     *             if no periodic loop is running
     */
    public void stopPeriodicSync() {
        ScheduledExecutorService stopping;
        Duration wait;
        String agentId;
        synchronized (lifecycleLock) {
            if (syncTask == null) {
                throw new SyncNotRunningException(instanceId);
            }
            syncTask.cancel(false);
            stopping = scheduler;
            wait = syncInterval;
            agentId = periodicAgentId;
            syncTask = null;
            scheduler = null;
            syncInterval = null;
            periodicAgentId = null;
        }

        stopping.shutdown();
        try {
            if (!stopping.awaitTermination(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                stopping.shutdownNow();
            }
        } catch (InterruptedException e) {
            stopping.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Sync] Stopped periodic sync for agent {} on instance {}", agentId, instanceId);
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return syncTask != null;
        }
    }

    void tick(String agentId) {
        try {
            syncAgent(agentId);
        } catch (RuntimeException e) {
            log.error("[Sync] Periodic sync of agent {} failed: {}", agentId, e.getMessage(), e);
        }
    }

    // ==================== Sync pass ====================

    /**
     * Stage a local edit made against {@code baseVersion} (0 when the key did
     * not exist). A later edit of the same key replaces the staged one.
     */
    public void recordLocalChange(String agentId, MemoryType memoryType, String key, Object value,
            long baseVersion) {
        MemoryValidationException.requireId(agentId, "agentId");
        MemoryValidationException.requireId(key, "key");
        if (memoryType == null) {
            throw new MemoryValidationException("memoryType is required");
        }
        if (baseVersion < 0) {
            throw new MemoryValidationException("baseVersion must not be negative");
        }

        synchronized (lockFor(agentId)) {
            PendingChange change = new PendingChange(memoryType, key, value, baseVersion, clock.instant());
            staged(agentId).put(stagingKey(memoryType, key), change);
            SyncStatus status = loadStatus(agentId);
            status.setPendingChanges(status.getPendingChanges() + 1);
            memoryRepository.upsertSyncStatus(status);
        }
        log.debug("[Sync] Staged {} change {}/{} at base version {}", memoryType.getValue(), agentId, key,
                baseVersion);
    }

    /**
     * Run one synchronization pass for {@code agentId}. Step failures are
     * collected into the result instead of aborting the pass; the sync version
     * always advances and pending changes are always reset.
     */
    public SyncResult syncAgent(String agentId) {
        MemoryValidationException.requireId(agentId, "agentId");
        long started = clock.millis();
        Instant syncedAt = clock.instant();
        List<String> errors = new ArrayList<>();
        List<MemoryConflict> detected = new ArrayList<>();
        int workingCount = 0;
        int longtermCount = 0;
        int pushed = 0;

        synchronized (lockFor(agentId)) {
            SyncStatus status = loadStatus(agentId);
            status.setStatus(SyncState.SYNCING);
            status.setLastSyncAt(syncedAt);
            try {
                memoryRepository.upsertSyncStatus(status);
            } catch (RuntimeException e) {
                errors.add("failed to update sync status: " + e.getMessage());
            }

            Map<String, PendingChange> changes = staged(agentId);
            for (Map.Entry<String, PendingChange> entry : new ArrayList<>(changes.entrySet())) {
                PendingChange change = entry.getValue();
                try {
                    Optional<MemoryConflict> conflict = push(agentId, change, syncedAt);
                    if (conflict.isPresent()) {
                        detected.add(conflict.get());
                    } else {
                        changes.remove(entry.getKey(), change);
                        pushed++;
                    }
                } catch (RuntimeException e) {
                    log.warn("[Sync] Failed to push {} key {}/{}: {}", change.memoryType().getValue(), agentId,
                            change.key(), e.getMessage());
                    errors.add("failed to push " + change.memoryType().getValue() + " key " + change.key()
                            + ": " + e.getMessage());
                }
            }

            try {
                workingCount = memoryRepository.listWorking(agentId, MemoryFilters.none(), syncedAt).size();
            } catch (RuntimeException e) {
                errors.add("working memory sync error: " + e.getMessage());
            }
            try {
                longtermCount = memoryRepository.listLongterm(agentId, MemoryFilters.none()).size();
            } catch (RuntimeException e) {
                errors.add("longterm memory sync error: " + e.getMessage());
            }

            mergeConflicts(status, detected);
            if (!status.getConflicts().isEmpty()) {
                status.setStatus(SyncState.CONFLICT);
            } else if (!errors.isEmpty()) {
                status.setStatus(SyncState.ERROR);
            } else {
                status.setStatus(SyncState.SYNCED);
            }
            status.setPendingChanges(0);
            status.setSyncVersion(status.getSyncVersion() + 1);
            try {
                memoryRepository.upsertSyncStatus(status);
            } catch (RuntimeException e) {
                errors.add("failed to update final sync status: " + e.getMessage());
            }
        }

        SyncResult result = SyncResult.builder()
                .agentId(agentId)
                .instanceId(instanceId)
                .syncedAt(syncedAt)
                .durationMs(clock.millis() - started)
                .itemsSynced(workingCount + longtermCount)
                .workingCount(workingCount)
                .longtermCount(longtermCount)
                .conflicts(detected)
                .errors(errors)
                .success(errors.isEmpty())
                .build();

        log.info("[Sync] Agent {} synced on instance {}: {} items, {} pushed, {} conflicts, {} errors in {}ms",
                agentId, instanceId, result.getItemsSynced(), pushed, detected.size(), errors.size(),
                result.getDurationMs());
        return result;
    }

    // ==================== Conflicts ====================

    public List<ConflictResolution> resolveConflicts(String agentId) {
        return resolveConflicts(agentId, conflictStrategy);
    }

    /**
     * Resolve every open conflict of {@code agentId} and write the winners back:
     * a local winner overwrites the stored entry, a remote winner drops the
     * staged change.
     *
     * @throws ConflictResolutionException
     *             if any conflict stayed unresolved; the status keeps those
     *             conflicts and stays in {@code conflict}
     */
    public List<ConflictResolution> resolveConflicts(String agentId, ConflictStrategy strategy) {
        MemoryValidationException.requireId(agentId, "agentId");
        if (strategy == null) {
            throw new MemoryValidationException("strategy is required");
        }

        ConflictResolver.BatchOutcome outcome;
        synchronized (lockFor(agentId)) {
            SyncStatus status = loadStatus(agentId);
            if (status.getConflicts().isEmpty()) {
                return List.of();
            }
            Instant now = clock.instant();
            log.info("[Sync] Resolving {} conflicts of agent {} with strategy {}",
                    status.getConflicts().size(), agentId, strategy.getValue());
            outcome = conflictResolver.resolveAll(status, strategy,
                    resolution -> applyResolution(agentId, resolution, now));
            memoryRepository.upsertSyncStatus(status);
        }

        log.info("[Sync] Conflict resolution for agent {}: {} resolved, {} failed",
                agentId, outcome.resolved().size(), outcome.failures().size());
        if (!outcome.isComplete()) {
            throw new ConflictResolutionException(outcome.failures().size(), outcome.failures());
        }
        return outcome.resolved();
    }

    public List<MemoryConflict> getConflicts(String agentId) {
        return getSyncStatus(agentId).getConflicts();
    }

    // ==================== Overrides ====================

    /**
     * Write every staged change over the store without conflict detection.
     */
    public void forcePush(String agentId) {
        MemoryValidationException.requireId(agentId, "agentId");
        log.warn("[Sync] Force pushing local changes of agent {} from instance {}", agentId, instanceId);
        synchronized (lockFor(agentId)) {
            Instant now = clock.instant();
            Map<String, PendingChange> changes = staged(agentId);
            for (Map.Entry<String, PendingChange> entry : new ArrayList<>(changes.entrySet())) {
                PendingChange change = entry.getValue();
                overwrite(agentId, change.memoryType(), change.key(), change.value(), now);
                changes.remove(entry.getKey(), change);
            }
            markOverridden(agentId, SyncStatus.LAST_FORCE_PUSH, now);
        }
        log.info("[Sync] Force push completed for agent {}", agentId);
    }

    /**
     * Discard every staged change and accept the store as it is.
     */
    public void forcePull(String agentId) {
        MemoryValidationException.requireId(agentId, "agentId");
        log.warn("[Sync] Force pulling shared state of agent {} into instance {}", agentId, instanceId);
        synchronized (lockFor(agentId)) {
            stagedChanges.remove(agentId);
            markOverridden(agentId, SyncStatus.LAST_FORCE_PULL, clock.instant());
        }
        log.info("[Sync] Force pull completed for agent {}", agentId);
    }

    // ==================== Status ====================

    /**
     * Sync status of this instance, created as {@code synced} on first access.
     */
    public SyncStatus getSyncStatus(String agentId) {
        MemoryValidationException.requireId(agentId, "agentId");
        synchronized (lockFor(agentId)) {
            return loadStatus(agentId);
        }
    }

    public String getInstanceId() {
        return instanceId;
    }

    public ConflictStrategy getConflictStrategy() {
        return conflictStrategy;
    }

    public void setConflictStrategy(ConflictStrategy strategy) {
        if (strategy == null) {
            throw new MemoryValidationException("strategy is required");
        }
        this.conflictStrategy = strategy;
        log.info("[Sync] Conflict strategy set to {}", strategy.getValue());
    }

    // ==================== Internals ====================

    private SyncStatus loadStatus(String agentId) {
        return memoryRepository.findSyncStatus(agentId, instanceId)
                .orElseGet(() -> memoryRepository.upsertSyncStatus(SyncStatus.initial(agentId, instanceId)));
    }

    private void markOverridden(String agentId, String metadataKey, Instant now) {
        SyncStatus status = loadStatus(agentId);
        status.setConflicts(new ArrayList<>());
        status.setStatus(SyncState.SYNCED);
        status.setPendingChanges(0);
        status.setLastSyncAt(now);
        status.setSyncVersion(status.getSyncVersion() + 1);
        if (status.getMetadata() == null) {
            status.setMetadata(new LinkedHashMap<>());
        }
        status.getMetadata().put(metadataKey, now.toString());
        memoryRepository.upsertSyncStatus(status);
    }

    private static void mergeConflicts(SyncStatus status, List<MemoryConflict> detected) {
        List<MemoryConflict> merged = new ArrayList<>();
        for (MemoryConflict existing : status.getConflicts()) {
            boolean replaced = detected.stream()
                    .anyMatch(fresh -> fresh.sameTarget(existing.getMemoryType(), existing.getKey()));
            if (!replaced) {
                merged.add(existing);
            }
        }
        merged.addAll(detected);
        status.setConflicts(merged);
    }

    private void applyResolution(String agentId, ConflictResolution resolution, Instant now) {
        MemoryConflict conflict = resolution.conflict();
        if (resolution.localWins()) {
            overwrite(agentId, conflict.getMemoryType(), conflict.getKey(), resolution.winningValue(), now);
        }
        staged(agentId).remove(stagingKey(conflict.getMemoryType(), conflict.getKey()));
    }

    /**
     * Push one staged change with a version check.
     *
     * @return the conflict when the store moved past the change's base version
     */
    private Optional<MemoryConflict> push(String agentId, PendingChange change, Instant now) {
        StoredEntry current = findLive(agentId, change.memoryType(), change.key(), now);
        if (current == null) {
            if (change.baseVersion() != 0) {
                return Optional.of(conflict(change, null, now));
            }
            try {
                create(agentId, change.memoryType(), change.key(), change.value(), now);
                return Optional.empty();
            } catch (DuplicateMemoryException e) {
                return Optional.of(conflict(change, findLive(agentId, change.memoryType(), change.key(), now), now));
            }
        }
        if (current.version() != change.baseVersion()) {
            return Optional.of(conflict(change, current, now));
        }
        try {
            replace(agentId, change.memoryType(), change.key(), change.value(), current.version(), now);
            return Optional.empty();
        } catch (VersionConflictException e) {
            return Optional.of(conflict(change, findLive(agentId, change.memoryType(), change.key(), now), now));
        }
    }

    /**
     * Write {@code value} over whatever is stored, retrying when a concurrent
     * writer moves the version in between.
     */
    private void overwrite(String agentId, MemoryType memoryType, String key, Object value, Instant now) {
        for (int attempt = 1; attempt <= MAX_OVERWRITE_ATTEMPTS; attempt++) {
            StoredEntry current = findLive(agentId, memoryType, key, now);
            try {
                if (current == null) {
                    create(agentId, memoryType, key, value, now);
                } else {
                    replace(agentId, memoryType, key, value, current.version(), now);
                }
                return;
            } catch (VersionConflictException | DuplicateMemoryException e) {
                log.debug("[Sync] Overwrite of {}/{} raced with another writer (attempt {})", agentId, key, attempt);
            }
        }
        throw new MemoryException("Could not overwrite " + memoryType.getValue() + " key " + agentId + "/" + key
                + " after " + MAX_OVERWRITE_ATTEMPTS + " attempts");
    }

    private StoredEntry findLive(String agentId, MemoryType memoryType, String key, Instant now) {
        if (memoryType == MemoryType.WORKING) {
            return memoryRepository.findWorking(agentId, key)
                    .filter(memory -> !memory.isExpiredAt(now))
                    .map(memory -> new StoredEntry(memory.getValue(), memory.getVersion(), memory.getUpdatedAt()))
                    .orElse(null);
        }
        return memoryRepository.findLongterm(agentId, key)
                .map(memory -> new StoredEntry(memory.getValue(), memory.getVersion(), memory.getUpdatedAt()))
                .orElse(null);
    }

    private void create(String agentId, MemoryType memoryType, String key, Object value, Instant now) {
        if (memoryType == MemoryType.WORKING) {
            memoryRepository.createWorking(WorkingMemory.builder()
                    .id(UUID.randomUUID().toString())
                    .agentId(agentId)
                    .key(key)
                    .value(value)
                    .createdAt(now)
                    .updatedAt(now)
                    .accessedAt(now)
                    .expiresAt(now.plus(properties.getWorking().getDefaultTtl()))
                    .version(1)
                    .build(), now);
            return;
        }
        memoryRepository.createLongterm(LongtermMemory.builder()
                .id(UUID.randomUUID().toString())
                .agentId(agentId)
                .category(properties.getLongterm().getDefaultCategory())
                .key(key)
                .value(value)
                .createdAt(now)
                .updatedAt(now)
                .lastAccessed(now)
                .version(1)
                .build());
    }

    private void replace(String agentId, MemoryType memoryType, String key, Object value, long expectedVersion,
            Instant now) {
        if (memoryType == MemoryType.WORKING) {
            WorkingMemory next = memoryRepository.findWorking(agentId, key)
                    .orElseThrow(() -> new VersionConflictException(WorkingMemory.ENTITY_TYPE, agentId, key,
                            expectedVersion, 0));
            next.setValue(value);
            next.setUpdatedAt(now);
            next.setVersion(expectedVersion + 1);
            memoryRepository.updateWorking(next, expectedVersion);
            return;
        }
        LongtermMemory next = memoryRepository.findLongterm(agentId, key)
                .orElseThrow(() -> new VersionConflictException(LongtermMemory.ENTITY_TYPE, agentId, key,
                        expectedVersion, 0));
        next.setValue(value);
        next.setUpdatedAt(now);
        next.setVersion(expectedVersion + 1);
        memoryRepository.updateLongterm(next, expectedVersion);
    }

    private static MemoryConflict conflict(PendingChange change, StoredEntry remote, Instant detectedAt) {
        return MemoryConflict.builder()
                .key(change.key())
                .memoryType(change.memoryType())
                .localVersion(change.baseVersion() + 1)
                .remoteVersion(remote != null ? remote.version() : 0)
                .localValue(change.value())
                .remoteValue(remote != null ? remote.value() : null)
                .localTime(change.recordedAt())
                .remoteTime(remote != null ? remote.updatedAt() : null)
                .detectedAt(detectedAt)
                .build();
    }

    private Map<String, PendingChange> staged(String agentId) {
        return stagedChanges.computeIfAbsent(agentId, id -> new ConcurrentHashMap<>());
    }

    private Object lockFor(String agentId) {
        return agentLocks.computeIfAbsent(agentId, id -> new Object());
    }

    private static String stagingKey(MemoryType memoryType, String key) {
        return memoryType.getValue() + ":" + key;
    }

    private record StoredEntry(Object value, long version, Instant updatedAt) {
    }
}
