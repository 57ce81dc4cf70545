package me.golemcore.memory.domain.service;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.MemoryExpiredException;
import me.golemcore.memory.domain.exception.MemoryNotFoundException;
import me.golemcore.memory.domain.exception.MemoryValidationException;
import me.golemcore.memory.domain.exception.VersionConflictException;
import me.golemcore.memory.domain.model.MemoryFilters;
import me.golemcore.memory.domain.model.WorkingMemory;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Short-lived, TTL-bounded task context of an agent.
 *
 * <p>
 * Writes go through the optimistic-locking path of
 * {@link MemoryRepositoryPort}: every update names the version it was based on
 * and fails with {@link VersionConflictException} when another writer got
 * there first. Reads of an expired entry fail with
 * {@link MemoryExpiredException} and leave the cleanup to a background task.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkingMemoryService {

    private final MemoryRepositoryPort memoryRepository;
    private final MemoryProperties properties;
    private final MemoryTelemetryDispatcher telemetryDispatcher;
    private final Clock clock;

    public WorkingMemory store(String agentId, String key, Object value, Duration ttl) {
        return store(agentId, key, value, ttl, null);
    }

    /**
     * Create a new entry with version 1.
     *
     * @param ttl
     *            lifetime of the entry; {@code null} selects
     *            {@code memory.working.default-ttl}
     * @throws me.golemcore.memory.domain.exception.DuplicateMemoryException
     *             if a live entry already uses the key
     */
    public WorkingMemory store(String agentId, String key, Object value, Duration ttl, Map<String, Object> metadata) {
        MemoryValidationException.requireId(agentId, "agentId");
        MemoryValidationException.requireId(key, "key");
        Duration effectiveTtl = resolveTtl(ttl);

        Instant now = clock.instant();
        WorkingMemory memory = WorkingMemory.builder()
                .id(UUID.randomUUID().toString())
                .agentId(agentId)
                .key(key)
                .value(value)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .createdAt(now)
                .updatedAt(now)
                .accessedAt(now)
                .accessCount(0)
                .expiresAt(now.plus(effectiveTtl))
                .version(1)
                .build();

        memoryRepository.createWorking(memory, now);
        log.debug("[WorkingMemory] Stored {}/{} (ttl={})", agentId, key, effectiveTtl);
        return memory.copy();
    }

    /**
     * Value of a live entry.
     *
     * @throws MemoryNotFoundException
     *             if the key is absent
     * @throws MemoryExpiredException
     *             if the entry outlived its TTL
     */
    public Object retrieve(String agentId, String key) {
        return get(agentId, key).getValue();
    }

    /**
     * Whole live entry, including the version needed for a later
     * {@link #update(String, String, Object, long)}.
     */
    public WorkingMemory get(String agentId, String key) {
        WorkingMemory memory = requireLive(agentId, key);
        Instant accessedAt = clock.instant();
        telemetryDispatcher.dispatch("working access " + agentId + "/" + key,
                () -> memoryRepository.recordWorkingAccess(agentId, key, accessedAt));
        return memory;
    }

    /**
     * Read-modify-write using the version that is current at call time.
     */
    public WorkingMemory update(String agentId, String key, Object value) {
        WorkingMemory current = requireLive(agentId, key);
        return update(agentId, key, value, current.getVersion());
    }

    /**
     * Replace the value if the stored version still equals
     * {@code expectedVersion}; the stored version then grows by one.
     */
    public WorkingMemory update(String agentId, String key, Object value, long expectedVersion) {
        WorkingMemory current = requireLive(agentId, key);
        if (current.getVersion() != expectedVersion) {
            throw new VersionConflictException(WorkingMemory.ENTITY_TYPE, agentId, key,
                    expectedVersion, current.getVersion());
        }

        WorkingMemory next = current.copy();
        next.setValue(value);
        next.setUpdatedAt(clock.instant());
        next.setVersion(expectedVersion + 1);

        WorkingMemory updated = memoryRepository.updateWorking(next, expectedVersion);
        log.debug("[WorkingMemory] Updated {}/{} to version {}", agentId, key, updated.getVersion());
        return updated;
    }

    public void delete(String agentId, String key) {
        MemoryValidationException.requireId(agentId, "agentId");
        MemoryValidationException.requireId(key, "key");
        if (!memoryRepository.deleteWorking(agentId, key)) {
            throw new MemoryNotFoundException(WorkingMemory.ENTITY_TYPE, agentId, key);
        }
        log.debug("[WorkingMemory] Deleted {}/{}", agentId, key);
    }

    public int clear(String agentId) {
        MemoryValidationException.requireId(agentId, "agentId");
        int removed = memoryRepository.clearWorking(agentId);
        log.info("[WorkingMemory] Cleared {} entries for agent {}", removed, agentId);
        return removed;
    }

    /**
     * Live entries of an agent. Tag filters match on any intersection with
     * {@code metadata.tags}; the default order is newest first.
     */
    public List<WorkingMemory> list(String agentId, MemoryFilters filters) {
        MemoryValidationException.requireId(agentId, "agentId");
        MemoryFilterSupport.validate(filters, MemoryFilterSupport.WORKING_SORT_FIELDS);
        return memoryRepository.listWorking(agentId, filters, clock.instant());
    }

    private WorkingMemory requireLive(String agentId, String key) {
        MemoryValidationException.requireId(agentId, "agentId");
        MemoryValidationException.requireId(key, "key");

        WorkingMemory memory = memoryRepository.findWorking(agentId, key)
                .orElseThrow(() -> new MemoryNotFoundException(WorkingMemory.ENTITY_TYPE, agentId, key));
        Instant now = clock.instant();
        if (memory.isExpiredAt(now)) {
            telemetryDispatcher.dispatch("expired delete " + agentId + "/" + key,
                    () -> deleteIfStillExpired(agentId, key));
            throw new MemoryExpiredException(agentId, key, memory.getExpiresAt());
        }
        return memory;
    }

    private void deleteIfStillExpired(String agentId, String key) {
        if (memoryRepository.deleteWorkingIfExpired(agentId, key, clock.instant())) {
            log.debug("[WorkingMemory] Removed expired entry {}/{}", agentId, key);
        }
    }

    private Duration resolveTtl(Duration ttl) {
        Duration effective = ttl != null ? ttl : properties.getWorking().getDefaultTtl();
        if (effective == null || effective.isZero() || effective.isNegative()) {
            throw new MemoryValidationException("ttl must be positive");
        }
        return effective;
    }
}
