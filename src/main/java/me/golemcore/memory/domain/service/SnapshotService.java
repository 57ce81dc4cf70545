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
import me.golemcore.memory.domain.exception.DuplicateMemoryException;
import me.golemcore.memory.domain.exception.MemoryNotFoundException;
import me.golemcore.memory.domain.exception.MemoryValidationException;
import me.golemcore.memory.domain.exception.SnapshotIntegrityException;
import me.golemcore.memory.domain.exception.SnapshotOwnershipException;
import me.golemcore.memory.domain.model.LongtermMemory;
import me.golemcore.memory.domain.model.MemoryFilters;
import me.golemcore.memory.domain.model.RestoreReport;
import me.golemcore.memory.domain.model.SnapshotFilters;
import me.golemcore.memory.domain.model.SnapshotType;
import me.golemcore.memory.domain.model.StateSnapshot;
import me.golemcore.memory.domain.model.WorkingMemory;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Point-in-time capture and recovery of agent memory.
 *
 * <p>
 * A snapshot holds the working-memory inventory with the full live entries,
 * a long-term summary (per-category counts and key versions) and the capture
 * time. Restoring replaces working memory with the captured live entries and
 * bumps each restored version past anything stored for the key, so writers
 * holding a pre-restore version fail their next update. Long-term memory is
 * never rolled back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotService {

    static final String STATE_SNAPSHOT_TIME = "snapshot_time";
    static final String STATE_WORKING_KEYS = "working_memory_keys";
    static final String STATE_WORKING_COUNT = "working_memory_count";
    static final String STATE_WORKING_ENTRIES = "working_memory_entries";
    static final String STATE_LONGTERM_CATEGORIES = "longterm_memory_categories";
    static final String STATE_LONGTERM_COUNT = "longterm_memory_count";
    static final String STATE_LONGTERM_KEYS = "longterm_memory_keys";

    static final String ENTRY_KEY = "key";
    static final String ENTRY_VALUE = "value";
    static final String ENTRY_METADATA = "metadata";
    static final String ENTRY_CREATED_AT = "created_at";
    static final String ENTRY_EXPIRES_AT = "expires_at";
    static final String ENTRY_VERSION = "version";
    static final String ENTRY_CATEGORY = "category";

    static final String DEFAULT_REASON = "manual snapshot";
    static final String DEFAULT_TRIGGER = "service";

    private final MemoryRepositoryPort memoryRepository;
    private final MemoryProperties properties;
    private final SnapshotChecksums snapshotChecksums;
    private final Clock clock;

    /**
     * @param type
     *            wire name such as {@code periodic} or {@code pre-update}; blank
     *            means {@code manual}
     */
    public StateSnapshot create(String agentId, String type, String reason) {
        return create(agentId, parseType(type), reason, DEFAULT_TRIGGER);
    }

    public StateSnapshot create(String agentId, SnapshotType type, String reason, String trigger) {
        MemoryValidationException.requireId(agentId, "agentId");
        SnapshotType effectiveType = type != null ? type : SnapshotType.MANUAL;
        Instant now = clock.instant();

        Map<String, Object> state = snapshotChecksums.normalize(captureState(agentId, now));
        String canonical = snapshotChecksums.canonicalJson(state);

        StateSnapshot snapshot = StateSnapshot.builder()
                .id(UUID.randomUUID().toString())
                .agentId(agentId)
                .snapshotType(effectiveType)
                .state(state)
                .checksum(SnapshotChecksums.sha256Hex(canonical))
                .metadata(StateSnapshot.SnapshotMetadata.builder()
                        .trigger(trigger == null || trigger.isBlank() ? DEFAULT_TRIGGER : trigger)
                        .reason(reason == null || reason.isBlank() ? DEFAULT_REASON : reason)
                        .sizeBytes(canonical.getBytes(StandardCharsets.UTF_8).length)
                        .compressed(false)
                        .build())
                .createdAt(now)
                .expiresAt(now.plus(properties.getSnapshot().getRetention().forType(effectiveType)))
                .version(1)
                .build();

        memoryRepository.createSnapshot(snapshot);
        log.info("[Snapshot] Created {} snapshot {} for agent {} ({} bytes)",
                effectiveType.getValue(), snapshot.getId(), agentId, snapshot.getMetadata().getSizeBytes());
        return snapshot;
    }

    /**
     * Replace the working memory of {@code agentId} with the live entries
     * captured in the snapshot. Ownership and checksum are verified before
     * anything is changed.
     *
     * @throws SnapshotOwnershipException
     *             if the snapshot belongs to another agent
     * @throws SnapshotIntegrityException
     *             if the state no longer matches its checksum
     */
    public RestoreReport restore(String agentId, String snapshotId) {
        MemoryValidationException.requireId(agentId, "agentId");
        StateSnapshot snapshot = get(snapshotId);
        if (!agentId.equals(snapshot.getAgentId())) {
            throw new SnapshotOwnershipException(snapshotId, agentId);
        }
        if (!snapshotChecksums.verify(snapshot)) {
            throw new SnapshotIntegrityException(snapshotId);
        }

        Instant now = clock.instant();
        List<Map<String, Object>> entries = capturedEntries(snapshot);

        Map<String, Long> storedVersions = new HashMap<>();
        for (Map<String, Object> entry : entries) {
            String key = (String) entry.get(ENTRY_KEY);
            memoryRepository.findWorking(agentId, key)
                    .ifPresent(current -> storedVersions.put(key, current.getVersion()));
        }

        int cleared = memoryRepository.clearWorking(agentId);
        List<String> restored = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (Map<String, Object> entry : entries) {
            String key = (String) entry.get(ENTRY_KEY);
            Instant expiresAt = parseInstant(entry.get(ENTRY_EXPIRES_AT));
            if (expiresAt != null && now.isAfter(expiresAt)) {
                skipped.add(key);
                continue;
            }
            WorkingMemory memory = WorkingMemory.builder()
                    .id(UUID.randomUUID().toString())
                    .agentId(agentId)
                    .key(key)
                    .value(entry.get(ENTRY_VALUE))
                    .metadata(toMetadata(entry.get(ENTRY_METADATA)))
                    .createdAt(orElse(parseInstant(entry.get(ENTRY_CREATED_AT)), now))
                    .updatedAt(now)
                    .accessedAt(now)
                    .accessCount(0)
                    .expiresAt(expiresAt)
                    .version(storedVersions.getOrDefault(key, 0L) + 1)
                    .build();
            try {
                memoryRepository.createWorking(memory, now);
                restored.add(key);
            } catch (DuplicateMemoryException e) {
                log.warn("[Snapshot] Key {}/{} was re-created during restore, keeping the newer entry",
                        agentId, key);
                skipped.add(key);
            }
        }

        log.info("[Snapshot] Restored snapshot {} for agent {}: {} cleared, {} restored, {} skipped",
                snapshotId, agentId, cleared, restored.size(), skipped.size());
        return RestoreReport.builder()
                .agentId(agentId)
                .snapshotId(snapshotId)
                .clearedCount(cleared)
                .restoredKeys(restored)
                .skippedExpiredKeys(skipped)
                .restoredAt(now)
                .build();
    }

    public StateSnapshot get(String snapshotId) {
        MemoryValidationException.requireId(snapshotId, "snapshotId");
        return memoryRepository.findSnapshot(snapshotId)
                .orElseThrow(() -> new MemoryNotFoundException(StateSnapshot.ENTITY_TYPE, snapshotId));
    }

    /**
     * Snapshots of an agent, newest first.
     */
    public List<StateSnapshot> list(String agentId, SnapshotFilters filters) {
        MemoryValidationException.requireId(agentId, "agentId");
        if (filters != null) {
            MemoryFilterSupport.validatePage(filters.getLimit(), filters.getOffset());
        }
        return memoryRepository.listSnapshots(agentId, filters);
    }

    public void delete(String snapshotId) {
        MemoryValidationException.requireId(snapshotId, "snapshotId");
        if (!memoryRepository.deleteSnapshot(snapshotId)) {
            throw new MemoryNotFoundException(StateSnapshot.ENTITY_TYPE, snapshotId);
        }
        log.debug("[Snapshot] Deleted snapshot {}", snapshotId);
    }

    private Map<String, Object> captureState(String agentId, Instant now) {
        List<WorkingMemory> working = memoryRepository.listWorking(agentId, MemoryFilters.builder()
                .sortBy(MemoryFilters.SORT_KEY)
                .build(), now);
        List<String> workingKeys = new ArrayList<>(working.size());
        List<Map<String, Object>> workingEntries = new ArrayList<>(working.size());
        for (WorkingMemory memory : working) {
            workingKeys.add(memory.getKey());
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(ENTRY_KEY, memory.getKey());
            entry.put(ENTRY_VALUE, memory.getValue());
            entry.put(ENTRY_METADATA, memory.getMetadata());
            entry.put(ENTRY_CREATED_AT, toText(memory.getCreatedAt()));
            entry.put(ENTRY_EXPIRES_AT, toText(memory.getExpiresAt()));
            entry.put(ENTRY_VERSION, memory.getVersion());
            workingEntries.add(entry);
        }

        List<LongtermMemory> longterm = memoryRepository.listLongterm(agentId, MemoryFilters.builder()
                .sortBy(MemoryFilters.SORT_KEY)
                .build());
        Map<String, Integer> categoryCounts = new TreeMap<>();
        List<Map<String, Object>> longtermKeys = new ArrayList<>(longterm.size());
        for (LongtermMemory memory : longterm) {
            categoryCounts.merge(memory.getCategory(), 1, Integer::sum);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(ENTRY_KEY, memory.getKey());
            entry.put(ENTRY_CATEGORY, memory.getCategory());
            entry.put(ENTRY_VERSION, memory.getVersion());
            longtermKeys.add(entry);
        }

        Map<String, Object> state = new LinkedHashMap<>();
        state.put(STATE_WORKING_KEYS, workingKeys);
        state.put(STATE_WORKING_COUNT, workingKeys.size());
        state.put(STATE_WORKING_ENTRIES, workingEntries);
        state.put(STATE_LONGTERM_CATEGORIES, categoryCounts);
        state.put(STATE_LONGTERM_COUNT, longterm.size());
        state.put(STATE_LONGTERM_KEYS, longtermKeys);
        state.put(STATE_SNAPSHOT_TIME, now.toString());
        return state;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> capturedEntries(StateSnapshot snapshot) {
        Object raw = snapshot.getState().get(STATE_WORKING_ENTRIES);
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> entries = new ArrayList<>(list.size());
        for (Object element : list) {
            if (element instanceof Map<?, ?> map && map.get(ENTRY_KEY) instanceof String) {
                entries.add((Map<String, Object>) map);
            }
        }
        return entries;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> toMetadata(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        return new LinkedHashMap<>();
    }

    private static SnapshotType parseType(String type) {
        if (type == null || type.isBlank()) {
            return SnapshotType.MANUAL;
        }
        try {
            return SnapshotType.fromValue(type);
        } catch (IllegalArgumentException e) {
            throw new MemoryValidationException(e.getMessage());
        }
    }

    private static String toText(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static Instant parseInstant(Object raw) {
        if (!(raw instanceof String text) || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.debug("[Snapshot] Ignoring malformed timestamp: {}", text);
            return null;
        }
    }

    private static Instant orElse(Instant value, Instant fallback) {
        return value != null ? value : fallback;
    }
}
