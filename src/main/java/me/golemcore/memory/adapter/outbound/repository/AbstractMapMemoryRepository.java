package me.golemcore.memory.adapter.outbound.repository;

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
import me.golemcore.memory.domain.exception.DuplicateMemoryException;
import me.golemcore.memory.domain.exception.MemoryNotFoundException;
import me.golemcore.memory.domain.exception.VersionConflictException;
import me.golemcore.memory.domain.model.LongtermMemory;
import me.golemcore.memory.domain.model.MemoryFilters;
import me.golemcore.memory.domain.model.MemoryMetadata;
import me.golemcore.memory.domain.model.MemoryQuery;
import me.golemcore.memory.domain.model.SnapshotFilters;
import me.golemcore.memory.domain.model.StateSnapshot;
import me.golemcore.memory.domain.model.SyncStatus;
import me.golemcore.memory.domain.model.WorkingMemory;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Map-backed repository shared by the in-process and the file-backed adapters.
 *
 * <p>
 * Entries live in per-agent {@link ConcurrentHashMap}s. Every mutation of a
 * single key runs inside {@code compute}, so version checks and writes are
 * atomic per key without any global lock. Entities are copied on the way in
 * and on the way out.
 *
 * <p>
 * Subclasses observe successful mutations through the {@code on*Changed}
 * hooks, which run after the map has been updated. A hook that throws rolls
 * the affected keys back to their previous values before the exception
 * reaches the caller, so a failed write leaves no trace in memory.
 */
public abstract class AbstractMapMemoryRepository implements MemoryRepositoryPort {

    protected final Map<String, Map<String, WorkingMemory>> workingByAgent = new ConcurrentHashMap<>();
    protected final Map<String, Map<String, LongtermMemory>> longtermByAgent = new ConcurrentHashMap<>();
    protected final Map<String, StateSnapshot> snapshotsById = new ConcurrentHashMap<>();
    protected final Map<String, Map<String, SyncStatus>> syncByAgent = new ConcurrentHashMap<>();

    // ==================== Working memory ====================

    @Override
    public void createWorking(WorkingMemory memory, Instant now) {
        WorkingMemory stored = copyOf(memory);
        Map<String, WorkingMemory> entries = working(memory.getAgentId());
        AtomicReference<WorkingMemory> previous = new AtomicReference<>();
        entries.compute(memory.getKey(), (key, existing) -> {
            if (existing != null && !existing.isExpiredAt(now)) {
                throw new DuplicateMemoryException(WorkingMemory.ENTITY_TYPE, memory.getAgentId(), key);
            }
            previous.set(existing);
            return stored;
        });
        notifyOrRollback(entries, memory.getKey(), previous.get(), stored,
                () -> onWorkingChanged(memory.getAgentId()));
    }

    @Override
    public Optional<WorkingMemory> findWorking(String agentId, String key) {
        Map<String, WorkingMemory> entries = workingByAgent.get(agentId);
        if (entries == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(key)).map(AbstractMapMemoryRepository::copyOf);
    }

    @Override
    public WorkingMemory updateWorking(WorkingMemory memory, long expectedVersion) {
        WorkingMemory replacement = copyOf(memory);
        Map<String, WorkingMemory> entries = working(memory.getAgentId());
        AtomicReference<WorkingMemory> previous = new AtomicReference<>();
        entries.compute(memory.getKey(), (key, existing) -> {
            if (existing == null) {
                throw new MemoryNotFoundException(WorkingMemory.ENTITY_TYPE, memory.getAgentId(), key);
            }
            if (existing.getVersion() != expectedVersion) {
                throw new VersionConflictException(WorkingMemory.ENTITY_TYPE, memory.getAgentId(), key,
                        expectedVersion, existing.getVersion());
            }
            previous.set(existing);
            return replacement;
        });
        notifyOrRollback(entries, memory.getKey(), previous.get(), replacement,
                () -> onWorkingChanged(memory.getAgentId()));
        return copyOf(replacement);
    }

    @Override
    public boolean deleteWorking(String agentId, String key) {
        Map<String, WorkingMemory> entries = workingByAgent.get(agentId);
        WorkingMemory removed = entries != null ? entries.remove(key) : null;
        if (removed == null) {
            return false;
        }
        notifyOrRollback(entries, key, removed, null, () -> onWorkingChanged(agentId));
        return true;
    }

    @Override
    public boolean deleteWorkingIfExpired(String agentId, String key, Instant now) {
        Map<String, WorkingMemory> entries = workingByAgent.get(agentId);
        if (entries == null) {
            return false;
        }
        AtomicReference<WorkingMemory> removed = new AtomicReference<>();
        entries.computeIfPresent(key, (k, existing) -> {
            if (!existing.isExpiredAt(now)) {
                return existing;
            }
            removed.set(existing);
            return null;
        });
        if (removed.get() == null) {
            return false;
        }
        notifyOrRollback(entries, key, removed.get(), null, () -> onWorkingChanged(agentId));
        return true;
    }

    @Override
    public int clearWorking(String agentId) {
        Map<String, WorkingMemory> entries = workingByAgent.get(agentId);
        if (entries == null) {
            return 0;
        }
        Map<String, WorkingMemory> removed = new LinkedHashMap<>();
        for (String key : new ArrayList<>(entries.keySet())) {
            WorkingMemory memory = entries.remove(key);
            if (memory != null) {
                removed.put(key, memory);
            }
        }
        if (!removed.isEmpty()) {
            notifyOrRestore(entries, removed, () -> onWorkingChanged(agentId));
        }
        return removed.size();
    }

    @Override
    public List<WorkingMemory> listWorking(String agentId, MemoryFilters filters, Instant now) {
        MemoryFilters effective = filters != null ? filters : MemoryFilters.none();
        Stream<WorkingMemory> stream = valuesOf(workingByAgent, agentId).stream()
                .filter(memory -> !memory.isExpiredAt(now))
                .filter(memory -> matchesTags(memory.getTags(), effective.getTags()))
                .filter(memory -> withinWindow(memory.getCreatedAt(), effective));
        return paginate(stream.sorted(workingOrder(effective)), effective.getOffset(), effective.getLimit())
                .map(AbstractMapMemoryRepository::copyOf)
                .toList();
    }

    @Override
    public void recordWorkingAccess(String agentId, String key, Instant accessedAt) {
        Map<String, WorkingMemory> entries = workingByAgent.get(agentId);
        if (entries == null) {
            return;
        }
        AtomicReference<WorkingMemory> previous = new AtomicReference<>();
        WorkingMemory bumped = entries.computeIfPresent(key, (k, existing) -> {
            WorkingMemory next = copyOf(existing);
            next.setAccessCount(existing.getAccessCount() + 1);
            next.setAccessedAt(accessedAt);
            previous.set(existing);
            return next;
        });
        if (bumped != null) {
            notifyOrRollback(entries, key, previous.get(), bumped, () -> onWorkingChanged(agentId));
        }
    }

    // ==================== Long-term memory ====================

    @Override
    public void createLongterm(LongtermMemory memory) {
        LongtermMemory stored = copyOf(memory);
        Map<String, LongtermMemory> entries = longterm(memory.getAgentId());
        if (entries.putIfAbsent(memory.getKey(), stored) != null) {
            throw new DuplicateMemoryException(LongtermMemory.ENTITY_TYPE, memory.getAgentId(), memory.getKey());
        }
        notifyOrRollback(entries, memory.getKey(), null, stored, () -> onLongtermChanged(memory.getAgentId()));
    }

    @Override
    public Optional<LongtermMemory> findLongterm(String agentId, String key) {
        Map<String, LongtermMemory> entries = longtermByAgent.get(agentId);
        if (entries == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(key)).map(AbstractMapMemoryRepository::copyOf);
    }

    @Override
    public LongtermMemory updateLongterm(LongtermMemory memory, long expectedVersion) {
        LongtermMemory replacement = copyOf(memory);
        Map<String, LongtermMemory> entries = longterm(memory.getAgentId());
        AtomicReference<LongtermMemory> previous = new AtomicReference<>();
        entries.compute(memory.getKey(), (key, existing) -> {
            if (existing == null) {
                throw new MemoryNotFoundException(LongtermMemory.ENTITY_TYPE, memory.getAgentId(), key);
            }
            if (existing.getVersion() != expectedVersion) {
                throw new VersionConflictException(LongtermMemory.ENTITY_TYPE, memory.getAgentId(), key,
                        expectedVersion, existing.getVersion());
            }
            previous.set(existing);
            return replacement;
        });
        notifyOrRollback(entries, memory.getKey(), previous.get(), replacement,
                () -> onLongtermChanged(memory.getAgentId()));
        return copyOf(replacement);
    }

    @Override
    public boolean deleteLongterm(String agentId, String key) {
        Map<String, LongtermMemory> entries = longtermByAgent.get(agentId);
        LongtermMemory removed = entries != null ? entries.remove(key) : null;
        if (removed == null) {
            return false;
        }
        notifyOrRollback(entries, key, removed, null, () -> onLongtermChanged(agentId));
        return true;
    }

    @Override
    public List<LongtermMemory> listLongterm(String agentId, MemoryFilters filters) {
        return selectLongterm(agentId, filters, null);
    }

    @Override
    public List<LongtermMemory> searchLongterm(String agentId, MemoryQuery query) {
        if (query == null) {
            return selectLongterm(agentId, null, null);
        }
        return selectLongterm(agentId, query.getFilters(), query.getQuery());
    }

    @Override
    public void recordLongtermAccess(String agentId, String key, Instant accessedAt) {
        Map<String, LongtermMemory> entries = longtermByAgent.get(agentId);
        if (entries == null) {
            return;
        }
        AtomicReference<LongtermMemory> previous = new AtomicReference<>();
        LongtermMemory bumped = entries.computeIfPresent(key, (k, existing) -> {
            LongtermMemory next = copyOf(existing);
            next.setAccessCount(existing.getAccessCount() + 1);
            next.setLastAccessed(accessedAt);
            previous.set(existing);
            return next;
        });
        if (bumped != null) {
            notifyOrRollback(entries, key, previous.get(), bumped, () -> onLongtermChanged(agentId));
        }
    }

    private List<LongtermMemory> selectLongterm(String agentId, MemoryFilters filters, String text) {
        MemoryFilters effective = filters != null ? filters : MemoryFilters.none();
        String needle = text == null || text.isBlank() ? null : text.trim().toLowerCase(Locale.ROOT);
        Stream<LongtermMemory> stream = valuesOf(longtermByAgent, agentId).stream()
                .filter(memory -> effective.getCategory() == null
                        || effective.getCategory().equals(memory.getCategory()))
                .filter(memory -> matchesTags(tagsOf(memory), effective.getTags()))
                .filter(memory -> effective.getMinImportance() == null
                        || importanceOf(memory) >= effective.getMinImportance())
                .filter(memory -> withinWindow(memory.getCreatedAt(), effective))
                .filter(memory -> needle == null || matchesText(memory, needle));
        return paginate(stream.sorted(longtermOrder(effective)), effective.getOffset(), effective.getLimit())
                .map(AbstractMapMemoryRepository::copyOf)
                .toList();
    }

    private static boolean matchesText(LongtermMemory memory, String needle) {
        if (containsIgnoreCase(memory.getKey(), needle) || containsIgnoreCase(memory.getCategory(), needle)) {
            return true;
        }
        for (String tag : tagsOf(memory)) {
            if (containsIgnoreCase(tag, needle)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsIgnoreCase(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    // ==================== Snapshots ====================

    @Override
    public void createSnapshot(StateSnapshot snapshot) {
        StateSnapshot stored = copyOf(snapshot);
        if (snapshotsById.putIfAbsent(snapshot.getId(), stored) != null) {
            throw new DuplicateMemoryException(StateSnapshot.ENTITY_TYPE, snapshot.getAgentId(), snapshot.getId());
        }
        notifyOrRollback(snapshotsById, snapshot.getId(), null, stored, () -> onSnapshotSaved(snapshot));
    }

    @Override
    public Optional<StateSnapshot> findSnapshot(String snapshotId) {
        return Optional.ofNullable(snapshotsById.get(snapshotId)).map(AbstractMapMemoryRepository::copyOf);
    }

    @Override
    public List<StateSnapshot> listSnapshots(String agentId, SnapshotFilters filters) {
        SnapshotFilters effective = filters != null ? filters : SnapshotFilters.none();
        Stream<StateSnapshot> stream = snapshotsById.values().stream()
                .filter(snapshot -> agentId.equals(snapshot.getAgentId()))
                .filter(snapshot -> effective.getSnapshotType() == null
                        || effective.getSnapshotType() == snapshot.getSnapshotType())
                .filter(snapshot -> effective.getAfterTime() == null
                        || !snapshot.getCreatedAt().isBefore(effective.getAfterTime()))
                .filter(snapshot -> effective.getBeforeTime() == null
                        || !snapshot.getCreatedAt().isAfter(effective.getBeforeTime()))
                .sorted(Comparator.comparing(StateSnapshot::getCreatedAt,
                        Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed()
                        .thenComparing(StateSnapshot::getId));
        return paginate(stream, effective.getOffset(), effective.getLimit())
                .map(AbstractMapMemoryRepository::copyOf)
                .toList();
    }

    @Override
    public boolean deleteSnapshot(String snapshotId) {
        StateSnapshot removed = snapshotsById.remove(snapshotId);
        if (removed == null) {
            return false;
        }
        notifyOrRollback(snapshotsById, snapshotId, removed, null, () -> onSnapshotDeleted(snapshotId));
        return true;
    }

    // ==================== Sync status ====================

    @Override
    public Optional<SyncStatus> findSyncStatus(String agentId, String instanceId) {
        Map<String, SyncStatus> statuses = syncByAgent.get(agentId);
        if (statuses == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(statuses.get(instanceId)).map(SyncStatus::copy);
    }

    @Override
    public SyncStatus upsertSyncStatus(SyncStatus status) {
        SyncStatus stored = status.copy();
        Map<String, SyncStatus> statuses = syncByAgent.computeIfAbsent(status.getAgentId(),
                id -> new ConcurrentHashMap<>());
        SyncStatus previous = statuses.put(status.getInstanceId(), stored);
        notifyOrRollback(statuses, status.getInstanceId(), previous, stored,
                () -> onSyncStatusChanged(status.getAgentId()));
        return stored.copy();
    }

    @Override
    public List<SyncStatus> listSyncStatuses(String agentId) {
        return valuesOf(syncByAgent, agentId).stream()
                .sorted(Comparator.comparing(SyncStatus::getInstanceId))
                .map(SyncStatus::copy)
                .toList();
    }

    // ==================== Maintenance ====================

    @Override
    public int deleteExpiredWorking(Instant now) {
        int removed = 0;
        for (Map.Entry<String, Map<String, WorkingMemory>> agentEntries : workingByAgent.entrySet()) {
            Map<String, WorkingMemory> removedForAgent = new LinkedHashMap<>();
            Map<String, WorkingMemory> entries = agentEntries.getValue();
            for (Map.Entry<String, WorkingMemory> entry : entries.entrySet()) {
                // Conditional remove keeps an entry re-created concurrently under the same key
                if (entry.getValue().isExpiredAt(now) && entries.remove(entry.getKey(), entry.getValue())) {
                    removedForAgent.put(entry.getKey(), entry.getValue());
                }
            }
            if (!removedForAgent.isEmpty()) {
                notifyOrRestore(entries, removedForAgent, () -> onWorkingChanged(agentEntries.getKey()));
                removed += removedForAgent.size();
            }
        }
        return removed;
    }

    @Override
    public int deleteExpiredSnapshots(Instant now) {
        int removed = 0;
        for (Map.Entry<String, StateSnapshot> entry : snapshotsById.entrySet()) {
            if (entry.getValue().isExpiredAt(now) && snapshotsById.remove(entry.getKey(), entry.getValue())) {
                notifyOrRollback(snapshotsById, entry.getKey(), entry.getValue(), null,
                        () -> onSnapshotDeleted(entry.getKey()));
                removed++;
            }
        }
        return removed;
    }

    // ==================== Hooks ====================

    protected void onWorkingChanged(String agentId) {
    }

    protected void onLongtermChanged(String agentId) {
    }

    protected void onSnapshotSaved(StateSnapshot snapshot) {
    }

    protected void onSnapshotDeleted(String snapshotId) {
    }

    protected void onSyncStatusChanged(String agentId) {
    }

    // ==================== Rollback ====================

    /**
     * Runs the change hook for a single key and, if it fails, puts back the
     * value the key held before the mutation. The restore is conditional on the
     * key still holding {@code current}, so a newer concurrent write survives.
     */
    private static <T> void notifyOrRollback(Map<String, T> entries, String key, T previous, T current,
            Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            if (previous == null) {
                entries.remove(key, current);
            } else if (current == null) {
                entries.putIfAbsent(key, previous);
            } else {
                entries.replace(key, current, previous);
            }
            throw e;
        }
    }

    private static <T> void notifyOrRestore(Map<String, T> entries, Map<String, T> removed, Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            removed.forEach(entries::putIfAbsent);
            throw e;
        }
    }

    // ==================== Helpers ====================

    protected Map<String, WorkingMemory> working(String agentId) {
        return workingByAgent.computeIfAbsent(agentId, id -> new ConcurrentHashMap<>());
    }

    protected Map<String, LongtermMemory> longterm(String agentId) {
        return longtermByAgent.computeIfAbsent(agentId, id -> new ConcurrentHashMap<>());
    }

    private static <T> Collection<T> valuesOf(Map<String, Map<String, T>> byAgent, String agentId) {
        Map<String, T> entries = byAgent.get(agentId);
        return entries != null ? entries.values() : List.of();
    }

    private static boolean matchesTags(List<String> entryTags, List<String> wanted) {
        if (wanted == null || wanted.isEmpty()) {
            return true;
        }
        Set<String> present = new LinkedHashSet<>(entryTags);
        for (String tag : wanted) {
            if (present.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    private static boolean withinWindow(Instant createdAt, MemoryFilters filters) {
        if (filters.getAfterTime() != null && (createdAt == null || createdAt.isBefore(filters.getAfterTime()))) {
            return false;
        }
        return filters.getBeforeTime() == null
                || (createdAt != null && !createdAt.isAfter(filters.getBeforeTime()));
    }

    private static <T> Stream<T> paginate(Stream<T> sorted, Integer offset, Integer limit) {
        Stream<T> result = sorted;
        if (offset != null && offset > 0) {
            result = result.skip(offset);
        }
        if (limit != null && limit > 0) {
            result = result.limit(limit);
        }
        return result;
    }

    private static Comparator<WorkingMemory> workingOrder(MemoryFilters filters) {
        String sortBy = filters.getSortBy();
        if (sortBy == null || sortBy.isBlank()) {
            return byInstant(WorkingMemory::getCreatedAt).reversed().thenComparing(WorkingMemory::getKey);
        }
        Comparator<WorkingMemory> order = switch (sortBy) {
        case MemoryFilters.SORT_UPDATED_AT -> byInstant(WorkingMemory::getUpdatedAt);
        case MemoryFilters.SORT_ACCESSED_AT -> byInstant(WorkingMemory::getAccessedAt);
        case MemoryFilters.SORT_EXPIRES_AT -> byInstant(WorkingMemory::getExpiresAt);
        case MemoryFilters.SORT_ACCESS_COUNT -> Comparator.comparingLong(WorkingMemory::getAccessCount);
        case MemoryFilters.SORT_KEY -> Comparator.comparing(WorkingMemory::getKey);
        case MemoryFilters.SORT_VERSION -> Comparator.comparingLong(WorkingMemory::getVersion);
        default -> byInstant(WorkingMemory::getCreatedAt);
        };
        if (filters.isSortDesc()) {
            order = order.reversed();
        }
        return order.thenComparing(WorkingMemory::getKey);
    }

    private static Comparator<LongtermMemory> longtermOrder(MemoryFilters filters) {
        String sortBy = filters.getSortBy();
        if (sortBy == null || sortBy.isBlank()) {
            return Comparator.comparingInt(AbstractMapMemoryRepository::importanceOf).reversed()
                    .thenComparing(byInstant(LongtermMemory::getCreatedAt).reversed())
                    .thenComparing(LongtermMemory::getKey);
        }
        Comparator<LongtermMemory> order = switch (sortBy) {
        case MemoryFilters.SORT_IMPORTANCE -> Comparator.comparingInt(AbstractMapMemoryRepository::importanceOf);
        case MemoryFilters.SORT_UPDATED_AT -> byInstant(LongtermMemory::getUpdatedAt);
        case MemoryFilters.SORT_ACCESSED_AT -> byInstant(LongtermMemory::getLastAccessed);
        case MemoryFilters.SORT_ACCESS_COUNT -> Comparator.comparingLong(LongtermMemory::getAccessCount);
        case MemoryFilters.SORT_KEY -> Comparator.comparing(LongtermMemory::getKey);
        case MemoryFilters.SORT_VERSION -> Comparator.comparingLong(LongtermMemory::getVersion);
        default -> byInstant(LongtermMemory::getCreatedAt);
        };
        if (filters.isSortDesc()) {
            order = order.reversed();
        }
        return order.thenComparing(LongtermMemory::getKey);
    }

    private static <T> Comparator<T> byInstant(Function<T, Instant> getter) {
        return Comparator.comparing(getter, Comparator.nullsFirst(Comparator.naturalOrder()));
    }

    private static int importanceOf(LongtermMemory memory) {
        return memory.getMetadata() != null ? memory.getMetadata().getImportance()
                : MemoryMetadata.DEFAULT_IMPORTANCE;
    }

    private static List<String> tagsOf(LongtermMemory memory) {
        if (memory.getMetadata() == null || memory.getMetadata().getTags() == null) {
            return List.of();
        }
        return memory.getMetadata().getTags();
    }

    protected static WorkingMemory copyOf(WorkingMemory memory) {
        WorkingMemory copy = memory.copy();
        copy.setValue(deepCopy(memory.getValue()));
        return copy;
    }

    protected static LongtermMemory copyOf(LongtermMemory memory) {
        LongtermMemory copy = memory.copy();
        copy.setValue(deepCopy(memory.getValue()));
        return copy;
    }

    @SuppressWarnings("unchecked")
    protected static StateSnapshot copyOf(StateSnapshot snapshot) {
        StateSnapshot.SnapshotMetadata metadata = snapshot.getMetadata();
        return snapshot.toBuilder()
                .state(snapshot.getState() != null ? (Map<String, Object>) deepCopy(snapshot.getState())
                        : new LinkedHashMap<>())
                .metadata(metadata != null ? metadata.toBuilder().build() : new StateSnapshot.SnapshotMetadata())
                .build();
    }

    /**
     * Copy JSON-compatible values so nested maps and lists are detached from the
     * stored entity. Scalars are immutable and shared.
     */
    protected static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(entry.getKey(), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(deepCopy(element));
            }
            return copy;
        }
        return value;
    }
}
