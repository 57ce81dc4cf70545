package me.golemcore.memory.port.outbound;

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
import me.golemcore.memory.domain.model.LongtermMemory;
import me.golemcore.memory.domain.model.MemoryFilters;
import me.golemcore.memory.domain.model.MemoryQuery;
import me.golemcore.memory.domain.model.SnapshotFilters;
import me.golemcore.memory.domain.model.StateSnapshot;
import me.golemcore.memory.domain.model.SyncStatus;
import me.golemcore.memory.domain.model.WorkingMemory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence capability consumed by the memory services. Implementations may
 * be backed by a document database, a relational database or plain maps; all of
 * them must honour the contracts below.
 *
 * <p>
 * Every returned entity is a detached copy: mutating it never changes stored
 * state. Versioned updates are compare-and-swap operations: the stored version
 * must equal {@code expectedVersion}, otherwise
 * {@link me.golemcore.memory.domain.exception.VersionConflictException} is
 * thrown and nothing is written. Backing-store failures surface as
 * {@link me.golemcore.memory.domain.exception.RepositoryException}.
 */
public interface MemoryRepositoryPort {

    // ==================== Working memory ====================

    /**
     * Insert a new entry. A live entry with the same key causes
     * {@link me.golemcore.memory.domain.exception.DuplicateMemoryException}; an
     * entry already expired at {@code now} is replaced.
     */
    void createWorking(WorkingMemory memory, Instant now);

    Optional<WorkingMemory> findWorking(String agentId, String key);

    /**
     * Replace the stored entry if its version equals {@code expectedVersion}.
     * The caller supplies the entity with the new version and timestamps.
     */
    WorkingMemory updateWorking(WorkingMemory memory, long expectedVersion);

    boolean deleteWorking(String agentId, String key);

    /**
     * Remove the entry only if it is still expired at {@code now}. An entry
     * stored again under the same key after it expired is left untouched.
     */
    boolean deleteWorkingIfExpired(String agentId, String key, Instant now);

    int clearWorking(String agentId);

    /**
     * Filtered, sorted and paginated listing of entries live at {@code now}.
     */
    List<WorkingMemory> listWorking(String agentId, MemoryFilters filters, Instant now);

    /**
     * Access telemetry; never changes version or value.
     */
    void recordWorkingAccess(String agentId, String key, Instant accessedAt);

    // ==================== Long-term memory ====================

    void createLongterm(LongtermMemory memory);

    Optional<LongtermMemory> findLongterm(String agentId, String key);

    LongtermMemory updateLongterm(LongtermMemory memory, long expectedVersion);

    boolean deleteLongterm(String agentId, String key);

    List<LongtermMemory> listLongterm(String agentId, MemoryFilters filters);

    List<LongtermMemory> searchLongterm(String agentId, MemoryQuery query);

    void recordLongtermAccess(String agentId, String key, Instant accessedAt);

    // ==================== Snapshots ====================

    void createSnapshot(StateSnapshot snapshot);

    Optional<StateSnapshot> findSnapshot(String snapshotId);

    /**
     * Snapshots of an agent, newest first.
     */
    List<StateSnapshot> listSnapshots(String agentId, SnapshotFilters filters);

    boolean deleteSnapshot(String snapshotId);

    // ==================== Sync status ====================

    Optional<SyncStatus> findSyncStatus(String agentId, String instanceId);

    /**
     * Atomic insert-or-replace keyed by {@code (agentId, instanceId)}.
     */
    SyncStatus upsertSyncStatus(SyncStatus status);

    List<SyncStatus> listSyncStatuses(String agentId);

    // ==================== Maintenance ====================

    /**
     * Delete working entries whose expiry is strictly before {@code now}.
     */
    int deleteExpiredWorking(Instant now);

    /**
     * Delete snapshots whose expiry is strictly before {@code now}.
     */
    int deleteExpiredSnapshots(Instant now);
}
