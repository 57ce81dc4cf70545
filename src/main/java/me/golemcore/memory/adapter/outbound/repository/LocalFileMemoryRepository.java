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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.RepositoryException;
import me.golemcore.memory.domain.model.LongtermMemory;
import me.golemcore.memory.domain.model.StateSnapshot;
import me.golemcore.memory.domain.model.SyncStatus;
import me.golemcore.memory.domain.model.WorkingMemory;
import me.golemcore.memory.port.outbound.StoragePort;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Durable repository keeping JSON documents in the local storage workspace.
 *
 * <p>
 * Layout:
 * <ul>
 * <li>{@code working/<agent>.json} - working entries of one agent
 * <li>{@code longterm/<agent>.json} - long-term entries of one agent
 * <li>{@code snapshots/<id>.json} - one snapshot per document
 * <li>{@code sync/<agent>.json} - sync statuses of all instances of one agent
 * </ul>
 *
 * <p>
 * The maps of {@link AbstractMapMemoryRepository} stay authoritative for
 * reads. After every mutation the affected document is rewritten atomically
 * from the current map contents, serialized per document. Call {@link #load()}
 * once before use.
 */
@Slf4j
public class LocalFileMemoryRepository extends AbstractMapMemoryRepository {

    static final String WORKING_DIR = "working";
    static final String LONGTERM_DIR = "longterm";
    static final String SNAPSHOTS_DIR = "snapshots";
    static final String SYNC_DIR = "sync";
    private static final String JSON_EXTENSION = ".json";

    private static final TypeReference<List<WorkingMemory>> WORKING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<LongtermMemory>> LONGTERM_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<SyncStatus>> SYNC_LIST = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Map<String, Object> documentLocks = new ConcurrentHashMap<>();

    public LocalFileMemoryRepository(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    /**
     * Read every stored document into memory. Unreadable documents are skipped
     * with a warning.
     */
    public void load() {
        int working = this.<WorkingMemory>loadDocuments(WORKING_DIR, json -> objectMapper.readValue(json, WORKING_LIST),
                memory -> working(memory.getAgentId()).put(memory.getKey(), memory));
        int longterm = this.<LongtermMemory>loadDocuments(LONGTERM_DIR, json -> objectMapper.readValue(json, LONGTERM_LIST),
                memory -> longterm(memory.getAgentId()).put(memory.getKey(), memory));
        int snapshots = this.<StateSnapshot>loadDocuments(SNAPSHOTS_DIR,
                json -> List.of(objectMapper.readValue(json, StateSnapshot.class)),
                snapshot -> snapshotsById.put(snapshot.getId(), snapshot));
        int statuses = this.<SyncStatus>loadDocuments(SYNC_DIR, json -> objectMapper.readValue(json, SYNC_LIST),
                status -> syncByAgent.computeIfAbsent(status.getAgentId(), id -> new ConcurrentHashMap<>())
                        .put(status.getInstanceId(), status));
        log.info("[MemoryStore] Loaded {} working, {} long-term, {} snapshots, {} sync statuses",
                working, longterm, snapshots, statuses);
    }

    private <T> int loadDocuments(String directory, DocumentReader<T> reader, Consumer<T> sink) {
        List<String> files;
        try {
            files = storagePort.listObjects(directory, "").join();
        } catch (RuntimeException e) {
            throw new RepositoryException(directory, "*", "load", e);
        }
        int loaded = 0;
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            try {
                String json = storagePort.getText(directory, file).join();
                if (json == null || json.isBlank()) {
                    continue;
                }
                for (T item : reader.read(json)) {
                    sink.accept(item);
                    loaded++;
                }
            } catch (IOException | RuntimeException e) {
                log.warn("[MemoryStore] Skipping unreadable document {}/{}: {}", directory, file, e.getMessage());
            }
        }
        return loaded;
    }

    @Override
    protected void onWorkingChanged(String agentId) {
        writeAgentDocument(WORKING_DIR, WorkingMemory.ENTITY_TYPE, agentId,
                () -> sortedValues(workingByAgent.get(agentId), WorkingMemory::getKey));
    }

    @Override
    protected void onLongtermChanged(String agentId) {
        writeAgentDocument(LONGTERM_DIR, LongtermMemory.ENTITY_TYPE, agentId,
                () -> sortedValues(longtermByAgent.get(agentId), LongtermMemory::getKey));
    }

    @Override
    protected void onSyncStatusChanged(String agentId) {
        writeAgentDocument(SYNC_DIR, SyncStatus.ENTITY_TYPE, agentId,
                () -> sortedValues(syncByAgent.get(agentId), SyncStatus::getInstanceId));
    }

    @Override
    protected void onSnapshotSaved(StateSnapshot snapshot) {
        String path = fileName(snapshot.getId());
        synchronized (lockFor(SNAPSHOTS_DIR, snapshot.getId())) {
            StateSnapshot stored = snapshotsById.get(snapshot.getId());
            if (stored == null) {
                return;
            }
            try {
                storagePort.putTextAtomic(SNAPSHOTS_DIR, path, objectMapper.writeValueAsString(stored), false)
                        .join();
            } catch (JsonProcessingException | RuntimeException e) {
                throw new RepositoryException(StateSnapshot.ENTITY_TYPE, snapshot.getId(), "write", e);
            }
        }
    }

    @Override
    protected void onSnapshotDeleted(String snapshotId) {
        String lockKey = SNAPSHOTS_DIR + "/" + snapshotId;
        Object lock = lockFor(SNAPSHOTS_DIR, snapshotId);
        synchronized (lock) {
            try {
                storagePort.deleteObject(SNAPSHOTS_DIR, fileName(snapshotId)).join();
            } catch (RuntimeException e) {
                throw new RepositoryException(StateSnapshot.ENTITY_TYPE, snapshotId, "delete", e);
            }
        }
        // Snapshot ids are never reused once deleted
        documentLocks.remove(lockKey, lock);
    }

    private <T> void writeAgentDocument(String directory, String entityType, String agentId,
            Supplier<List<T>> currentContents) {
        synchronized (lockFor(directory, agentId)) {
            // Read under the lock so the last writer always sees the latest map state
            List<T> contents = currentContents.get();
            String path = fileName(agentId);
            try {
                if (contents.isEmpty()) {
                    storagePort.deleteObject(directory, path).join();
                } else {
                    storagePort.putTextAtomic(directory, path, objectMapper.writeValueAsString(contents), false)
                            .join();
                }
                log.debug("[MemoryStore] Wrote {} {} entries for agent {}", contents.size(), directory, agentId);
            } catch (JsonProcessingException | RuntimeException e) {
                throw new RepositoryException(entityType, agentId, "write", e);
            }
        }
    }

    int documentLockCount() {
        return documentLocks.size();
    }

    private Object lockFor(String directory, String id) {
        return documentLocks.computeIfAbsent(directory + "/" + id, k -> new Object());
    }

    private static <T> List<T> sortedValues(Map<String, T> entries, Function<T, String> sortKey) {
        if (entries == null) {
            return List.of();
        }
        List<T> values = new ArrayList<>(entries.values());
        values.sort(Comparator.comparing(sortKey));
        return values;
    }

    static String fileName(String id) {
        return URLEncoder.encode(id, StandardCharsets.UTF_8) + JSON_EXTENSION;
    }

    @FunctionalInterface
    private interface DocumentReader<T> {
        List<T> read(String json) throws IOException;
    }
}
