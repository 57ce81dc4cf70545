package me.golemcore.memory.domain.model;

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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Synchronization progress of one {@code (agentId, instanceId)} pair.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SyncStatus {

    public static final String ENTITY_TYPE = "Sync status";
    public static final String LAST_FORCE_PUSH = "last_force_push";
    public static final String LAST_FORCE_PULL = "last_force_pull";

    private String agentId;
    private String instanceId;
    private Instant lastSyncAt;
    private long syncVersion;
    private int pendingChanges;

    @Builder.Default
    private List<MemoryConflict> conflicts = new ArrayList<>();

    @Builder.Default
    private SyncState status = SyncState.SYNCED;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public static SyncStatus initial(String agentId, String instanceId) {
        return SyncStatus.builder()
                .agentId(agentId)
                .instanceId(instanceId)
                .build();
    }

    public SyncStatus copy() {
        List<MemoryConflict> conflictCopies = new ArrayList<>();
        if (conflicts != null) {
            for (MemoryConflict conflict : conflicts) {
                conflictCopies.add(conflict.toBuilder().build());
            }
        }
        return toBuilder()
                .conflicts(conflictCopies)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .build();
    }
}
