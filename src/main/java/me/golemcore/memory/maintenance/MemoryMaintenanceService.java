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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.MemoryException;
import me.golemcore.memory.domain.exception.MemoryValidationException;
import me.golemcore.memory.domain.model.LongtermMemory;
import me.golemcore.memory.domain.model.MemoryFilters;
import me.golemcore.memory.domain.model.MemoryStats;
import me.golemcore.memory.domain.model.SnapshotFilters;
import me.golemcore.memory.domain.model.StateSnapshot;
import me.golemcore.memory.domain.model.SyncStatus;
import me.golemcore.memory.domain.model.WorkingMemory;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Expiry sweeps and usage statistics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryMaintenanceService {

    private final MemoryRepositoryPort memoryRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Delete working entries and snapshots whose expiry is strictly in the
     * past.
     *
     * @return number of deleted records
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        int working = memoryRepository.deleteExpiredWorking(now);
        int snapshots = memoryRepository.deleteExpiredSnapshots(now);
        if (working > 0 || snapshots > 0) {
            log.info("[Maintenance] Removed {} expired working entries and {} expired snapshots", working, snapshots);
        } else {
            log.debug("[Maintenance] Nothing expired");
        }
        return working + snapshots;
    }

    public MemoryStats getMemoryStats(String agentId) {
        MemoryValidationException.requireId(agentId, "agentId");
        Instant now = clock.instant();

        List<WorkingMemory> working = memoryRepository.listWorking(agentId, MemoryFilters.none(), now);
        List<LongtermMemory> longterm = memoryRepository.listLongterm(agentId, MemoryFilters.none());
        List<StateSnapshot> snapshots = memoryRepository.listSnapshots(agentId, SnapshotFilters.none());
        List<SyncStatus> statuses = memoryRepository.listSyncStatuses(agentId);

        long workingSize = jsonSize(working);
        long longtermSize = jsonSize(longterm);
        long snapshotSize = 0;
        for (StateSnapshot snapshot : snapshots) {
            snapshotSize += snapshot.getMetadata() != null ? snapshot.getMetadata().getSizeBytes() : 0;
        }

        Instant lastSyncAt = statuses.stream()
                .map(SyncStatus::getLastSyncAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(null);

        return MemoryStats.builder()
                .agentId(agentId)
                .workingMemoryCount(working.size())
                .workingMemorySizeBytes(workingSize)
                .longtermMemoryCount(longterm.size())
                .longtermMemorySizeBytes(longtermSize)
                .snapshotCount(snapshots.size())
                .totalSizeBytes(workingSize + longtermSize + snapshotSize)
                .lastSyncAt(lastSyncAt)
                .lastSnapshotAt(snapshots.isEmpty() ? null : snapshots.get(0).getCreatedAt())
                .build();
    }

    private long jsonSize(List<?> entries) {
        if (entries.isEmpty()) {
            return 0;
        }
        try {
            return objectMapper.writeValueAsString(entries).getBytes(StandardCharsets.UTF_8).length;
        } catch (JsonProcessingException e) {
            throw new MemoryException("Failed to measure memory size", e);
        }
    }
}
