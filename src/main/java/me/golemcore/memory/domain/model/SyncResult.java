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
import java.util.List;

/**
 * Outcome of one synchronization pass.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncResult {

    private String agentId;
    private String instanceId;
    private Instant syncedAt;
    private long durationMs;
    private int itemsSynced;
    private int workingCount;
    private int longtermCount;

    @Builder.Default
    private List<MemoryConflict> conflicts = new ArrayList<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private boolean success;
}
