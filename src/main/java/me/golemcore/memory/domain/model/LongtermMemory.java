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
 * Durable, categorized knowledge entry. Unique per {@code (agentId, key)} and
 * versioned the same way as {@link WorkingMemory}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class LongtermMemory {

    public static final String ENTITY_TYPE = "Long-term memory";
    public static final String DEFAULT_CATEGORY = "general";

    private String id;
    private String agentId;

    @Builder.Default
    private String category = DEFAULT_CATEGORY;

    private String key;
    private Object value;

    // Reserved for semantic retrieval, not used by search
    private List<Double> embedding;

    @Builder.Default
    private MemoryMetadata metadata = new MemoryMetadata();

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastAccessed;
    private long accessCount;
    private long version;

    public LongtermMemory copy() {
        return toBuilder()
                .metadata(metadata != null ? metadata.copy() : new MemoryMetadata())
                .embedding(embedding != null ? new ArrayList<>(embedding) : null)
                .build();
    }
}
