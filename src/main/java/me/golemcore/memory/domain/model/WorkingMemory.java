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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Short-lived, TTL-bounded task context owned by one agent. Unique per
 * {@code (agentId, key)}; {@link #version} starts at 1 and grows by exactly one
 * on every successful update.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class WorkingMemory {

    public static final String ENTITY_TYPE = "Working memory";
    public static final String TAGS_METADATA_KEY = "tags";

    private String id;
    private String agentId;
    private String key;
    private Object value;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private Instant createdAt;
    private Instant updatedAt;
    private Instant accessedAt;
    private long accessCount;
    private Instant expiresAt;
    private long version;

    @JsonIgnore
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Tags carried in the free-form metadata under {@code tags}.
     */
    @JsonIgnore
    public List<String> getTags() {
        if (metadata == null) {
            return List.of();
        }
        Object raw = metadata.get(TAGS_METADATA_KEY);
        if (!(raw instanceof Collection<?> collection)) {
            return List.of();
        }
        List<String> tags = new ArrayList<>(collection.size());
        for (Object tag : collection) {
            if (tag != null) {
                tags.add(tag.toString());
            }
        }
        return tags;
    }

    public WorkingMemory copy() {
        return toBuilder()
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .build();
    }
}
