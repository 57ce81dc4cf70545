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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time capture of agent state. Never modified after creation; the
 * {@link #checksum} always equals a fresh hash of {@link #state}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class StateSnapshot {

    public static final String ENTITY_TYPE = "Snapshot";

    private String id;
    private String agentId;
    private SnapshotType snapshotType;

    @Builder.Default
    private Map<String, Object> state = new LinkedHashMap<>();

    private String checksum;

    @Builder.Default
    private SnapshotMetadata metadata = new SnapshotMetadata();

    private Instant createdAt;
    private Instant expiresAt;

    @Builder.Default
    private long version = 1;

    @JsonIgnore
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    /**
     * Metadata describing how and why a snapshot was taken.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder(toBuilder = true)
    public static class SnapshotMetadata {
        private String trigger;
        private String reason;
        private long sizeBytes;
        private boolean compressed;
    }
}
