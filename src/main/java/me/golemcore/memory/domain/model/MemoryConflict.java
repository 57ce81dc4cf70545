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

/**
 * Divergence between the value an instance holds locally for a key and the
 * value in the shared store.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MemoryConflict {

    private String key;
    private MemoryType memoryType;
    private long localVersion;
    private long remoteVersion;
    private Object localValue;
    private Object remoteValue;
    private Instant localTime;
    private Instant remoteTime;
    private Instant detectedAt;

    public boolean sameTarget(MemoryType type, String otherKey) {
        return memoryType == type && key != null && key.equals(otherKey);
    }
}
