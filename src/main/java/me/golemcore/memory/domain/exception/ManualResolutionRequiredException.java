package me.golemcore.memory.domain.exception;

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
import me.golemcore.memory.domain.model.MemoryType;

/**
 * Raised for every conflict handled with the manual strategy; an external actor
 * has to settle it.
 */
public class ManualResolutionRequiredException extends MemoryException {

    private final String key;

    public ManualResolutionRequiredException(MemoryType memoryType, String key) {
        super("Manual conflict resolution required for " + memoryType.getValue() + " key: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
