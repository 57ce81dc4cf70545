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
public class MemoryNotFoundException extends MemoryException {

    private final String entityType;
    private final String key;

    public MemoryNotFoundException(String entityType, String agentId, String key) {
        super(entityType + " not found: " + agentId + "/" + key);
        this.entityType = entityType;
        this.key = key;
    }

    public MemoryNotFoundException(String entityType, String id) {
        super(entityType + " not found: " + id);
        this.entityType = entityType;
        this.key = id;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getKey() {
        return key;
    }
}
