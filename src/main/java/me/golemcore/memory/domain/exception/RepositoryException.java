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
/**
 * Backing-store failure. The message names the entity type, key and operation;
 * storage-specific detail stays in the cause.
 */
public class RepositoryException extends MemoryException {

    private final String entityType;
    private final String key;
    private final String operation;

    public RepositoryException(String entityType, String key, String operation, Throwable cause) {
        super("Repository failure during " + operation + " of " + entityType + " '" + key + "'", cause);
        this.entityType = entityType;
        this.key = key;
        this.operation = operation;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getKey() {
        return key;
    }

    public String getOperation() {
        return operation;
    }
}
