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
 * Optimistic-lock failure: the stored version moved past the version the caller
 * observed. The caller must re-read and retry.
 */
public class VersionConflictException extends MemoryException {

    private final String key;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String entityType, String agentId, String key,
            long expectedVersion, long actualVersion) {
        super(entityType + " version conflict for " + agentId + "/" + key
                + ": expected " + expectedVersion + ", stored " + actualVersion);
        this.key = key;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getKey() {
        return key;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
