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
import java.util.List;

/**
 * Aggregate failure of a conflict batch. Unresolved conflicts stay on the sync
 * status for a later attempt.
 */
public class ConflictResolutionException extends MemoryException {

    private final int unresolvedCount;
    private final transient List<RuntimeException> failures;

    public ConflictResolutionException(int unresolvedCount, List<RuntimeException> failures) {
        super("Failed to resolve " + unresolvedCount + " conflicts");
        this.unresolvedCount = unresolvedCount;
        this.failures = List.copyOf(failures);
        for (RuntimeException failure : failures) {
            addSuppressed(failure);
        }
    }

    public int getUnresolvedCount() {
        return unresolvedCount;
    }

    public List<RuntimeException> getFailures() {
        return failures;
    }
}
