package me.golemcore.memory.domain.service;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.ManualResolutionRequiredException;
import me.golemcore.memory.domain.exception.MemoryValidationException;
import me.golemcore.memory.domain.model.ConflictResolution;
import me.golemcore.memory.domain.model.ConflictStrategy;
import me.golemcore.memory.domain.model.MemoryConflict;
import me.golemcore.memory.domain.model.SyncState;
import me.golemcore.memory.domain.model.SyncStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Picks the winning side of memory conflicts.
 *
 * <p>
 * {@link #resolve(MemoryConflict, ConflictStrategy)} is a pure function of its
 * inputs. Ties always keep the local side.
 */
@Component
@Slf4j
public class ConflictResolver {

    public ConflictResolution resolve(MemoryConflict conflict, ConflictStrategy strategy) {
        if (conflict == null) {
            throw new MemoryValidationException("conflict is required");
        }
        if (strategy == null) {
            throw new MemoryValidationException("strategy is required");
        }
        return switch (strategy) {
        case LAST_WRITE_WINS -> isAfter(conflict.getRemoteTime(), conflict.getLocalTime())
                ? remote(conflict)
                : local(conflict);
        case VERSION_BASED -> conflict.getRemoteVersion() > conflict.getLocalVersion()
                ? remote(conflict)
                : local(conflict);
        case LOCAL_WINS -> local(conflict);
        case REMOTE_WINS -> remote(conflict);
        case MANUAL -> throw new ManualResolutionRequiredException(conflict.getMemoryType(), conflict.getKey());
        };
    }

    /**
     * Resolve every open conflict of {@code status} and hand each decision to
     * {@code applier}. Conflicts whose resolution or application succeeded are
     * removed from the status; the status returns to {@link SyncState#SYNCED}
     * only when none remain.
     */
    public BatchOutcome resolveAll(SyncStatus status, ConflictStrategy strategy,
            Consumer<ConflictResolution> applier) {
        List<MemoryConflict> remaining = new ArrayList<>();
        List<ConflictResolution> resolved = new ArrayList<>();
        List<RuntimeException> failures = new ArrayList<>();

        for (MemoryConflict conflict : status.getConflicts()) {
            try {
                ConflictResolution resolution = resolve(conflict, strategy);
                applier.accept(resolution);
                resolved.add(resolution);
            } catch (RuntimeException e) {
                log.debug("[ConflictResolver] Conflict on {} key {} left open: {}",
                        conflict.getMemoryType(), conflict.getKey(), e.getMessage());
                remaining.add(conflict);
                failures.add(e);
            }
        }

        status.setConflicts(remaining);
        if (remaining.isEmpty()) {
            if (status.getStatus() == SyncState.CONFLICT) {
                status.setStatus(SyncState.SYNCED);
            }
        } else {
            status.setStatus(SyncState.CONFLICT);
        }
        return new BatchOutcome(resolved, failures);
    }

    private static boolean isAfter(Instant candidate, Instant reference) {
        if (candidate == null) {
            return false;
        }
        return reference == null || candidate.isAfter(reference);
    }

    private static ConflictResolution local(MemoryConflict conflict) {
        return new ConflictResolution(conflict, ConflictResolution.Side.LOCAL, conflict.getLocalValue());
    }

    private static ConflictResolution remote(MemoryConflict conflict) {
        return new ConflictResolution(conflict, ConflictResolution.Side.REMOTE, conflict.getRemoteValue());
    }

    /**
     * Result of a batch resolution.
     */
    public record BatchOutcome(List<ConflictResolution> resolved, List<RuntimeException> failures) {

        public boolean isComplete() {
            return failures.isEmpty();
        }
    }
}
