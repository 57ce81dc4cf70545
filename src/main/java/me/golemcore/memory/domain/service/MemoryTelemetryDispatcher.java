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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs best-effort side effects of reads (access bumps, expired-entry deletes)
 * off the caller thread. Failures are logged at debug level and dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MemoryTelemetryDispatcher {

    private final ExecutorService memoryTelemetryExecutor;

    public void dispatch(String description, Runnable task) {
        try {
            memoryTelemetryExecutor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.debug("[Telemetry] {} failed: {}", description, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("[Telemetry] {} rejected: executor is shut down", description);
        }
    }
}
