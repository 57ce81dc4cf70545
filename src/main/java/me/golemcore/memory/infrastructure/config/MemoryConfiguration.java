package me.golemcore.memory.infrastructure.config;

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
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.adapter.outbound.repository.InMemoryMemoryRepository;
import me.golemcore.memory.adapter.outbound.repository.LocalFileMemoryRepository;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import me.golemcore.memory.port.outbound.StoragePort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration wiring the shared infrastructure beans of the memory
 * subsystem.
 *
 * <p>
 * The persistence adapter is selected once from {@code memory.storage.backend}:
 * {@code local} keeps JSON documents under the storage base path,
 * {@code in-memory} keeps everything in process maps.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class MemoryConfiguration {

    private static final String BACKEND_IN_MEMORY = "in-memory";
    private static final String BACKEND_LOCAL = "local";

    private final MemoryProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService memoryTelemetryExecutor() {
        int threads = Math.max(1, properties.getTelemetry().getThreads());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "memory-telemetry-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public MemoryRepositoryPort memoryRepository(StoragePort storagePort, ObjectMapper objectMapper) {
        String backend = properties.getStorage().getBackend();
        String normalized = backend == null ? BACKEND_LOCAL : backend.trim().toLowerCase(Locale.ROOT);
        if (BACKEND_IN_MEMORY.equals(normalized)) {
            log.info("[MemoryConfig] Using in-memory repository");
            return new InMemoryMemoryRepository();
        }
        if (!BACKEND_LOCAL.equals(normalized)) {
            throw new IllegalStateException("Unknown memory.storage.backend: " + backend);
        }
        LocalFileMemoryRepository repository = new LocalFileMemoryRepository(storagePort, objectMapper);
        repository.load();
        log.info("[MemoryConfig] Using local file repository at {}",
                properties.getStorage().getLocal().getBasePath());
        return repository;
    }
}
