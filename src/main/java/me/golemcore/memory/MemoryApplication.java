package me.golemcore.memory;

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
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the agent memory subsystem.
 *
 * <p>
 * Provides two tiers of agent state with point-in-time recovery and
 * cross-instance synchronization:
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Working Memory</b> - TTL-bounded task context with optimistic
 * locking</li>
 * <li><b>Long-term Memory</b> - categorized knowledge with filter search and
 * archival</li>
 * <li><b>Snapshots</b> - checksummed captures with retention by type</li>
 * <li><b>Synchronization</b> - periodic conflict detection between instances of
 * one agent</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Domain Layer       → memory services, conflict resolver
 * Coordination       → sync coordinator, expiry cleanup
 * Infrastructure     → local file / in-memory repositories
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code memory.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryApplication.class, args);
    }

}
