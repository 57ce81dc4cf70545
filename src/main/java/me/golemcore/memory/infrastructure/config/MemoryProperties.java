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
import lombok.Data;
import me.golemcore.memory.domain.model.ConflictStrategy;
import me.golemcore.memory.domain.model.SnapshotType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the memory subsystem, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code memory.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - persistence backend selection</li>
 * <li>{@link WorkingProperties} - working memory defaults</li>
 * <li>{@link LongtermProperties} - long-term memory defaults</li>
 * <li>{@link SnapshotProperties} - snapshot retention windows</li>
 * <li>{@link SyncProperties} - cross-instance synchronization</li>
 * <li>{@link MaintenanceProperties} - expiry sweeps</li>
 * <li>{@link TelemetryProperties} - background access tracking</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryProperties {

    private StorageProperties storage = new StorageProperties();
    private WorkingProperties working = new WorkingProperties();
    private LongtermProperties longterm = new LongtermProperties();
    private SnapshotProperties snapshot = new SnapshotProperties();
    private SyncProperties sync = new SyncProperties();
    private MaintenanceProperties maintenance = new MaintenanceProperties();
    private TelemetryProperties telemetry = new TelemetryProperties();

    @Data
    public static class StorageProperties {
        // local | in-memory
        private String backend = "local";
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/memory";
    }

    @Data
    public static class WorkingProperties {
        private Duration defaultTtl = Duration.ofHours(1);
    }

    @Data
    public static class LongtermProperties {
        private String defaultCategory = "general";
    }

    @Data
    public static class SnapshotProperties {
        private RetentionProperties retention = new RetentionProperties();
    }

    @Data
    public static class RetentionProperties {
        private Duration periodic = SnapshotType.PERIODIC.getDefaultRetention();
        private Duration manual = SnapshotType.MANUAL.getDefaultRetention();
        private Duration preUpdate = SnapshotType.PRE_UPDATE.getDefaultRetention();
        private Duration preShutdown = SnapshotType.PRE_SHUTDOWN.getDefaultRetention();

        public Duration forType(SnapshotType type) {
            Duration configured = switch (type) {
            case PERIODIC -> periodic;
            case MANUAL -> manual;
            case PRE_UPDATE -> preUpdate;
            case PRE_SHUTDOWN -> preShutdown;
            };
            return configured != null ? configured : type.getDefaultRetention();
        }
    }

    @Data
    public static class SyncProperties {
        private String instanceId = "";
        private Duration interval = Duration.ofMinutes(5);
        private ConflictStrategy strategy = ConflictStrategy.LAST_WRITE_WINS;
        private String autoStartAgentId = "";
    }

    @Data
    public static class MaintenanceProperties {
        private boolean enabled = true;
        private Duration cleanupInterval = Duration.ofMinutes(10);
    }

    @Data
    public static class TelemetryProperties {
        private int threads = 2;
    }
}
