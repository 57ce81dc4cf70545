package me.golemcore.memory.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;

/**
 * Snapshot kinds and their default retention windows.
 */
public enum SnapshotType {

    PERIODIC("periodic", Duration.ofDays(7)),

    MANUAL("manual", Duration.ofDays(30)),

    PRE_UPDATE("pre-update", Duration.ofDays(90)),

    PRE_SHUTDOWN("pre-shutdown", Duration.ofDays(90));

    private final String value;
    private final Duration defaultRetention;

    SnapshotType(String value, Duration defaultRetention) {
        this.value = value;
        this.defaultRetention = defaultRetention;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Duration getDefaultRetention() {
        return defaultRetention;
    }

    /**
     * Parse a wire value such as {@code pre-update}; enum names are accepted as
     * well.
     *
     * @throws IllegalArgumentException
     *             if the value names no known type
     */
    @JsonCreator
    public static SnapshotType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Snapshot type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (SnapshotType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown snapshot type: " + value);
    }
}
