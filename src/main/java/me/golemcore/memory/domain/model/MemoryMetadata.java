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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured metadata of a long-term memory entry.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MemoryMetadata {

    public static final String DEFAULT_SOURCE = "manual";
    public static final int DEFAULT_IMPORTANCE = 5;
    public static final double DEFAULT_CONFIDENCE = 1.0;
    public static final int MIN_IMPORTANCE = 1;
    public static final int MAX_IMPORTANCE = 10;

    @Builder.Default
    private String source = DEFAULT_SOURCE;

    // 1-10, higher is more important
    @Builder.Default
    private int importance = DEFAULT_IMPORTANCE;

    // 0.0-1.0
    @Builder.Default
    private double confidence = DEFAULT_CONFIDENCE;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private List<String> references = new ArrayList<>();

    public MemoryMetadata copy() {
        return toBuilder()
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .references(references != null ? new ArrayList<>(references) : new ArrayList<>())
                .build();
    }
}
