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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Rules selecting long-term memories for archival. An entry is eligible only
 * when it satisfies every bound that is set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ArchiveCriteria {

    // Created strictly before now - olderThan
    private Duration olderThan;

    // Inclusive ceiling
    private Integer maxAccessCount;

    // Inclusive ceiling
    private Integer maxImportance;

    @Builder.Default
    private List<String> categories = new ArrayList<>();

    private boolean dryRun;
}
