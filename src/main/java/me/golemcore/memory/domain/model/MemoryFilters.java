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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Selection descriptor for memory listings. Unset fields do not constrain the
 * result; time bounds apply to {@code createdAt} and are inclusive.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryFilters {

    public static final String SORT_CREATED_AT = "createdAt";
    public static final String SORT_UPDATED_AT = "updatedAt";
    public static final String SORT_ACCESSED_AT = "accessedAt";
    public static final String SORT_EXPIRES_AT = "expiresAt";
    public static final String SORT_ACCESS_COUNT = "accessCount";
    public static final String SORT_IMPORTANCE = "importance";
    public static final String SORT_KEY = "key";
    public static final String SORT_VERSION = "version";

    // Matches when any tag intersects
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String category;
    private Integer minImportance;
    private Instant afterTime;
    private Instant beforeTime;
    private Integer limit;
    private Integer offset;
    private String sortBy;
    private boolean sortDesc;

    public static MemoryFilters none() {
        return new MemoryFilters();
    }
}
