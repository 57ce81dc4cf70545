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
import me.golemcore.memory.domain.exception.MemoryValidationException;
import me.golemcore.memory.domain.model.MemoryFilters;

import java.util.Set;

/**
 * Validation shared by the memory listing operations.
 */
final class MemoryFilterSupport {

    static final Set<String> WORKING_SORT_FIELDS = Set.of(
            MemoryFilters.SORT_CREATED_AT,
            MemoryFilters.SORT_UPDATED_AT,
            MemoryFilters.SORT_ACCESSED_AT,
            MemoryFilters.SORT_EXPIRES_AT,
            MemoryFilters.SORT_ACCESS_COUNT,
            MemoryFilters.SORT_KEY,
            MemoryFilters.SORT_VERSION);

    static final Set<String> LONGTERM_SORT_FIELDS = Set.of(
            MemoryFilters.SORT_IMPORTANCE,
            MemoryFilters.SORT_CREATED_AT,
            MemoryFilters.SORT_UPDATED_AT,
            MemoryFilters.SORT_ACCESSED_AT,
            MemoryFilters.SORT_ACCESS_COUNT,
            MemoryFilters.SORT_KEY,
            MemoryFilters.SORT_VERSION);

    private MemoryFilterSupport() {
    }

    static void validatePage(Integer limit, Integer offset) {
        if (limit != null && limit < 0) {
            throw new MemoryValidationException("limit must not be negative");
        }
        if (offset != null && offset < 0) {
            throw new MemoryValidationException("offset must not be negative");
        }
    }

    static void validate(MemoryFilters filters, Set<String> sortFields) {
        if (filters == null) {
            return;
        }
        validatePage(filters.getLimit(), filters.getOffset());
        String sortBy = filters.getSortBy();
        if (sortBy != null && !sortBy.isBlank() && !sortFields.contains(sortBy)) {
            throw new MemoryValidationException("Unsupported sort field: " + sortBy);
        }
        if (filters.getAfterTime() != null && filters.getBeforeTime() != null
                && filters.getAfterTime().isAfter(filters.getBeforeTime())) {
            throw new MemoryValidationException("afterTime must not be later than beforeTime");
        }
    }
}
