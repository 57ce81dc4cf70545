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
import me.golemcore.memory.domain.exception.MemoryNotFoundException;
import me.golemcore.memory.domain.exception.MemoryValidationException;
import me.golemcore.memory.domain.exception.VersionConflictException;
import me.golemcore.memory.domain.model.ArchiveCriteria;
import me.golemcore.memory.domain.model.ArchiveReport;
import me.golemcore.memory.domain.model.LongtermMemory;
import me.golemcore.memory.domain.model.MemoryFilters;
import me.golemcore.memory.domain.model.MemoryMetadata;
import me.golemcore.memory.domain.model.MemoryQuery;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Durable, categorized knowledge of an agent.
 *
 * <p>
 * Search is filter based: category, tags, minimum importance, creation time
 * window and an optional case-insensitive substring over key, category and
 * tags. Archival removes entries that satisfy every bound of an
 * {@link ArchiveCriteria}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LongtermMemoryService {

    static final String METADATA_SOURCE = "source";
    static final String METADATA_IMPORTANCE = "importance";
    static final String METADATA_CONFIDENCE = "confidence";
    static final String METADATA_TAGS = "tags";
    static final String METADATA_REFERENCES = "references";

    private final MemoryRepositoryPort memoryRepository;
    private final MemoryProperties properties;
    private final MemoryTelemetryDispatcher telemetryDispatcher;
    private final Clock clock;

    public LongtermMemory remember(String agentId, String key, Object value, String category) {
        return remember(agentId, key, value, category, new MemoryMetadata());
    }

    /**
     * Store a new entry with metadata given as a loose map. Recognized keys are
     * {@code source}, {@code importance}, {@code confidence}, {@code tags} and
     * {@code references}; other keys are ignored.
     */
    public LongtermMemory remember(String agentId, String key, Object value, String category,
            Map<String, Object> metadata) {
        return remember(agentId, key, value, category, toMetadata(metadata));
    }

    public LongtermMemory remember(String agentId, String key, Object value, String category,
            MemoryMetadata metadata) {
        MemoryValidationException.requireId(agentId, "agentId");
        MemoryValidationException.requireId(key, "key");
        MemoryMetadata effectiveMetadata = metadata != null ? metadata.copy() : new MemoryMetadata();
        validateMetadata(effectiveMetadata);

        Instant now = clock.instant();
        LongtermMemory memory = LongtermMemory.builder()
                .id(UUID.randomUUID().toString())
                .agentId(agentId)
                .category(resolveCategory(category))
                .key(key)
                .value(value)
                .metadata(effectiveMetadata)
                .createdAt(now)
                .updatedAt(now)
                .lastAccessed(now)
                .accessCount(0)
                .version(1)
                .build();

        memoryRepository.createLongterm(memory);
        log.debug("[LongtermMemory] Remembered {}/{} in category {}", agentId, key, memory.getCategory());
        return memory.copy();
    }

    public Object recall(String agentId, String key) {
        return get(agentId, key).getValue();
    }

    public LongtermMemory get(String agentId, String key) {
        LongtermMemory memory = require(agentId, key);
        Instant accessedAt = clock.instant();
        telemetryDispatcher.dispatch("long-term access " + agentId + "/" + key,
                () -> memoryRepository.recordLongtermAccess(agentId, key, accessedAt));
        return memory;
    }

    public LongtermMemory update(String agentId, String key, Object value) {
        return update(agentId, key, value, require(agentId, key).getVersion());
    }

    public LongtermMemory update(String agentId, String key, Object value, long expectedVersion) {
        LongtermMemory current = require(agentId, key);
        if (current.getVersion() != expectedVersion) {
            throw new VersionConflictException(LongtermMemory.ENTITY_TYPE, agentId, key,
                    expectedVersion, current.getVersion());
        }

        LongtermMemory next = current.copy();
        next.setValue(value);
        next.setUpdatedAt(clock.instant());
        next.setVersion(expectedVersion + 1);

        LongtermMemory updated = memoryRepository.updateLongterm(next, expectedVersion);
        log.debug("[LongtermMemory] Updated {}/{} to version {}", agentId, key, updated.getVersion());
        return updated;
    }

    /**
     * Filtered search. Without an explicit sort, results come most important
     * first and newest first within the same importance.
     */
    public List<LongtermMemory> search(String agentId, MemoryQuery query) {
        MemoryValidationException.requireId(agentId, "agentId");
        MemoryQuery effective = query != null ? query : new MemoryQuery();
        MemoryFilters filters = effective.getFilters();
        MemoryFilterSupport.validate(filters, MemoryFilterSupport.LONGTERM_SORT_FIELDS);
        if (filters != null && filters.getMinImportance() != null) {
            validateImportance(filters.getMinImportance(), "minImportance");
        }
        return memoryRepository.searchLongterm(agentId, effective);
    }

    public void forget(String agentId, String key) {
        MemoryValidationException.requireId(agentId, "agentId");
        MemoryValidationException.requireId(key, "key");
        if (!memoryRepository.deleteLongterm(agentId, key)) {
            throw new MemoryNotFoundException(LongtermMemory.ENTITY_TYPE, agentId, key);
        }
        log.debug("[LongtermMemory] Forgot {}/{}", agentId, key);
    }

    /**
     * Remove entries satisfying every bound set on {@code criteria}. A dry run
     * only reports the eligible keys.
     */
    public ArchiveReport archive(String agentId, ArchiveCriteria criteria) {
        MemoryValidationException.requireId(agentId, "agentId");
        ArchiveCriteria effective = criteria != null ? criteria : new ArchiveCriteria();
        validateCriteria(effective);

        Instant now = clock.instant();
        Instant cutoff = effective.getOlderThan() != null ? now.minus(effective.getOlderThan()) : null;

        List<String> eligible = new ArrayList<>();
        for (LongtermMemory memory : memoryRepository.listLongterm(agentId, MemoryFilters.none())) {
            if (isEligible(memory, effective, cutoff)) {
                eligible.add(memory.getKey());
            }
        }

        ArchiveReport report = ArchiveReport.builder()
                .agentId(agentId)
                .dryRun(effective.isDryRun())
                .eligibleKeys(eligible)
                .build();

        if (effective.isDryRun()) {
            log.info("[LongtermMemory] Dry run: {} entries of agent {} eligible for archival",
                    eligible.size(), agentId);
            return report;
        }

        int archived = 0;
        List<String> failed = new ArrayList<>();
        for (String key : eligible) {
            try {
                if (memoryRepository.deleteLongterm(agentId, key)) {
                    archived++;
                }
            } catch (RuntimeException e) {
                log.warn("[LongtermMemory] Failed to archive {}/{}: {}", agentId, key, e.getMessage());
                failed.add(key);
            }
        }
        report.setArchivedCount(archived);
        report.setFailedKeys(failed);
        log.info("[LongtermMemory] Archived {} entries of agent {} ({} failed)", archived, agentId, failed.size());
        return report;
    }

    private static boolean isEligible(LongtermMemory memory, ArchiveCriteria criteria, Instant cutoff) {
        if (cutoff != null && (memory.getCreatedAt() == null || !memory.getCreatedAt().isBefore(cutoff))) {
            return false;
        }
        if (criteria.getMaxAccessCount() != null && memory.getAccessCount() > criteria.getMaxAccessCount()) {
            return false;
        }
        if (criteria.getMaxImportance() != null && importanceOf(memory) > criteria.getMaxImportance()) {
            return false;
        }
        List<String> categories = criteria.getCategories();
        return categories == null || categories.isEmpty() || categories.contains(memory.getCategory());
    }

    private static int importanceOf(LongtermMemory memory) {
        return memory.getMetadata() != null ? memory.getMetadata().getImportance()
                : MemoryMetadata.DEFAULT_IMPORTANCE;
    }

    private LongtermMemory require(String agentId, String key) {
        MemoryValidationException.requireId(agentId, "agentId");
        MemoryValidationException.requireId(key, "key");
        return memoryRepository.findLongterm(agentId, key)
                .orElseThrow(() -> new MemoryNotFoundException(LongtermMemory.ENTITY_TYPE, agentId, key));
    }

    private String resolveCategory(String category) {
        if (category != null && !category.isBlank()) {
            return category.trim();
        }
        String configured = properties.getLongterm().getDefaultCategory();
        return configured != null && !configured.isBlank() ? configured : LongtermMemory.DEFAULT_CATEGORY;
    }

    private static void validateCriteria(ArchiveCriteria criteria) {
        Duration olderThan = criteria.getOlderThan();
        if (olderThan != null && olderThan.isNegative()) {
            throw new MemoryValidationException("olderThan must not be negative");
        }
        if (criteria.getMaxAccessCount() != null && criteria.getMaxAccessCount() < 0) {
            throw new MemoryValidationException("maxAccessCount must not be negative");
        }
        if (criteria.getMaxImportance() != null) {
            validateImportance(criteria.getMaxImportance(), "maxImportance");
        }
    }

    private static void validateMetadata(MemoryMetadata metadata) {
        validateImportance(metadata.getImportance(), METADATA_IMPORTANCE);
        double confidence = metadata.getConfidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new MemoryValidationException("confidence must be between 0.0 and 1.0, got " + confidence);
        }
        if (metadata.getSource() == null || metadata.getSource().isBlank()) {
            metadata.setSource(MemoryMetadata.DEFAULT_SOURCE);
        }
        if (metadata.getTags() == null) {
            metadata.setTags(new ArrayList<>());
        }
        if (metadata.getReferences() == null) {
            metadata.setReferences(new ArrayList<>());
        }
    }

    private static void validateImportance(int importance, String name) {
        if (importance < MemoryMetadata.MIN_IMPORTANCE || importance > MemoryMetadata.MAX_IMPORTANCE) {
            throw new MemoryValidationException(name + " must be between " + MemoryMetadata.MIN_IMPORTANCE
                    + " and " + MemoryMetadata.MAX_IMPORTANCE + ", got " + importance);
        }
    }

    static MemoryMetadata toMetadata(Map<String, Object> raw) {
        MemoryMetadata metadata = new MemoryMetadata();
        if (raw == null) {
            return metadata;
        }
        Object source = raw.get(METADATA_SOURCE);
        if (source != null) {
            metadata.setSource(source.toString());
        }
        Object importance = raw.get(METADATA_IMPORTANCE);
        if (importance != null) {
            metadata.setImportance(requireWholeNumber(importance, METADATA_IMPORTANCE));
        }
        Object confidence = raw.get(METADATA_CONFIDENCE);
        if (confidence != null) {
            metadata.setConfidence(requireNumber(confidence, METADATA_CONFIDENCE).doubleValue());
        }
        Object tags = raw.get(METADATA_TAGS);
        if (tags != null) {
            metadata.setTags(toStringList(tags, METADATA_TAGS));
        }
        Object references = raw.get(METADATA_REFERENCES);
        if (references != null) {
            metadata.setReferences(toStringList(references, METADATA_REFERENCES));
        }
        return metadata;
    }

    private static Number requireNumber(Object value, String name) {
        if (value instanceof Number number) {
            return number;
        }
        throw new MemoryValidationException(name + " must be a number, got " + value.getClass().getSimpleName());
    }

    /**
     * Narrow a JSON number to {@code int} without truncating a fraction or
     * wrapping a value outside the {@code int} range.
     */
    private static int requireWholeNumber(Object value, String name) {
        Number number = requireNumber(value, name);
        try {
            return new BigDecimal(number.toString()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MemoryValidationException(name + " must be a whole number, got " + number);
        }
    }

    private static List<String> toStringList(Object value, String name) {
        if (!(value instanceof Collection<?> collection)) {
            throw new MemoryValidationException(name + " must be a list");
        }
        List<String> result = new ArrayList<>(collection.size());
        for (Object element : collection) {
            if (element != null) {
                result.add(element.toString());
            }
        }
        return result;
    }
}
