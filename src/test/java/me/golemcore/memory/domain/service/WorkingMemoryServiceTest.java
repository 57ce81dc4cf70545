package me.golemcore.memory.domain.service;

import me.golemcore.memory.adapter.outbound.repository.InMemoryMemoryRepository;
import me.golemcore.memory.domain.exception.DuplicateMemoryException;
import me.golemcore.memory.domain.exception.MemoryExpiredException;
import me.golemcore.memory.domain.exception.MemoryNotFoundException;
import me.golemcore.memory.domain.exception.MemoryValidationException;
import me.golemcore.memory.domain.exception.VersionConflictException;
import me.golemcore.memory.domain.model.MemoryFilters;
import me.golemcore.memory.domain.model.WorkingMemory;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import me.golemcore.memory.testsupport.DirectExecutors;
import me.golemcore.memory.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class WorkingMemoryServiceTest {

    private static final String AGENT_ID = "agent-1";
    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private MemoryProperties properties;
    private InMemoryMemoryRepository repository;
    private WorkingMemoryService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        properties = new MemoryProperties();
        repository = new InMemoryMemoryRepository();
        service = new WorkingMemoryService(repository, properties,
                new MemoryTelemetryDispatcher(DirectExecutors.sameThread()), clock);
    }

    @Test
    void taskLifecycleWithOptimisticLocking() {
        WorkingMemory stored = service.store(AGENT_ID, "task", "pending", Duration.ofHours(1));
        assertEquals(1, stored.getVersion());

        WorkingMemory updated = service.update(AGENT_ID, "task", "in_progress", 1);
        assertEquals(2, updated.getVersion());
        assertEquals("in_progress", service.retrieve(AGENT_ID, "task"));

        VersionConflictException conflict = assertThrows(VersionConflictException.class,
                () -> service.update(AGENT_ID, "task", "done", 1));
        assertEquals(2, conflict.getActualVersion());
        assertEquals("in_progress", service.retrieve(AGENT_ID, "task"));
    }

    @Test
    void storeSetsExpiryFromTtl() {
        WorkingMemory stored = service.store(AGENT_ID, "task", "pending", Duration.ofMinutes(15));

        assertEquals(START, stored.getCreatedAt());
        assertEquals(START.plus(Duration.ofMinutes(15)), stored.getExpiresAt());
    }

    @Test
    void storeUsesConfiguredDefaultTtlWhenTtlMissing() {
        properties.getWorking().setDefaultTtl(Duration.ofMinutes(7));

        WorkingMemory stored = service.store(AGENT_ID, "task", "pending", null);

        assertEquals(START.plus(Duration.ofMinutes(7)), stored.getExpiresAt());
    }

    @Test
    void storeRejectsNonPositiveTtl() {
        assertThrows(MemoryValidationException.class,
                () -> service.store(AGENT_ID, "task", "pending", Duration.ZERO));
        assertThrows(MemoryValidationException.class,
                () -> service.store(AGENT_ID, "task", "pending", Duration.ofSeconds(-5)));
    }

    @Test
    void blankIdentifiersFailBeforeAnyStoreAccess() {
        MemoryRepositoryPort repositoryPort = mock(MemoryRepositoryPort.class);
        WorkingMemoryService guarded = new WorkingMemoryService(repositoryPort, properties,
                new MemoryTelemetryDispatcher(DirectExecutors.sameThread()), clock);

        assertThrows(MemoryValidationException.class, () -> guarded.store("", "task", "x", Duration.ofHours(1)));
        assertThrows(MemoryValidationException.class, () -> guarded.store(AGENT_ID, " ", "x", Duration.ofHours(1)));
        assertThrows(MemoryValidationException.class, () -> guarded.retrieve(null, "task"));
        assertThrows(MemoryValidationException.class, () -> guarded.update(AGENT_ID, "", "x", 1));
        assertThrows(MemoryValidationException.class, () -> guarded.clear(""));

        verifyNoInteractions(repositoryPort);
    }

    @Test
    void storeRejectsLiveDuplicateButReplacesExpiredEntry() {
        service.store(AGENT_ID, "task", "pending", Duration.ofMinutes(1));
        assertThrows(DuplicateMemoryException.class,
                () -> service.store(AGENT_ID, "task", "again", Duration.ofMinutes(1)));

        clock.advance(Duration.ofMinutes(2));
        WorkingMemory replaced = service.store(AGENT_ID, "task", "again", Duration.ofMinutes(1));

        assertEquals(1, replaced.getVersion());
        assertEquals("again", service.retrieve(AGENT_ID, "task"));
    }

    @Test
    void retrieveAfterExpiryFailsThenEntryIsGone() {
        service.store(AGENT_ID, "task", "pending", Duration.ofSeconds(1));

        clock.advance(Duration.ofSeconds(1));
        assertEquals("pending", service.retrieve(AGENT_ID, "task"));

        clock.advance(Duration.ofMillis(1));
        MemoryExpiredException expired = assertThrows(MemoryExpiredException.class,
                () -> service.retrieve(AGENT_ID, "task"));
        assertEquals(START.plusSeconds(1), expired.getExpiredAt());

        assertThrows(MemoryNotFoundException.class, () -> service.retrieve(AGENT_ID, "task"));
    }

    @Test
    void expiredCleanupKeepsEntryStoredAgainBeforeDelete() {
        List<WorkingMemoryService> racingWriter = new ArrayList<>();
        InMemoryMemoryRepository interleaving = new InMemoryMemoryRepository() {
            @Override
            public boolean deleteWorkingIfExpired(String agentId, String key, Instant now) {
                // Another caller replaces the expired entry between the expiry check and the delete
                racingWriter.get(0).store(agentId, key, "fresh", Duration.ofHours(1));
                return super.deleteWorkingIfExpired(agentId, key, now);
            }
        };
        WorkingMemoryService racing = new WorkingMemoryService(interleaving, properties,
                new MemoryTelemetryDispatcher(DirectExecutors.sameThread()), clock);
        racingWriter.add(racing);
        racing.store(AGENT_ID, "task", "stale", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        assertThrows(MemoryExpiredException.class, () -> racing.retrieve(AGENT_ID, "task"));

        assertEquals("fresh", racing.retrieve(AGENT_ID, "task"));
        assertEquals(1, interleaving.findWorking(AGENT_ID, "task").orElseThrow().getVersion());
    }

    @Test
    void retrieveMissingKeyFails() {
        MemoryNotFoundException ex = assertThrows(MemoryNotFoundException.class,
                () -> service.retrieve(AGENT_ID, "missing"));

        assertEquals("missing", ex.getKey());
    }

    @Test
    void retrieveRecordsAccessWithoutChangingVersion() {
        service.store(AGENT_ID, "task", "pending", Duration.ofHours(1));
        clock.advance(Duration.ofSeconds(30));

        service.retrieve(AGENT_ID, "task");
        service.retrieve(AGENT_ID, "task");

        WorkingMemory stored = repository.findWorking(AGENT_ID, "task").orElseThrow();
        assertEquals(2, stored.getAccessCount());
        assertEquals(START.plusSeconds(30), stored.getAccessedAt());
        assertEquals(1, stored.getVersion());
    }

    @Test
    void updateWithoutVersionUsesCurrentVersion() {
        service.store(AGENT_ID, "task", "pending", Duration.ofHours(1));
        clock.advance(Duration.ofSeconds(5));

        service.update(AGENT_ID, "task", "in_progress");
        WorkingMemory updated = service.update(AGENT_ID, "task", "done");

        assertEquals(3, updated.getVersion());
        assertEquals(START.plusSeconds(5), updated.getUpdatedAt());
        assertEquals(START, updated.getCreatedAt());
    }

    @Test
    void updateOfExpiredEntryFails() {
        service.store(AGENT_ID, "task", "pending", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        assertThrows(MemoryExpiredException.class, () -> service.update(AGENT_ID, "task", "late", 1));
    }

    @Test
    void concurrentUpdatesWithSameVersionHaveExactlyOneWinner() throws Exception {
        service.store(AGENT_ID, "task", "pending", Duration.ofHours(1));
        int writers = 6;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String value = "writer-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        service.update(AGENT_ID, "task", value, 1);
                        return true;
                    } catch (VersionConflictException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
            assertEquals(2, repository.findWorking(AGENT_ID, "task").orElseThrow().getVersion());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void deleteMissingKeyFails() {
        service.store(AGENT_ID, "task", "pending", Duration.ofHours(1));

        service.delete(AGENT_ID, "task");

        assertThrows(MemoryNotFoundException.class, () -> service.delete(AGENT_ID, "task"));
    }

    @Test
    void clearReturnsNumberOfRemovedEntries() {
        service.store(AGENT_ID, "a", 1, Duration.ofHours(1));
        service.store(AGENT_ID, "b", 2, Duration.ofHours(1));
        service.store("agent-2", "c", 3, Duration.ofHours(1));

        assertEquals(2, service.clear(AGENT_ID));
        assertTrue(service.list(AGENT_ID, null).isEmpty());
        assertEquals(1, service.list("agent-2", null).size());
    }

    @Test
    void listFiltersByTagsAndPaginates() {
        service.store(AGENT_ID, "a", 1, Duration.ofHours(1), Map.of("tags", List.of("plan")));
        clock.advance(Duration.ofSeconds(1));
        service.store(AGENT_ID, "b", 2, Duration.ofHours(1), Map.of("tags", List.of("plan", "urgent")));
        clock.advance(Duration.ofSeconds(1));
        service.store(AGENT_ID, "c", 3, Duration.ofHours(1), Map.of("tags", List.of("notes")));

        List<WorkingMemory> tagged = service.list(AGENT_ID, MemoryFilters.builder()
                .tags(List.of("urgent", "plan"))
                .sortBy(MemoryFilters.SORT_CREATED_AT)
                .build());
        List<WorkingMemory> page = service.list(AGENT_ID, MemoryFilters.builder().limit(2).build());

        assertEquals(List.of("a", "b"), tagged.stream().map(WorkingMemory::getKey).toList());
        assertEquals(List.of("c", "b"), page.stream().map(WorkingMemory::getKey).toList());
    }

    @Test
    void listRejectsInvalidFilters() {
        assertThrows(MemoryValidationException.class, () -> service.list(AGENT_ID,
                MemoryFilters.builder().sortBy("importance").build()));
        assertThrows(MemoryValidationException.class, () -> service.list(AGENT_ID,
                MemoryFilters.builder().limit(-1).build()));
        assertThrows(MemoryValidationException.class, () -> service.list(AGENT_ID,
                MemoryFilters.builder().afterTime(START.plusSeconds(10)).beforeTime(START).build()));
    }
}
