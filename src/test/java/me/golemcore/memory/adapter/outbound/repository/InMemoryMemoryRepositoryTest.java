package me.golemcore.memory.adapter.outbound.repository;

import me.golemcore.memory.domain.exception.DuplicateMemoryException;
import me.golemcore.memory.domain.exception.MemoryNotFoundException;
import me.golemcore.memory.domain.exception.VersionConflictException;
import me.golemcore.memory.domain.model.LongtermMemory;
import me.golemcore.memory.domain.model.MemoryFilters;
import me.golemcore.memory.domain.model.MemoryMetadata;
import me.golemcore.memory.domain.model.MemoryQuery;
import me.golemcore.memory.domain.model.SnapshotFilters;
import me.golemcore.memory.domain.model.SnapshotType;
import me.golemcore.memory.domain.model.StateSnapshot;
import me.golemcore.memory.domain.model.SyncState;
import me.golemcore.memory.domain.model.SyncStatus;
import me.golemcore.memory.domain.model.WorkingMemory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMemoryRepositoryTest {

    private static final String AGENT_ID = "agent-1";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private InMemoryMemoryRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryMemoryRepository();
    }

    // ==================== Working memory ====================

    @Test
    void createWorkingRejectsLiveDuplicate() {
        repository.createWorking(working("plan", NOW, Duration.ofHours(1)), NOW);

        assertThrows(DuplicateMemoryException.class,
                () -> repository.createWorking(working("plan", NOW, Duration.ofHours(1)), NOW));
    }

    @Test
    void createWorkingReplacesExpiredEntry() {
        repository.createWorking(working("plan", NOW, Duration.ofMinutes(1)), NOW);
        Instant later = NOW.plus(Duration.ofMinutes(2));

        WorkingMemory replacement = working("plan", later, Duration.ofHours(1));
        replacement.setValue("fresh");
        repository.createWorking(replacement, later);

        assertEquals("fresh", repository.findWorking(AGENT_ID, "plan").orElseThrow().getValue());
    }

    @Test
    void updateWorkingIsCompareAndSwap() {
        repository.createWorking(working("plan", NOW, Duration.ofHours(1)), NOW);
        WorkingMemory next = repository.findWorking(AGENT_ID, "plan").orElseThrow();
        next.setValue("v2");
        next.setVersion(2);

        WorkingMemory updated = repository.updateWorking(next, 1);
        assertEquals(2, updated.getVersion());

        next.setVersion(3);
        VersionConflictException conflict = assertThrows(VersionConflictException.class,
                () -> repository.updateWorking(next, 1));
        assertEquals(1, conflict.getExpectedVersion());
        assertEquals(2, conflict.getActualVersion());
        assertEquals("v2", repository.findWorking(AGENT_ID, "plan").orElseThrow().getValue());
    }

    @Test
    void updateWorkingFailsForMissingKey() {
        WorkingMemory ghost = working("ghost", NOW, Duration.ofHours(1));

        assertThrows(MemoryNotFoundException.class, () -> repository.updateWorking(ghost, 1));
    }

    @Test
    void concurrentUpdatesWithSameVersionHaveExactlyOneWinner() throws Exception {
        repository.createWorking(working("counter", NOW, Duration.ofHours(1)), NOW);
        int writers = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                int writer = i;
                results.add(pool.submit(() -> {
                    WorkingMemory next = repository.findWorking(AGENT_ID, "counter").orElseThrow();
                    next.setValue("writer-" + writer);
                    next.setVersion(2);
                    start.await();
                    try {
                        repository.updateWorking(next, 1);
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
            assertEquals(2, repository.findWorking(AGENT_ID, "counter").orElseThrow().getVersion());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void returnedEntitiesAreDetachedCopies() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("step", 1);
        WorkingMemory memory = working("plan", NOW, Duration.ofHours(1));
        memory.setValue(value);
        repository.createWorking(memory, NOW);

        value.put("step", 99);
        WorkingMemory read = repository.findWorking(AGENT_ID, "plan").orElseThrow();
        @SuppressWarnings("unchecked")
        Map<String, Object> readValue = (Map<String, Object>) read.getValue();
        readValue.put("step", 42);
        read.setVersion(100);

        WorkingMemory again = repository.findWorking(AGENT_ID, "plan").orElseThrow();
        assertEquals(Map.of("step", 1), again.getValue());
        assertEquals(1, again.getVersion());
    }

    @Test
    void listWorkingFiltersByAnyTagAndHidesExpired() {
        repository.createWorking(tagged("a", NOW, Duration.ofHours(1), List.of("red", "blue")), NOW);
        repository.createWorking(tagged("b", NOW, Duration.ofHours(1), List.of("green")), NOW);
        repository.createWorking(tagged("c", NOW, Duration.ofSeconds(1), List.of("blue")), NOW);

        Instant later = NOW.plusSeconds(5);
        List<WorkingMemory> result = repository.listWorking(AGENT_ID,
                MemoryFilters.builder().tags(List.of("blue", "yellow")).build(), later);

        assertEquals(List.of("a"), keys(result));
    }

    @Test
    void listWorkingDefaultsToNewestFirstAndPaginates() {
        repository.createWorking(working("first", NOW, Duration.ofHours(1)), NOW);
        repository.createWorking(working("second", NOW.plusSeconds(1), Duration.ofHours(1)), NOW);
        repository.createWorking(working("third", NOW.plusSeconds(2), Duration.ofHours(1)), NOW);

        assertEquals(List.of("third", "second", "first"),
                keys(repository.listWorking(AGENT_ID, MemoryFilters.none(), NOW)));
        assertEquals(List.of("second"), keys(repository.listWorking(AGENT_ID,
                MemoryFilters.builder().offset(1).limit(1).build(), NOW)));
        assertEquals(List.of("first", "second", "third"), keys(repository.listWorking(AGENT_ID,
                MemoryFilters.builder().sortBy(MemoryFilters.SORT_KEY).build(), NOW)));
    }

    @Test
    void listWorkingAppliesInclusiveTimeWindow() {
        repository.createWorking(working("early", NOW, Duration.ofHours(1)), NOW);
        repository.createWorking(working("middle", NOW.plusSeconds(10), Duration.ofHours(1)), NOW);
        repository.createWorking(working("late", NOW.plusSeconds(20), Duration.ofHours(1)), NOW);

        List<WorkingMemory> result = repository.listWorking(AGENT_ID, MemoryFilters.builder()
                .afterTime(NOW.plusSeconds(10))
                .beforeTime(NOW.plusSeconds(20))
                .build(), NOW);

        assertEquals(List.of("late", "middle"), keys(result));
    }

    @Test
    void recordWorkingAccessKeepsVersion() {
        repository.createWorking(working("plan", NOW, Duration.ofHours(1)), NOW);

        repository.recordWorkingAccess(AGENT_ID, "plan", NOW.plusSeconds(3));
        repository.recordWorkingAccess(AGENT_ID, "plan", NOW.plusSeconds(4));

        WorkingMemory read = repository.findWorking(AGENT_ID, "plan").orElseThrow();
        assertEquals(2, read.getAccessCount());
        assertEquals(NOW.plusSeconds(4), read.getAccessedAt());
        assertEquals(1, read.getVersion());
    }

    @Test
    void clearWorkingReturnsCount() {
        repository.createWorking(working("a", NOW, Duration.ofHours(1)), NOW);
        repository.createWorking(working("b", NOW, Duration.ofHours(1)), NOW);

        assertEquals(2, repository.clearWorking(AGENT_ID));
        assertEquals(0, repository.clearWorking(AGENT_ID));
        assertEquals(0, repository.clearWorking("unknown-agent"));
    }

    @Test
    void deleteExpiredWorkingRemovesOnlyEntriesStrictlyPastExpiry() {
        repository.createWorking(working("boundary", NOW, Duration.ofMinutes(10)), NOW);
        repository.createWorking(working("past", NOW, Duration.ofMinutes(5)), NOW);
        repository.createWorking(working("future", NOW, Duration.ofMinutes(20)), NOW);

        int removed = repository.deleteExpiredWorking(NOW.plus(Duration.ofMinutes(10)));

        assertEquals(1, removed);
        assertTrue(repository.findWorking(AGENT_ID, "boundary").isPresent());
        assertTrue(repository.findWorking(AGENT_ID, "future").isPresent());
        assertFalse(repository.findWorking(AGENT_ID, "past").isPresent());
    }

    @Test
    void deleteWorkingIfExpiredLeavesLiveEntry() {
        repository.createWorking(working("plan", NOW, Duration.ofMinutes(1)), NOW);

        assertFalse(repository.deleteWorkingIfExpired(AGENT_ID, "plan", NOW.plusSeconds(30)));
        assertTrue(repository.findWorking(AGENT_ID, "plan").isPresent());

        assertTrue(repository.deleteWorkingIfExpired(AGENT_ID, "plan", NOW.plus(Duration.ofMinutes(2))));
        assertFalse(repository.findWorking(AGENT_ID, "plan").isPresent());
        assertFalse(repository.deleteWorkingIfExpired(AGENT_ID, "plan", NOW.plus(Duration.ofMinutes(2))));
        assertFalse(repository.deleteWorkingIfExpired("unknown-agent", "plan", NOW));
    }

    // ==================== Long-term memory ====================

    @Test
    void searchLongtermDefaultsToImportanceThenNewest() {
        repository.createLongterm(longterm("low", 2, NOW));
        repository.createLongterm(longterm("high-old", 9, NOW));
        repository.createLongterm(longterm("high-new", 9, NOW.plusSeconds(5)));

        List<LongtermMemory> result = repository.searchLongterm(AGENT_ID, new MemoryQuery());

        assertEquals(List.of("high-new", "high-old", "low"), keys(result));
    }

    @Test
    void searchLongtermNarrowsByTextAndMinImportance() {
        LongtermMemory deploy = longterm("deploy-checklist", 7, NOW);
        deploy.getMetadata().setTags(new ArrayList<>(List.of("ops")));
        repository.createLongterm(deploy);
        repository.createLongterm(longterm("lunch-order", 7, NOW));
        repository.createLongterm(longterm("deploy-notes", 3, NOW));

        List<LongtermMemory> byText = repository.searchLongterm(AGENT_ID, MemoryQuery.builder()
                .query("DEPLOY")
                .filters(MemoryFilters.builder().minImportance(5).build())
                .build());
        List<LongtermMemory> byTag = repository.searchLongterm(AGENT_ID, MemoryQuery.builder()
                .query("op")
                .build());

        assertEquals(List.of("deploy-checklist"), keys(byText));
        assertEquals(List.of("deploy-checklist"), keys(byTag));
    }

    @Test
    void listLongtermFiltersByCategory() {
        LongtermMemory fact = longterm("fact", 5, NOW);
        fact.setCategory("facts");
        repository.createLongterm(fact);
        repository.createLongterm(longterm("other", 5, NOW));

        List<LongtermMemory> result = repository.listLongterm(AGENT_ID,
                MemoryFilters.builder().category("facts").build());

        assertEquals(List.of("fact"), keys(result));
    }

    @Test
    void createLongtermRejectsDuplicate() {
        repository.createLongterm(longterm("fact", 5, NOW));

        assertThrows(DuplicateMemoryException.class, () -> repository.createLongterm(longterm("fact", 5, NOW)));
    }

    // ==================== Snapshots & sync ====================

    @Test
    void listSnapshotsNewestFirstForOwnerOnly() {
        repository.createSnapshot(snapshot("s1", AGENT_ID, NOW, SnapshotType.MANUAL));
        repository.createSnapshot(snapshot("s2", AGENT_ID, NOW.plusSeconds(60), SnapshotType.PERIODIC));
        repository.createSnapshot(snapshot("s3", "agent-2", NOW.plusSeconds(120), SnapshotType.MANUAL));

        List<StateSnapshot> all = repository.listSnapshots(AGENT_ID, SnapshotFilters.none());
        List<StateSnapshot> manual = repository.listSnapshots(AGENT_ID,
                SnapshotFilters.builder().snapshotType(SnapshotType.MANUAL).build());

        assertEquals(List.of("s2", "s1"), all.stream().map(StateSnapshot::getId).toList());
        assertEquals(List.of("s1"), manual.stream().map(StateSnapshot::getId).toList());
    }

    @Test
    void deleteExpiredSnapshotsUsesStrictComparison() {
        StateSnapshot boundary = snapshot("boundary", AGENT_ID, NOW, SnapshotType.MANUAL);
        boundary.setExpiresAt(NOW.plusSeconds(10));
        StateSnapshot past = snapshot("past", AGENT_ID, NOW, SnapshotType.MANUAL);
        past.setExpiresAt(NOW.plusSeconds(5));
        repository.createSnapshot(boundary);
        repository.createSnapshot(past);

        assertEquals(1, repository.deleteExpiredSnapshots(NOW.plusSeconds(10)));
        assertTrue(repository.findSnapshot("boundary").isPresent());
        assertFalse(repository.findSnapshot("past").isPresent());
    }

    @Test
    void upsertSyncStatusReplacesPerInstance() {
        repository.upsertSyncStatus(SyncStatus.initial(AGENT_ID, "instance-a"));
        SyncStatus updated = SyncStatus.initial(AGENT_ID, "instance-a");
        updated.setSyncVersion(3);
        updated.setStatus(SyncState.CONFLICT);
        repository.upsertSyncStatus(updated);
        repository.upsertSyncStatus(SyncStatus.initial(AGENT_ID, "instance-b"));

        SyncStatus read = repository.findSyncStatus(AGENT_ID, "instance-a").orElseThrow();
        assertEquals(3, read.getSyncVersion());
        assertEquals(SyncState.CONFLICT, read.getStatus());
        assertEquals(2, repository.listSyncStatuses(AGENT_ID).size());
        assertTrue(repository.findSyncStatus(AGENT_ID, "instance-c").isEmpty());
    }

    // ==================== Fixtures ====================

    private static WorkingMemory working(String key, Instant createdAt, Duration ttl) {
        return WorkingMemory.builder()
                .id("id-" + key)
                .agentId(AGENT_ID)
                .key(key)
                .value("value-" + key)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .expiresAt(createdAt.plus(ttl))
                .version(1)
                .build();
    }

    private static WorkingMemory tagged(String key, Instant createdAt, Duration ttl, List<String> tags) {
        WorkingMemory memory = working(key, createdAt, ttl);
        memory.getMetadata().put(WorkingMemory.TAGS_METADATA_KEY, tags);
        return memory;
    }

    private static LongtermMemory longterm(String key, int importance, Instant createdAt) {
        return LongtermMemory.builder()
                .id("id-" + key)
                .agentId(AGENT_ID)
                .key(key)
                .value("value-" + key)
                .metadata(MemoryMetadata.builder().importance(importance).build())
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .version(1)
                .build();
    }

    private static StateSnapshot snapshot(String id, String agentId, Instant createdAt, SnapshotType type) {
        return StateSnapshot.builder()
                .id(id)
                .agentId(agentId)
                .snapshotType(type)
                .checksum("checksum")
                .createdAt(createdAt)
                .expiresAt(createdAt.plus(type.getDefaultRetention()))
                .build();
    }

    private static List<String> keys(List<?> memories) {
        List<String> keys = new ArrayList<>();
        for (Object memory : memories) {
            keys.add(memory instanceof WorkingMemory w ? w.getKey() : ((LongtermMemory) memory).getKey());
        }
        return keys;
    }
}
