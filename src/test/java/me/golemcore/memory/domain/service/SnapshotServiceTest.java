package me.golemcore.memory.domain.service;

import me.golemcore.memory.adapter.outbound.repository.InMemoryMemoryRepository;
import me.golemcore.memory.domain.exception.MemoryNotFoundException;
import me.golemcore.memory.domain.exception.MemoryValidationException;
import me.golemcore.memory.domain.exception.SnapshotIntegrityException;
import me.golemcore.memory.domain.exception.SnapshotOwnershipException;
import me.golemcore.memory.domain.model.LongtermMemory;
import me.golemcore.memory.domain.model.RestoreReport;
import me.golemcore.memory.domain.model.SnapshotFilters;
import me.golemcore.memory.domain.model.SnapshotType;
import me.golemcore.memory.domain.model.StateSnapshot;
import me.golemcore.memory.domain.model.WorkingMemory;
import me.golemcore.memory.infrastructure.config.MemoryConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.testsupport.DirectExecutors;
import me.golemcore.memory.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotServiceTest {

    private static final String AGENT_ID = "agent-1";
    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private MemoryProperties properties;
    private InMemoryMemoryRepository repository;
    private SnapshotChecksums checksums;
    private WorkingMemoryService workingMemoryService;
    private LongtermMemoryService longtermMemoryService;
    private SnapshotService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        properties = new MemoryProperties();
        repository = new InMemoryMemoryRepository();
        checksums = new SnapshotChecksums(MemoryConfiguration.objectMapper());
        MemoryTelemetryDispatcher dispatcher = new MemoryTelemetryDispatcher(DirectExecutors.sameThread());
        workingMemoryService = new WorkingMemoryService(repository, properties, dispatcher, clock);
        longtermMemoryService = new LongtermMemoryService(repository, properties, dispatcher, clock);
        service = new SnapshotService(repository, properties, checksums, clock);
    }

    // ==================== create ====================

    @Test
    void createCapturesWorkingAndLongtermState() {
        workingMemoryService.store(AGENT_ID, "task", "pending", Duration.ofHours(1));
        workingMemoryService.store(AGENT_ID, "step", 3, Duration.ofHours(1));
        longtermMemoryService.remember(AGENT_ID, "capital", "Paris", "facts");
        longtermMemoryService.remember(AGENT_ID, "language", "en", "preferences");
        longtermMemoryService.remember(AGENT_ID, "timezone", "UTC", "preferences");

        StateSnapshot snapshot = service.create(AGENT_ID, "periodic", "hourly");

        Map<String, Object> state = snapshot.getState();
        assertEquals(List.of("step", "task"), state.get(SnapshotService.STATE_WORKING_KEYS));
        assertEquals(2, state.get(SnapshotService.STATE_WORKING_COUNT));
        assertEquals(3, state.get(SnapshotService.STATE_LONGTERM_COUNT));
        assertEquals(Map.of("facts", 1, "preferences", 2), state.get(SnapshotService.STATE_LONGTERM_CATEGORIES));
        assertEquals(START.toString(), state.get(SnapshotService.STATE_SNAPSHOT_TIME));
        assertEquals(SnapshotType.PERIODIC, snapshot.getSnapshotType());
        assertEquals("hourly", snapshot.getMetadata().getReason());
    }

    @Test
    void checksumMatchesStoredState() {
        workingMemoryService.store(AGENT_ID, "task", Map.of("title", "write report", "steps", List.of(1, 2)),
                Duration.ofHours(1));

        StateSnapshot created = service.create(AGENT_ID, "manual", null);
        StateSnapshot loaded = service.get(created.getId());

        assertEquals(64, created.getChecksum().length());
        assertEquals(created.getChecksum(), checksums.checksum(loaded.getState()));
        assertTrue(checksums.verify(loaded));
        assertEquals(checksums.canonicalJson(loaded.getState()).length(), created.getMetadata().getSizeBytes());
    }

    @Test
    void createAppliesDefaults() {
        StateSnapshot snapshot = service.create(AGENT_ID, " ", null);

        assertEquals(SnapshotType.MANUAL, snapshot.getSnapshotType());
        assertEquals(SnapshotService.DEFAULT_REASON, snapshot.getMetadata().getReason());
        assertEquals(SnapshotService.DEFAULT_TRIGGER, snapshot.getMetadata().getTrigger());
        assertFalse(snapshot.getMetadata().isCompressed());
        assertEquals(1, snapshot.getVersion());
        assertEquals(0, snapshot.getState().get(SnapshotService.STATE_WORKING_COUNT));
    }

    @Test
    void createSetsRetentionPerType() {
        properties.getSnapshot().getRetention().setManual(Duration.ofDays(2));

        StateSnapshot periodic = service.create(AGENT_ID, "periodic", null);
        StateSnapshot preUpdate = service.create(AGENT_ID, SnapshotType.PRE_UPDATE, "upgrade", "updater");
        StateSnapshot manual = service.create(AGENT_ID, "manual", null);

        assertEquals(START.plus(Duration.ofDays(7)), periodic.getExpiresAt());
        assertEquals(START.plus(Duration.ofDays(90)), preUpdate.getExpiresAt());
        assertEquals("updater", preUpdate.getMetadata().getTrigger());
        assertEquals(START.plus(Duration.ofDays(2)), manual.getExpiresAt());
    }

    @Test
    void createRejectsUnknownType() {
        assertThrows(MemoryValidationException.class, () -> service.create(AGENT_ID, "hourly", null));
    }

    // ==================== restore ====================

    @Test
    void restoreReplacesWorkingMemoryAndBumpsVersions() {
        workingMemoryService.store(AGENT_ID, "task", "pending", Duration.ofHours(1), Map.of("tags", List.of("plan")));
        StateSnapshot snapshot = service.create(AGENT_ID, "manual", "before work");

        clock.advance(Duration.ofMinutes(1));
        workingMemoryService.update(AGENT_ID, "task", "in_progress", 1);
        workingMemoryService.store(AGENT_ID, "scratch", "temp", Duration.ofHours(1));

        RestoreReport report = service.restore(AGENT_ID, snapshot.getId());

        assertEquals(2, report.getClearedCount());
        assertEquals(List.of("task"), report.getRestoredKeys());
        assertTrue(report.getSkippedExpiredKeys().isEmpty());

        WorkingMemory restored = repository.findWorking(AGENT_ID, "task").orElseThrow();
        assertEquals("pending", restored.getValue());
        assertEquals(3, restored.getVersion());
        assertEquals(START, restored.getCreatedAt());
        assertEquals(START.plus(Duration.ofHours(1)), restored.getExpiresAt());
        assertEquals(List.of("plan"), restored.getTags());
        assertTrue(repository.findWorking(AGENT_ID, "scratch").isEmpty());
    }

    @Test
    void restoreSkipsEntriesExpiredSinceCapture() {
        workingMemoryService.store(AGENT_ID, "short", "a", Duration.ofMinutes(1));
        workingMemoryService.store(AGENT_ID, "long", "b", Duration.ofHours(2));
        StateSnapshot snapshot = service.create(AGENT_ID, "manual", null);

        clock.advance(Duration.ofMinutes(5));
        RestoreReport report = service.restore(AGENT_ID, snapshot.getId());

        assertEquals(List.of("long"), report.getRestoredKeys());
        assertEquals(List.of("short"), report.getSkippedExpiredKeys());
        assertEquals(2, repository.findWorking(AGENT_ID, "long").orElseThrow().getVersion());
        assertTrue(repository.findWorking(AGENT_ID, "short").isEmpty());
    }

    @Test
    void restoreDoesNotRollBackLongtermMemory() {
        longtermMemoryService.remember(AGENT_ID, "capital", "Paris", "facts");
        StateSnapshot snapshot = service.create(AGENT_ID, "manual", null);

        longtermMemoryService.update(AGENT_ID, "capital", "Paris, France");
        longtermMemoryService.remember(AGENT_ID, "language", "en", "preferences");
        service.restore(AGENT_ID, snapshot.getId());

        LongtermMemory capital = repository.findLongterm(AGENT_ID, "capital").orElseThrow();
        assertEquals("Paris, France", capital.getValue());
        assertEquals(2, capital.getVersion());
        assertTrue(repository.findLongterm(AGENT_ID, "language").isPresent());
    }

    @Test
    void restoreChecksOwnershipBeforeIntegrity() {
        workingMemoryService.store(AGENT_ID, "task", "pending", Duration.ofHours(1));
        StateSnapshot foreign = service.create("agent-2", "manual", null);
        StateSnapshot tampered = tamperedCopy(foreign, "tampered-foreign");
        repository.createSnapshot(tampered);

        assertThrows(SnapshotOwnershipException.class, () -> service.restore(AGENT_ID, foreign.getId()));
        assertThrows(SnapshotOwnershipException.class, () -> service.restore(AGENT_ID, tampered.getId()));
        assertEquals("pending", workingMemoryService.retrieve(AGENT_ID, "task"));
    }

    @Test
    void restoreRejectsTamperedState() {
        workingMemoryService.store(AGENT_ID, "task", "pending", Duration.ofHours(1));
        StateSnapshot snapshot = service.create(AGENT_ID, "manual", null);
        StateSnapshot tampered = tamperedCopy(snapshot, "tampered");
        repository.createSnapshot(tampered);
        workingMemoryService.update(AGENT_ID, "task", "in_progress");

        assertThrows(SnapshotIntegrityException.class, () -> service.restore(AGENT_ID, tampered.getId()));
        assertEquals("in_progress", workingMemoryService.retrieve(AGENT_ID, "task"));
        assertEquals(2, repository.findWorking(AGENT_ID, "task").orElseThrow().getVersion());
    }

    @Test
    void restoreOfMissingSnapshotFails() {
        assertThrows(MemoryNotFoundException.class, () -> service.restore(AGENT_ID, "nope"));
    }

    // ==================== list / delete ====================

    @Test
    void listReturnsNewestFirstAndFiltersByType() {
        StateSnapshot first = service.create(AGENT_ID, "manual", null);
        clock.advance(Duration.ofMinutes(1));
        StateSnapshot second = service.create(AGENT_ID, "periodic", null);
        clock.advance(Duration.ofMinutes(1));
        StateSnapshot third = service.create(AGENT_ID, "manual", null);
        service.create("agent-2", "manual", null);

        List<StateSnapshot> all = service.list(AGENT_ID, null);
        List<StateSnapshot> manual = service.list(AGENT_ID,
                SnapshotFilters.builder().snapshotType(SnapshotType.MANUAL).build());

        assertEquals(List.of(third.getId(), second.getId(), first.getId()),
                all.stream().map(StateSnapshot::getId).toList());
        assertEquals(List.of(third.getId(), first.getId()),
                manual.stream().map(StateSnapshot::getId).toList());
        assertThrows(MemoryValidationException.class,
                () -> service.list(AGENT_ID, SnapshotFilters.builder().offset(-1).build()));
    }

    @Test
    void deleteRemovesSnapshotAndFailsWhenAbsent() {
        StateSnapshot snapshot = service.create(AGENT_ID, "manual", null);

        service.delete(snapshot.getId());

        assertThrows(MemoryNotFoundException.class, () -> service.get(snapshot.getId()));
        assertThrows(MemoryNotFoundException.class, () -> service.delete(snapshot.getId()));
    }

    private static StateSnapshot tamperedCopy(StateSnapshot snapshot, String id) {
        Map<String, Object> state = new LinkedHashMap<>(snapshot.getState());
        state.put(SnapshotService.STATE_WORKING_COUNT, 42);
        return snapshot.toBuilder()
                .id(id)
                .state(state)
                .build();
    }
}
