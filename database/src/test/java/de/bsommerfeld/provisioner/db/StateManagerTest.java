package de.bsommerfeld.provisioner.db;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StateManagerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);

    @Mock
    private StateStore failingStore;

    private InMemoryStateStore store;
    private StateManager manager;

    @BeforeEach
    void setUp() {
        store = new InMemoryStateStore();
        manager = new StateManager(store, CLOCK);
    }

    @Test
    void startInstallation_shouldAllocateShortHexId() {
        InstallationState installation = manager.startInstallation("default", Map.of("host", "vps-1"));

        assertTrue(installation.installationId().matches("inst-[0-9a-f]{12}"), installation.installationId());
        assertEquals(InstallationStatus.IN_PROGRESS, installation.status());
        assertTrue(manager.canResume());
    }

    @Test
    void updateModule_shouldStampTimestampsOnTransitions() {
        Clock[] now = { CLOCK };
        StateManager ticking = new StateManager(store, new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return now[0].instant();
            }
        });
        ticking.startInstallation("default", Map.of());

        ticking.updateModule("docker", ModuleStatus.RUNNING);
        now[0] = Clock.offset(CLOCK, Duration.ofSeconds(3));
        ticking.updateModule("docker", ModuleStatus.RUNNING, 50, "installing", null);
        now[0] = Clock.offset(CLOCK, Duration.ofSeconds(12));
        ticking.updateModule("docker", ModuleStatus.COMPLETED);

        ModuleState state = ticking.getModuleState("docker").orElseThrow();
        assertEquals(CLOCK.instant(), state.startedAt());
        assertEquals(CLOCK.instant().plusSeconds(12), state.completedAt());
        assertEquals(12.0, state.durationSeconds());
        assertEquals(50, state.progressPercent());
        assertEquals("installing", state.currentStep());
    }

    @Test
    void updateModule_shouldApplyOnlyGivenFieldsAndClampProgress() {
        manager.startInstallation("default", Map.of());

        manager.updateModule("git", null, 150, "cloning", null);
        manager.updateModule("git", null, -3, null, "timeout");

        ModuleState state = manager.getModuleState("git").orElseThrow();
        assertEquals(ModuleStatus.PENDING, state.status());
        assertEquals(0, state.progressPercent());
        assertEquals("cloning", state.currentStep());
        assertEquals("timeout", state.errorMessage());
    }

    @Test
    void updateModule_shouldRequireActiveInstallation() {
        assertThrows(IllegalStateException.class, () -> manager.updateModule("git", ModuleStatus.RUNNING));
        assertThrows(IllegalStateException.class, () -> manager.createCheckpoint("git", "x"));
        assertThrows(IllegalStateException.class, () -> manager.completeInstallation(true));
    }

    @Test
    void createCheckpoint_shouldUpdateFieldAndAppendSnapshot() {
        InstallationState installation = manager.startInstallation("default", Map.of());
        manager.updateModule("docker", ModuleStatus.RUNNING, 30, null, null);

        manager.createCheckpoint("docker", "repo-added");
        manager.createCheckpoint("docker", "engine-installed");

        assertEquals("engine-installed", manager.getModuleState("docker").orElseThrow().checkpoint());
        List<CheckpointSnapshot> snapshots = manager.getCheckpoints(installation.installationId(), "docker");
        assertEquals(List.of("repo-added", "engine-installed"),
                snapshots.stream().map(CheckpointSnapshot::checkpointName).toList());
        assertEquals("repo-added", snapshots.get(0).snapshot().checkpoint());
    }

    @Test
    void createCheckpoint_shouldIgnoreUnknownModule() {
        InstallationState installation = manager.startInstallation("default", Map.of());

        manager.createCheckpoint("ghost", "never");

        assertTrue(manager.getCheckpoints(installation.installationId(), "ghost").isEmpty());
    }

    @Test
    void recordRollbackAction_shouldAppendToModuleState() {
        manager.startInstallation("default", Map.of());
        manager.updateModule("docker", ModuleStatus.RUNNING);

        manager.recordRollbackAction("docker", "Remove packages: docker-ce");
        manager.recordRollbackAction("docker", "Stop service: docker");

        assertEquals(List.of("Remove packages: docker-ce", "Stop service: docker"),
                manager.getModuleState("docker").orElseThrow().rollbackActions());
    }

    @Test
    void resumeInstallation_shouldReturnEmptyWhenNothingIsResumable() {
        manager.startInstallation("default", Map.of());
        manager.completeInstallation(true);

        assertFalse(manager.canResume());
        assertTrue(new StateManager(store, CLOCK).resumeInstallation().isEmpty());
    }

    @Test
    void resumeInstallation_shouldRehydrateModules() {
        InstallationState started = manager.startInstallation("default", Map.of());
        manager.updateModule("system", ModuleStatus.COMPLETED);
        manager.updateModule("docker", ModuleStatus.RUNNING, 40, "installing", null);

        StateManager afterCrash = new StateManager(store, CLOCK);
        InstallationState resumed = afterCrash.resumeInstallation().orElseThrow();

        assertEquals(started.installationId(), resumed.installationId());
        assertEquals(ModuleStatus.COMPLETED, resumed.modules().get("system").status());
        assertEquals(40, afterCrash.getModuleState("docker").orElseThrow().progressPercent());
        assertEquals(2, afterCrash.getCurrentState().orElseThrow().modules().size());
    }

    @Test
    void completeInstallation_shouldRecordOutcome() {
        manager.startInstallation("default", Map.of());

        manager.completeInstallation(false);

        InstallationState state = manager.getCurrentState().orElseThrow();
        assertEquals(InstallationStatus.FAILED, state.status());
        assertEquals(CLOCK.instant(), state.completedAt());
        assertEquals(InstallationStatus.FAILED, manager.getInstallationHistory(5).get(0).status());
    }

    @Test
    void updateModule_shouldSwallowPersistenceFailures() {
        StateManager flaky = new StateManager(failingStore, CLOCK);
        flaky.startInstallation("default", Map.of());
        doThrow(new StateStoreException("disk full", null)).when(failingStore).upsertModule(anyString(), any());
        doThrow(new StateStoreException("disk full", null)).when(failingStore).insertCheckpoint(any());

        assertDoesNotThrow(() -> flaky.updateModule("git", ModuleStatus.RUNNING));
        assertDoesNotThrow(() -> flaky.createCheckpoint("git", "cloned"));
        assertEquals("cloned", flaky.getModuleState("git").orElseThrow().checkpoint());
    }

    @Test
    void startInstallation_shouldPropagatePersistenceFailures() {
        StateManager flaky = new StateManager(failingStore, CLOCK);
        doThrow(new StateStoreException("read-only", null)).when(failingStore).insertInstallation(any());

        assertThrows(StateStoreException.class, () -> flaky.startInstallation("default", Map.of()));
        assertTrue(flaky.getCurrentState().isEmpty());
    }

    @Test
    void resumeInstallation_shouldPropagateStoreFailures() {
        StateManager flaky = new StateManager(failingStore, CLOCK);
        when(failingStore.findResumableInstallation()).thenThrow(new StateStoreException("corrupt", null));

        assertThrows(StateStoreException.class, flaky::resumeInstallation);
    }

    @Test
    void getCurrentState_shouldBeEmptyBeforeStart() {
        assertEquals(Optional.empty(), manager.getCurrentState());
    }
}
