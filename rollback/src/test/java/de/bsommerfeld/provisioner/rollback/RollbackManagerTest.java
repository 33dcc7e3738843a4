package de.bsommerfeld.provisioner.rollback;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

/**
 * Rollback replay against a mocked {@link CommandRunner}; the state file
 * lives in a temporary directory.
 */
@ExtendWith(MockitoExtension.class)
class RollbackManagerTest {

    private static final CommandResult OK = new CommandResult(0, "", false);
    private static final CommandResult EXIT_1 = new CommandResult(1, "failed", false);

    @TempDir
    Path tempDir;

    @Mock
    private CommandRunner runner;

    private Path stateFile;
    private RollbackManager manager;

    @BeforeEach
    void setUp() {
        stateFile = tempDir.resolve("state").resolve("rollback-state.json");
        manager = new RollbackManager(stateFile, runner);
    }

    @Test
    void rollback_shouldUndoInReverseOrder() throws Exception {
        when(runner.run(anyString())).thenReturn(OK);
        manager.addCommand("undo-a");
        manager.addCommand("undo-b");
        manager.addCommand("undo-c");

        RollbackOutcome outcome = manager.rollback(false);

        InOrder order = inOrder(runner);
        order.verify(runner).run("undo-c");
        order.verify(runner).run("undo-b");
        order.verify(runner).run("undo-a");
        assertTrue(outcome.success());
        assertEquals(3, outcome.attempted());
    }

    @Test
    void rollback_shouldClearListAndDeleteFileOnFullSuccess() throws Exception {
        when(runner.run(anyString())).thenReturn(OK);
        manager.addPackageRemove(List.of("docker-ce", "docker-ce-cli"));
        assertTrue(Files.exists(stateFile));

        manager.rollback(false);

        verify(runner).run("apt-get remove -y docker-ce docker-ce-cli");
        assertFalse(manager.hasPendingActions());
        assertFalse(Files.exists(stateFile));
        assertEquals("No rollback actions pending", manager.getSummary());
    }

    @Test
    void rollback_shouldKeepOnlyFailedActionsAndContinuePastFailures() throws Exception {
        when(runner.run("undo-a")).thenReturn(EXIT_1);
        when(runner.run("undo-b")).thenReturn(OK);
        when(runner.run("undo-c")).thenThrow(new IOException("sh not found"));
        manager.addCommand("undo-a");
        manager.addCommand("undo-b");
        manager.addCommand("undo-c");

        RollbackOutcome outcome = manager.rollback(false);

        assertFalse(outcome.success());
        verify(runner).run("undo-a");
        assertEquals(List.of("undo-a", "undo-c"), manager.getActions().stream()
                .map(action -> action.data().get("command"))
                .toList());
        assertEquals(2, outcome.failures().size());
        assertTrue(outcome.failures().get(0).reason().contains("exited with code 1"));

        RollbackManager reloaded = new RollbackManager(stateFile, runner);
        assertTrue(reloaded.loadState());
        assertEquals(manager.getActions(), reloaded.getActions());
    }

    @Test
    void rollback_shouldStopAndDisableService() throws Exception {
        when(runner.run(anyString())).thenReturn(OK);
        manager.addServiceStop("netdata");

        manager.rollback(false);

        InOrder order = inOrder(runner);
        order.verify(runner).run("systemctl stop netdata");
        order.verify(runner).run("systemctl disable netdata");
    }

    @Test
    void rollback_shouldDisableServiceEvenWhenStopFails() throws Exception {
        when(runner.run("systemctl stop netdata")).thenReturn(EXIT_1);
        when(runner.run("systemctl disable netdata")).thenReturn(OK);
        manager.addServiceStop("netdata");

        RollbackOutcome outcome = manager.rollback(false);

        assertFalse(outcome.success());
        verify(runner).run("systemctl disable netdata");
        assertEquals(1, manager.getActions().size());
    }

    @Test
    void rollback_shouldContinuePastMalformedAction() throws Exception {
        when(runner.run(anyString())).thenReturn(OK);
        manager.addCommand("undo-a");
        manager.addFileRestore("/tmp/bad\0backup", "/tmp/original");
        manager.addCommand("undo-c");

        RollbackOutcome outcome = manager.rollback(false);

        InOrder order = inOrder(runner);
        order.verify(runner).run("undo-c");
        order.verify(runner).run("undo-a");
        assertFalse(outcome.success());
        assertEquals(3, outcome.attempted());
        assertEquals(1, outcome.failures().size());
        assertEquals(RollbackActionType.FILE_RESTORE, manager.getActions().get(0).actionType());
        assertEquals(1, manager.getActions().size());
    }

    @Test
    void rollback_shouldRejectNonStringPackageEntries() throws Exception {
        when(runner.run(anyString())).thenReturn(OK);
        manager.addCommand("undo-a");
        manager.add(new RollbackAction(RollbackActionType.PACKAGE_REMOVE, "Remove packages",
                Map.of("packages", List.of("curl", 42)), null));

        RollbackOutcome outcome = manager.rollback(false);

        assertFalse(outcome.success());
        assertTrue(outcome.failures().get(0).reason().contains("invalid package entry"));
        verify(runner).run("undo-a");
        verify(runner, never()).run(startsWith("apt-get"));
    }

    @Test
    void rollback_shouldTreatTimeoutAsFailure() throws Exception {
        when(runner.run(anyString())).thenReturn(new CommandResult(-1, "", true));
        manager.addCommand("sleep 999");

        RollbackOutcome outcome = manager.rollback(false);

        assertFalse(outcome.success());
        assertTrue(manager.hasPendingActions());
    }

    @Test
    void rollback_shouldRestoreFileFromBackup() throws Exception {
        Path original = tempDir.resolve("etc").resolve("sshd_config");
        Path backup = tempDir.resolve("sshd_config.bak");
        Files.createDirectories(original.getParent());
        Files.writeString(original, "PermitRootLogin no");
        Files.writeString(backup, "PermitRootLogin yes");
        manager.addFileRestore(backup.toString(), original.toString());

        RollbackOutcome outcome = manager.rollback(false);

        assertTrue(outcome.success());
        assertEquals("PermitRootLogin yes", Files.readString(original));
        verifyNoInteractions(runner);
    }

    @Test
    void rollback_shouldFailFileRestoreWithoutBackup() {
        manager.addFileRestore(tempDir.resolve("missing.bak").toString(), tempDir.resolve("target").toString());

        RollbackOutcome outcome = manager.rollback(false);

        assertFalse(outcome.success());
        assertTrue(outcome.failures().get(0).reason().startsWith("Backup not found"));
        assertEquals(1, manager.getActions().size());
    }

    @Test
    void rollback_dryRunShouldNotExecuteOrClear() {
        manager.addCommand("undo-a");
        manager.addServiceStop("docker");

        RollbackOutcome outcome = manager.rollback(true);

        assertTrue(outcome.success());
        assertEquals(2, outcome.attempted());
        assertEquals(2, manager.getActions().size());
        assertTrue(Files.exists(stateFile));
        verifyNoInteractions(runner);
    }

    @Test
    void rollback_shouldSucceedWithNothingPending() {
        RollbackOutcome outcome = manager.rollback(false);

        assertTrue(outcome.success());
        assertEquals(0, outcome.attempted());
    }

    @Test
    void addCommand_shouldRewriteStateFileInFull() throws Exception {
        manager.addCommand("rm -f /etc/apt/sources.list.d/docker.list", "Remove docker repository");
        manager.addPackageRemove(List.of("git"));

        JsonNode state = new ObjectMapper().readTree(stateFile.toFile());

        assertEquals(2, state.get("actions").size());
        JsonNode first = state.get("actions").get(0);
        assertEquals("command", first.get("action_type").asText());
        assertEquals("Remove docker repository", first.get("description").asText());
        assertEquals("rm -f /etc/apt/sources.list.d/docker.list", first.get("data").get("command").asText());
        assertTrue(first.get("timestamp").isTextual());
        assertEquals("git", state.get("actions").get(1).get("data").get("packages").get(0).asText());
        assertTrue(state.hasNonNull("saved_at"));
    }

    @Test
    void add_shouldFillDefaultDescriptions() {
        manager.addCommand("ufw disable");
        manager.addFileRestore("/b", "/etc/hosts");
        manager.addPackageRemove(List.of("a", "b"));
        manager.addServiceStop("caddy");

        assertEquals(List.of("Run: ufw disable", "Restore: /etc/hosts", "Remove packages: a, b",
                "Stop service: caddy"),
                manager.getActions().stream().map(RollbackAction::description).toList());
    }

    @Test
    void loadState_shouldReturnFalseWithoutFile() {
        assertFalse(manager.loadState());
    }

    @Test
    void loadState_shouldReturnFalseForCorruptFile() throws Exception {
        Files.createDirectories(stateFile.getParent());
        Files.writeString(stateFile, "{ not json");

        assertFalse(manager.loadState());
        assertFalse(manager.hasPendingActions());
    }

    @Test
    void loadState_shouldRehydrateActionsAfterCrash() {
        manager.addCommand("undo-a");
        manager.addFileRestore("/backup", "/etc/hosts", "Restore hosts");

        RollbackManager afterCrash = new RollbackManager(stateFile, runner);

        assertTrue(afterCrash.loadState());
        assertEquals(manager.getActions(), afterCrash.getActions());
        assertEquals(RollbackActionType.FILE_RESTORE, afterCrash.getActions().get(1).actionType());
    }

    @Test
    void getSummary_shouldCountByTypeInFirstSeenOrder() {
        manager.addCommand("a");
        manager.addFileRestore("/b", "/o");
        manager.addCommand("c");

        assertEquals("Rollback actions: 2 command, 1 file_restore", manager.getSummary());
    }
}
