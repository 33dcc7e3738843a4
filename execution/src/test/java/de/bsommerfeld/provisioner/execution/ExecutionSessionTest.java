package de.bsommerfeld.provisioner.execution;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionSessionTest {

    @Test
    void getExecutionStats_shouldReportDurationOfFinishedModules() {
        ExecutionSession session = new ExecutionSession();
        Instant start = Instant.parse("2024-01-01T10:00:00Z");
        Instant end = Instant.parse("2024-01-01T10:00:02.500Z");

        session.markStarted("docker", start);
        session.markStarted("python", start);
        session.recordResult(ExecutionResult.succeeded("docker", start, end));

        ExecutionSession.ModuleTiming docker = session.getExecutionStats().get("docker");
        assertEquals(start, docker.start());
        assertEquals(end, docker.end());
        assertEquals(2.5, docker.durationSeconds(), 1e-9);

        ExecutionSession.ModuleTiming python = session.getExecutionStats().get("python");
        assertNull(python.end());
        assertNull(python.durationSeconds());
    }

    @Test
    void recordResult_shouldNotCreateTimingForCancelledModules() {
        ExecutionSession session = new ExecutionSession();
        session.recordResult(ExecutionResult.cancelled("git"));

        assertTrue(session.getResult("git").orElseThrow().isCancelled());
        assertTrue(session.getExecutionStats().isEmpty());
    }

    @Test
    void cancel_shouldBeSticky() {
        ExecutionSession session = new ExecutionSession();
        assertFalse(session.isCancelled());
        session.cancel();
        session.cancel();
        assertTrue(session.isCancelled());
    }

    @Test
    void moduleEvent_shouldUseWireNames() {
        assertEquals("pre_configure", ModuleEvent.PRE_CONFIGURE.wireName());
        assertTrue(ModuleEvent.FAILED.isTerminal());
        assertEquals("verifying", ModuleEvent.VERIFYING.toString());
    }
}
