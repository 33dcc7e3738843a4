package de.bsommerfeld.provisioner.execution;

import de.bsommerfeld.provisioner.core.module.ModuleLifecycle;
import de.bsommerfeld.provisioner.core.module.SchedulingHints;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HybridStrategyTest {

    @Mock
    private ParallelStrategy parallel;

    @Mock
    private PipelineStrategy pipeline;

    private static ExecutionContext context(String name, SchedulingHints hints) {
        return new ExecutionContext(name, ModuleLifecycle.empty(), null, false, null, hints, null, null);
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_shouldRouteByHints() {
        ExecutionContext desktop = context("desktop", new SchedulingHints(true, false));
        ExecutionContext python = context("python", SchedulingHints.DEFAULT);
        ExecutionContext rust = context("rust", new SchedulingHints(false, true));
        ExecutionContext git = context("git", SchedulingHints.DEFAULT);
        ExecutionSession session = new ExecutionSession();

        when(pipeline.execute(anyList(), any(), any())).thenAnswer(invocation -> {
            List<ExecutionContext> batch = invocation.getArgument(0);
            return Map.of(batch.get(0).moduleName(), ExecutionResult.cancelled(batch.get(0).moduleName()));
        });
        when(parallel.execute(anyList(), any(), any())).thenReturn(Map.of());

        Map<String, ExecutionResult> results = new HybridStrategy(parallel, pipeline)
                .execute(List.of(desktop, python, rust, git), session, ProgressCallback.NONE);

        ArgumentCaptor<List<ExecutionContext>> pipelined = ArgumentCaptor.forClass(List.class);
        verify(pipeline, times(2)).execute(pipelined.capture(), eq(session), any());
        assertEquals(List.of(List.of(desktop), List.of(rust)), pipelined.getAllValues());
        verify(parallel).execute(eq(List.of(python, git)), eq(session), any());
        assertEquals(List.of("desktop", "rust"), List.copyOf(results.keySet()));
    }

    @Test
    void execute_shouldSkipParallelWhenEverythingIsSequential() {
        ExecutionContext rbac = context("rbac", new SchedulingHints(true, false));
        when(pipeline.execute(anyList(), any(), any())).thenReturn(Map.of());

        new HybridStrategy(parallel, pipeline).execute(List.of(rbac), new ExecutionSession(), ProgressCallback.NONE);

        verifyNoInteractions(parallel);
    }

    @Test
    void execute_shouldMergeResultsOfRealStrategies() {
        ExecutionContext desktop = context("desktop", new SchedulingHints(true, false));
        ExecutionContext python = context("python", SchedulingHints.DEFAULT);
        ExecutionContext git = context("git", SchedulingHints.DEFAULT);

        Map<String, ExecutionResult> results = new HybridStrategy(2)
                .execute(List.of(desktop, python, git), new ExecutionSession(), ProgressCallback.NONE);

        assertEquals(3, results.size());
        assertTrue(results.values().stream().allMatch(ExecutionResult::success));
        assertEquals("desktop", results.keySet().iterator().next());
    }

    @Test
    void canHandle_shouldAcceptAnything() {
        assertTrue(new HybridStrategy(1).canHandle(List.of()));
        assertEquals("hybrid", new HybridStrategy(1).getName());
    }
}
