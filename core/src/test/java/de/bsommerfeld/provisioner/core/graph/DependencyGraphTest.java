package de.bsommerfeld.provisioner.core.graph;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private static DependencyGraph stack() {
        DependencyGraph graph = new DependencyGraph();
        graph.addModule("sys", List.of());
        graph.addModule("sec", List.of("sys"));
        graph.addModule("a", List.of("sys"));
        graph.addModule("b", List.of("sys"));
        graph.addModule("app", List.of("a", "b"));
        return graph;
    }

    @Test
    void getParallelBatches_shouldGroupIndependentModules() throws Exception {
        List<Set<String>> batches = stack().getParallelBatches();

        assertEquals(List.of(Set.of("sys"), Set.of("sec", "a", "b"), Set.of("app")), batches);
    }

    @Test
    void getParallelBatches_shouldKeepDiscoveryOrderInsideBatch() throws Exception {
        List<Set<String>> batches = stack().getParallelBatches();

        assertEquals(List.of("sec", "a", "b"), List.copyOf(batches.get(1)));
    }

    @Test
    void getParallelBatches_shouldNeverScheduleModuleBeforeItsDependencies() throws Exception {
        DependencyGraph graph = new DependencyGraph();
        graph.addModule("devops", List.of("system", "docker"));
        graph.addModule("docker", List.of("system", "security"));
        graph.addModule("security", List.of("system"));
        graph.addModule("system", List.of());
        graph.addModule("python", List.of("system"));

        List<Set<String>> batches = graph.getParallelBatches();

        Map<String, Integer> batchOf = new HashMap<>();
        for (int i = 0; i < batches.size(); i++) {
            for (String module : batches.get(i)) {
                assertNull(batchOf.put(module, i), module + " scheduled twice");
            }
        }
        assertEquals(graph.getModules(), batchOf.keySet());
        for (String module : graph.getModules()) {
            for (String dependency : graph.getDependencies(module)) {
                assertTrue(batchOf.get(dependency) < batchOf.get(module),
                        dependency + " must run before " + module);
            }
        }
    }

    @Test
    void getParallelBatches_shouldIsolateForceSequentialModules() throws Exception {
        DependencyGraph graph = new DependencyGraph();
        graph.addModule("system", List.of());
        graph.addModule("desktop", List.of("system"), true);
        graph.addModule("python", List.of("system"));
        graph.addModule("rbac", List.of("system"), true);
        graph.addModule("git", List.of("system"));

        List<Set<String>> batches = graph.getParallelBatches();

        assertEquals(List.of(Set.of("system"), Set.of("desktop"), Set.of("rbac"), Set.of("python", "git")),
                batches);
    }

    @Test
    void getParallelBatches_shouldFailOnCycleWithoutPartialResult() {
        DependencyGraph graph = new DependencyGraph();
        graph.addModule("base", List.of());
        graph.addModule("x", List.of("base", "y"));
        graph.addModule("y", List.of("x"));

        DependencyGraphException e = assertThrows(DependencyGraphException.class, graph::getParallelBatches);
        assertEquals(Set.of("x", "y"), Set.copyOf(e.getModules()));
    }

    @Test
    void getParallelBatches_shouldReturnEmptyListForEmptyGraph() throws Exception {
        assertTrue(new DependencyGraph().getParallelBatches().isEmpty());
    }

    @Test
    void validate_shouldNameTheCycle() {
        DependencyGraph graph = new DependencyGraph();
        graph.addModule("a", List.of("c"));
        graph.addModule("b", List.of("a"));
        graph.addModule("c", List.of("b"));

        DependencyGraphException e = assertThrows(DependencyGraphException.class, graph::validate);
        assertEquals(Set.of("a", "b", "c"), Set.copyOf(e.getModules()));
        assertTrue(e.getMessage().contains("Circular dependency"));
    }

    @Test
    void validate_shouldRejectUnregisteredDependency() {
        DependencyGraph graph = new DependencyGraph();
        graph.addModule("docker", List.of("system"));

        DependencyGraphException e = assertThrows(DependencyGraphException.class, graph::validate);
        assertEquals(List.of("docker", "system"), e.getModules());
    }

    @Test
    void validate_shouldAcceptDisconnectedGraph() {
        DependencyGraph graph = new DependencyGraph();
        graph.addModule("a", List.of());
        graph.addModule("b", List.of());

        assertDoesNotThrow(graph::validate);
    }

    @Test
    void addModule_shouldAutoInsertUndeclaredDependency() {
        DependencyGraph graph = new DependencyGraph();
        graph.addModule("docker", List.of("system"));

        assertTrue(graph.contains("system"));
        assertEquals(2, graph.size());
        assertEquals(List.of("system"), graph.getDependencies("docker"));
        assertEquals(List.of(), graph.getDependencies("system"));
    }

    @Test
    void addModule_shouldReplaceDependenciesWhenAddedAgain() throws Exception {
        DependencyGraph graph = new DependencyGraph();
        graph.addModule("sys", List.of());
        graph.addModule("a", List.of("sys", "ghost"));
        graph.addModule("app", List.of("a"));
        graph.addModule("a", List.of());

        graph.validate();

        assertEquals(List.of(Set.of("sys", "a"), Set.of("app")), graph.getParallelBatches());
        assertEquals(List.of(), graph.getDependencies("a"));
        assertFalse(graph.getModules().contains("ghost"));
    }
}
