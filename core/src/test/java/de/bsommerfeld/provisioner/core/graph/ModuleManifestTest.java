package de.bsommerfeld.provisioner.core.graph;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModuleManifestTest {

    @Test
    void defaults_shouldBeValid() {
        assertDoesNotThrow(() -> ModuleManifest.defaults().validate());
    }

    @Test
    void defaults_shouldContainFullStack() {
        ModuleManifest manifest = ModuleManifest.defaults();

        assertEquals(21, manifest.modules().size());
        assertEquals(List.of("system", "docker"), manifest.dependenciesOf("devops"));
        assertEquals(List.of(), manifest.dependenciesOf("system"));
    }

    @Test
    void defaults_shouldScheduleSystemFirst() throws Exception {
        ModuleManifest manifest = ModuleManifest.defaults();
        DependencyGraph graph = new DependencyGraph();
        for (String module : manifest.modules()) {
            graph.addModule(module, manifest.dependenciesOf(module));
        }

        List<Set<String>> batches = graph.getParallelBatches();

        assertEquals(Set.of("system"), batches.get(0));
        assertEquals(Set.of("devops"), batches.get(batches.size() - 1));
    }

    @Test
    void validate_shouldRejectUnknownDependency() {
        Map<String, List<String>> deps = new LinkedHashMap<>();
        deps.put("docker", List.of("system"));

        DependencyGraphException e = assertThrows(DependencyGraphException.class,
                () -> new ModuleManifest(deps).validate());
        assertEquals(List.of("docker", "system"), e.getModules());
    }

    @Test
    void validate_shouldRejectCycle() {
        Map<String, List<String>> deps = new LinkedHashMap<>();
        deps.put("a", List.of("b"));
        deps.put("b", List.of("a"));

        DependencyGraphException e = assertThrows(DependencyGraphException.class,
                () -> new ModuleManifest(deps).validate());
        assertEquals(Set.of("a", "b"), Set.copyOf(e.getModules()));
    }

    @Test
    void dependenciesOf_shouldReturnEmptyForUnknownModule() {
        assertTrue(ModuleManifest.defaults().dependenciesOf("emacs").isEmpty());
        assertFalse(ModuleManifest.defaults().contains("emacs"));
    }
}
