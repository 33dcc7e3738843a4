package de.bsommerfeld.provisioner.core.graph;

import java.util.List;

/**
 * Thrown when the module graph cannot be scheduled: a dependency cycle or a
 * dependency that was referenced but never registered. Graph errors are
 * raised before any module runs and are never retried.
 */
public class DependencyGraphException extends Exception {

    private final List<String> modules;

    public DependencyGraphException(String message, List<String> modules) {
        super(message);
        this.modules = List.copyOf(modules);
    }

    static DependencyGraphException cycle(List<String> modules) {
        return new DependencyGraphException(
                "Circular dependency detected among: " + modules
                        + ". Please check module dependencies for cycles.",
                modules);
    }

    static DependencyGraphException missingDependency(String module, String dependency) {
        return new DependencyGraphException(
                "Module '" + module + "' depends on '" + dependency + "' which doesn't exist",
                List.of(module, dependency));
    }

    /**
     * Modules involved in the failure: the cycle members, the stuck set, or
     * the {@code (module, missing dependency)} pair.
     */
    public List<String> getModules() {
        return modules;
    }
}
