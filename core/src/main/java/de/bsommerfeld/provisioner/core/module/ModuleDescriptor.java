package de.bsommerfeld.provisioner.core.module;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registration record of a module for one run.
 *
 * @param name      unique module name (e.g. {@code docker})
 * @param dependsOn names of modules that must complete first; iteration
 *                  order is the declaration order
 * @param hints     scheduling hints read by the engine
 * @param lifecycle the module's stage table
 */
public record ModuleDescriptor(
        String name,
        Set<String> dependsOn,
        SchedulingHints hints,
        ModuleLifecycle lifecycle) {

    public ModuleDescriptor {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Module name must not be blank");
        }
        dependsOn = dependsOn == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
        hints = hints == null ? SchedulingHints.DEFAULT : hints;
        lifecycle = lifecycle == null ? ModuleLifecycle.empty() : lifecycle;
    }

    public ModuleDescriptor(String name, Set<String> dependsOn, ModuleLifecycle lifecycle) {
        this(name, dependsOn, SchedulingHints.DEFAULT, lifecycle);
    }

    public boolean forceSequential() {
        return hints.forceSequential();
    }

    /**
     * Returns a copy with the given dependencies. Used when a module declares
     * none and the manifest supplies them.
     */
    public ModuleDescriptor withDependencies(Set<String> dependencies) {
        return new ModuleDescriptor(name, dependencies, hints, lifecycle);
    }
}
