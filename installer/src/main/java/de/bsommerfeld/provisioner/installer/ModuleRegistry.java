package de.bsommerfeld.provisioner.installer;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.provisioner.core.graph.ModuleManifest;
import de.bsommerfeld.provisioner.core.module.ModuleDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Modules available to the installer, keyed by name in registration order.
 * A module registered without dependencies takes them from the
 * {@link ModuleManifest}.
 */
@Singleton
public class ModuleRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleRegistry.class);

    private final ModuleManifest manifest;
    private final Map<String, ModuleDescriptor> modules = new LinkedHashMap<>();

    @Inject
    public ModuleRegistry(ModuleManifest manifest) {
        this.manifest = manifest;
    }

    /**
     * @throws IllegalArgumentException if a module with the same name is
     *                                  already registered
     */
    public synchronized ModuleDescriptor register(ModuleDescriptor descriptor) {
        if (modules.containsKey(descriptor.name())) {
            throw new IllegalArgumentException("Module already registered: " + descriptor.name());
        }
        ModuleDescriptor effective = descriptor;
        if (descriptor.dependsOn().isEmpty() && !manifest.dependenciesOf(descriptor.name()).isEmpty()) {
            List<String> inherited = manifest.dependenciesOf(descriptor.name());
            effective = descriptor.withDependencies(new LinkedHashSet<>(inherited));
            LOG.debug("Module {} inherits manifest dependencies {}", descriptor.name(), effective.dependsOn());
        }
        modules.put(effective.name(), effective);
        return effective;
    }

    public synchronized Optional<ModuleDescriptor> get(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    public synchronized boolean contains(String name) {
        return modules.containsKey(name);
    }

    public synchronized List<ModuleDescriptor> all() {
        return List.copyOf(modules.values());
    }

    /**
     * The modules to install for the given selection, plus every registered
     * module they transitively depend on, in registration order. An empty
     * selection means every registered module. Names that are not
     * registered are logged and skipped; unregistered dependencies are left
     * for graph validation to report.
     */
    public synchronized List<ModuleDescriptor> resolve(Collection<String> selection) {
        if (selection == null || selection.isEmpty()) {
            return all();
        }

        Set<String> wanted = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String name : selection) {
            if (!modules.containsKey(name)) {
                LOG.warn("Enabled module '{}' is not registered, skipping", name);
                continue;
            }
            queue.add(name);
        }
        while (!queue.isEmpty()) {
            String name = queue.poll();
            ModuleDescriptor descriptor = modules.get(name);
            if (descriptor == null || !wanted.add(name)) {
                continue;
            }
            queue.addAll(descriptor.dependsOn());
        }

        List<ModuleDescriptor> resolved = new ArrayList<>();
        for (ModuleDescriptor descriptor : modules.values()) {
            if (wanted.contains(descriptor.name())) {
                resolved.add(descriptor);
            }
        }
        return resolved;
    }

    public ModuleManifest getManifest() {
        return manifest;
    }
}
