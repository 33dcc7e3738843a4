package de.bsommerfeld.provisioner.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static source of truth for module execution order: module name to the
 * names it depends on.
 *
 * <p>
 * The manifest is validated once, before any {@link DependencyGraph} is
 * built from it. Modules that do not declare their own dependencies inherit
 * the manifest's entry.
 */
public final class ModuleManifest {

    private final Map<String, List<String>> dependencies;

    public ModuleManifest(Map<String, List<String>> dependencies) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        dependencies.forEach((name, deps) -> copy.put(name, List.copyOf(deps)));
        this.dependencies = Collections.unmodifiableMap(copy);
    }

    /**
     * The full provisioning stack, grouped by phase: system base, security,
     * user management and desktop, languages, tools, editors, networking and
     * monitoring.
     */
    public static ModuleManifest defaults() {
        Map<String, List<String>> deps = new LinkedHashMap<>();
        deps.put("system", List.of());
        deps.put("security", List.of("system"));
        deps.put("rbac", List.of("system", "security"));
        deps.put("desktop", List.of("system", "security"));

        deps.put("python", List.of("system"));
        deps.put("nodejs", List.of("system"));
        deps.put("golang", List.of("system"));
        deps.put("rust", List.of("system"));
        deps.put("java", List.of("system"));
        deps.put("php", List.of("system"));

        // docker needs the firewall rules from security
        deps.put("docker", List.of("system", "security"));
        deps.put("git", List.of("system"));
        deps.put("databases", List.of("system"));
        deps.put("devops", List.of("system", "docker"));
        deps.put("utilities", List.of("system"));

        deps.put("vscode", List.of("system"));
        deps.put("cursor", List.of("system"));
        deps.put("neovim", List.of("system"));

        deps.put("wireguard", List.of("system", "security"));
        deps.put("caddy", List.of("system", "security"));

        deps.put("netdata", List.of("system"));
        return new ModuleManifest(deps);
    }

    /**
     * Checks that every referenced dependency is itself a manifest entry and
     * that the mapping is acyclic.
     *
     * @throws DependencyGraphException on the first violation found
     */
    public void validate() throws DependencyGraphException {
        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            for (String dependency : entry.getValue()) {
                if (!dependencies.containsKey(dependency)) {
                    throw DependencyGraphException.missingDependency(entry.getKey(), dependency);
                }
            }
        }

        Map<String, Integer> state = new HashMap<>();
        for (String module : dependencies.keySet()) {
            List<String> path = new ArrayList<>();
            if (hasCycle(module, state, path)) {
                throw DependencyGraphException.cycle(path);
            }
        }
    }

    private boolean hasCycle(String module, Map<String, Integer> state, List<String> path) {
        int current = state.getOrDefault(module, 0);
        if (current == 2) {
            return false;
        }
        if (current == 1) {
            path.subList(0, path.indexOf(module)).clear();
            return true;
        }
        state.put(module, 1);
        path.add(module);
        for (String dependency : dependencies.getOrDefault(module, List.of())) {
            if (hasCycle(dependency, state, path)) {
                return true;
            }
        }
        path.remove(path.size() - 1);
        state.put(module, 2);
        return false;
    }

    /**
     * Dependencies declared for {@code module}, empty if the manifest does not
     * know it.
     */
    public List<String> dependenciesOf(String module) {
        return dependencies.getOrDefault(module, List.of());
    }

    public boolean contains(String module) {
        return dependencies.containsKey(module);
    }

    public Set<String> modules() {
        return dependencies.keySet();
    }
}
