package de.bsommerfeld.provisioner.core.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of module dependencies, scheduled with Kahn's algorithm.
 *
 * <p>
 * Edges point from a dependency to its dependent ({@code system → docker}).
 * Nodes keep their discovery order, which makes the produced batches
 * deterministic for a given registration order.
 *
 * <h3>Batching</h3>
 * {@link #getParallelBatches()} repeatedly takes the frontier (every node
 * whose dependencies are all scheduled). Force-sequential frontier nodes
 * each get a batch of their own, the remaining frontier nodes share one
 * batch. A module therefore never precedes its dependencies and a
 * force-sequential module never shares a batch.
 *
 * <p>
 * Not thread-safe. The graph is built and scheduled once, before execution
 * starts.
 */
public class DependencyGraph {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyGraph.class);

    private final Map<String, Set<String>> successors = new LinkedHashMap<>();
    private final Map<String, ModuleNode> modules = new LinkedHashMap<>();

    private record ModuleNode(String name, List<String> dependsOn, boolean forceSequential) {
    }

    /**
     * Adds a module. Dependencies that are not (yet) modules are inserted as
     * bare nodes so the edge can be recorded; {@link #validate()} reports them
     * if they are still unregistered when the graph is validated. Adding a
     * name again replaces its dependencies.
     */
    public void addModule(String name, Iterable<String> dependsOn, boolean forceSequential) {
        ModuleNode previous = modules.remove(name);
        if (previous != null) {
            dropIncomingEdges(previous);
        }
        successors.computeIfAbsent(name, k -> new LinkedHashSet<>());

        List<String> deps = new ArrayList<>();
        if (dependsOn != null) {
            for (String dependency : dependsOn) {
                deps.add(dependency);
                successors.computeIfAbsent(dependency, k -> new LinkedHashSet<>()).add(name);
            }
        }
        modules.put(name, new ModuleNode(name, List.copyOf(deps), forceSequential));
    }

    private void dropIncomingEdges(ModuleNode node) {
        for (String dependency : node.dependsOn()) {
            Set<String> edges = successors.get(dependency);
            if (edges == null) {
                continue;
            }
            edges.remove(node.name());
            // a placeholder nobody references any more
            if (edges.isEmpty() && !modules.containsKey(dependency)) {
                successors.remove(dependency);
            }
        }
    }

    public void addModule(String name, Iterable<String> dependsOn) {
        addModule(name, dependsOn, false);
    }

    /**
     * Checks the graph for cycles and dangling dependencies. A graph that
     * falls apart into several unconnected components is legal but logged.
     *
     * @throws DependencyGraphException on a cycle or a missing dependency
     */
    public void validate() throws DependencyGraphException {
        List<String> cycle = findCycle();
        if (!cycle.isEmpty()) {
            throw DependencyGraphException.cycle(cycle);
        }

        for (ModuleNode node : modules.values()) {
            for (String dependency : node.dependsOn()) {
                if (!modules.containsKey(dependency)) {
                    throw DependencyGraphException.missingDependency(node.name(), dependency);
                }
            }
        }

        if (!isWeaklyConnected()) {
            LOG.warn("Dependency graph is disconnected; independent module groups will be scheduled side by side");
        }
    }

    /**
     * Groups all nodes into batches that can run concurrently.
     *
     * @return batches in execution order; batch {@code i} must fully complete
     *         before batch {@code i + 1} starts
     * @throws DependencyGraphException if the remaining nodes form a cycle;
     *                                  no partial result is returned
     */
    public List<Set<String>> getParallelBatches() throws DependencyGraphException {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String node : successors.keySet()) {
            inDegree.put(node, 0);
        }
        for (Set<String> targets : successors.values()) {
            for (String successor : targets) {
                inDegree.merge(successor, 1, Integer::sum);
            }
        }

        List<Set<String>> batches = new ArrayList<>();
        while (!inDegree.isEmpty()) {
            List<String> frontier = new ArrayList<>();
            for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
                if (entry.getValue() == 0) {
                    frontier.add(entry.getKey());
                }
            }

            if (frontier.isEmpty()) {
                throw DependencyGraphException.cycle(new ArrayList<>(inDegree.keySet()));
            }

            Set<String> parallel = new LinkedHashSet<>();
            for (String node : frontier) {
                if (isForceSequential(node)) {
                    batches.add(Collections.singleton(node));
                    removeNode(node, inDegree);
                } else {
                    parallel.add(node);
                }
            }
            if (!parallel.isEmpty()) {
                batches.add(Collections.unmodifiableSet(parallel));
                for (String node : parallel) {
                    removeNode(node, inDegree);
                }
            }
        }

        LOG.debug("Scheduled {} module(s) into {} batch(es): {}", size(), batches.size(), batches);
        return batches;
    }

    private void removeNode(String node, Map<String, Integer> inDegree) {
        inDegree.remove(node);
        for (String successor : successors.get(node)) {
            inDegree.computeIfPresent(successor, (k, degree) -> degree - 1);
        }
    }

    private boolean isForceSequential(String node) {
        ModuleNode info = modules.get(node);
        return info != null && info.forceSequential();
    }

    /**
     * Depth-first search with white/grey/black colouring.
     *
     * @return the nodes of one cycle in edge order, or an empty list
     */
    private List<String> findCycle() {
        Map<String, Integer> colour = new HashMap<>();
        for (String start : successors.keySet()) {
            if (colour.getOrDefault(start, 0) != 0) {
                continue;
            }
            Deque<String> path = new ArrayDeque<>();
            List<String> cycle = visit(start, colour, path);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        return List.of();
    }

    private List<String> visit(String node, Map<String, Integer> colour, Deque<String> path) {
        colour.put(node, 1);
        path.addLast(node);
        for (String next : successors.get(node)) {
            int state = colour.getOrDefault(next, 0);
            if (state == 1) {
                List<String> onPath = new ArrayList<>(path);
                return List.copyOf(onPath.subList(onPath.indexOf(next), onPath.size()));
            }
            if (state == 0) {
                List<String> cycle = visit(next, colour, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        path.removeLast();
        colour.put(node, 2);
        return List.of();
    }

    private boolean isWeaklyConnected() {
        if (successors.isEmpty()) {
            return true;
        }
        Map<String, Set<String>> undirected = new HashMap<>();
        for (Map.Entry<String, Set<String>> entry : successors.entrySet()) {
            undirected.computeIfAbsent(entry.getKey(), k -> new HashSet<>());
            for (String successor : entry.getValue()) {
                undirected.get(entry.getKey()).add(successor);
                undirected.computeIfAbsent(successor, k -> new HashSet<>()).add(entry.getKey());
            }
        }

        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        String first = successors.keySet().iterator().next();
        queue.add(first);
        seen.add(first);
        while (!queue.isEmpty()) {
            for (String neighbour : undirected.get(queue.poll())) {
                if (seen.add(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
        return seen.size() == successors.size();
    }

    /** All node names in discovery order, including auto-inserted ones. */
    public Set<String> getModules() {
        return Collections.unmodifiableSet(successors.keySet());
    }

    /**
     * Declared dependencies of a registered module, empty for unknown or
     * auto-inserted nodes.
     */
    public List<String> getDependencies(String name) {
        ModuleNode node = modules.get(name);
        return node == null ? List.of() : node.dependsOn();
    }

    public boolean contains(String name) {
        return successors.containsKey(name);
    }

    public int size() {
        return successors.size();
    }
}
