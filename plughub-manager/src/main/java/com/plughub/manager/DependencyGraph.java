package com.plughub.manager;

import com.plughub.repository.PluginRecord;
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
import java.util.Set;

/**
 * Dependency edges between a set of plugins; edge A → B means "A depends on B".
 * Built on demand from enabled records; only dependencies inside the set count.
 */
public final class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    /** id → dependencies inside the set, in record order of ids */
    private final Map<String, List<String>> edges;

    private DependencyGraph(Map<String, List<String>> edges) {
        this.edges = edges;
    }

    public static DependencyGraph of(Collection<PluginRecord> records) {
        Map<String, List<String>> declared = new LinkedHashMap<>();
        for (PluginRecord r : records) {
            declared.put(r.getId(), r.getDependencies());
        }
        Map<String, List<String>> edges = new LinkedHashMap<>();
        declared.forEach((id, deps) -> {
            List<String> inside = new ArrayList<>();
            for (String dep : deps) {
                if (declared.containsKey(dep) && !dep.equals(id) && !inside.contains(dep)) {
                    inside.add(dep);
                }
            }
            edges.put(id, List.copyOf(inside));
        });
        return new DependencyGraph(edges);
    }

    public Set<String> ids() {
        return edges.keySet();
    }

    /** Dependencies of {@code id} inside the set. */
    public List<String> dependenciesOf(String id) {
        return edges.getOrDefault(id, List.of());
    }

    /** Plugins in the set that declare {@code id} as a dependency, in record order. */
    public List<String> dependentsOf(String id) {
        List<String> out = new ArrayList<>();
        edges.forEach((other, deps) -> {
            if (deps.contains(id)) out.add(other);
        });
        return out;
    }

    /**
     * Kahn's algorithm: dependencies before dependents, ties in record order. Ids left on a cycle
     * are appended in record order and a warning is logged.
     */
    public List<String> loadOrder() {
        List<String> order = sortAcyclic();
        if (order.size() < edges.size()) {
            Set<String> cyclic = remainder(order);
            log.warn("Dependency cycle among plugins {}; loading them in registration order", cyclic);
            order.addAll(cyclic);
        }
        return order;
    }

    /** Ids that sit on, or depend on, a cycle. Empty when the graph is acyclic. */
    public Set<String> cyclicIds() {
        return remainder(sortAcyclic());
    }

    private List<String> sortAcyclic() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        edges.forEach((id, deps) -> inDegree.put(id, deps.size()));

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) ready.add(id);
        });

        List<String> order = new ArrayList<>(edges.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String dependent : dependentsOf(id)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) ready.add(dependent);
            }
        }
        return order;
    }

    private Set<String> remainder(List<String> sorted) {
        Set<String> rest = new LinkedHashSet<>(edges.keySet());
        sorted.forEach(rest::remove);
        return rest;
    }
}
