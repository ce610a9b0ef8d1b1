package com.plughub.manager;

import com.plughub.repository.PluginRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyGraphTest {

    @Test
    void loadOrder_dependenciesFirst() {
        DependencyGraph graph = DependencyGraph.of(List.of(
                record("a", "b"), record("b", "c"), record("c")));

        assertEquals(List.of("c", "b", "a"), graph.loadOrder());
        assertTrue(graph.cyclicIds().isEmpty());
    }

    @Test
    void loadOrder_keepsRecordOrderForIndependentPlugins() {
        DependencyGraph graph = DependencyGraph.of(List.of(
                record("web", "db"), record("metrics"), record("db"), record("cli")));

        assertEquals(List.of("metrics", "db", "cli", "web"), graph.loadOrder());
    }

    @Test
    void of_ignoresDependenciesOutsideTheSetAndSelfEdges() {
        DependencyGraph graph = DependencyGraph.of(List.of(record("a", "missing", "a", "b", "b"), record("b")));

        assertEquals(List.of("b"), graph.dependenciesOf("a"));
        assertEquals(List.of("a"), graph.dependentsOf("b"));
        assertEquals(List.of("b", "a"), graph.loadOrder());
    }

    @Test
    void cycle_isAppendedAfterAcyclicPart() {
        DependencyGraph graph = DependencyGraph.of(List.of(
                record("x", "y"), record("y", "x"), record("z"), record("w", "x")));

        assertEquals(Set.of("x", "y", "w"), graph.cyclicIds());
        assertEquals(List.of("z", "x", "y", "w"), graph.loadOrder());
    }

    private static PluginRecord record(String id, String... deps) {
        return PluginRecord.builder(id).version("1.0.0").enabled(true).dependencies(List.of(deps)).build();
    }
}
