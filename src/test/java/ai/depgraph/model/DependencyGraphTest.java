package ai.depgraph.model;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DependencyGraph}: reverse edges always mirror the forward edges.
 */
@Tag("unit")
class DependencyGraphTest {

    private static Map<String, PackageNode> nodes(String... names) {
        final Map<String, PackageNode> nodes = new LinkedHashMap<>();
        for (String name : names) {
            nodes.put(name, new PackageNode(name, "1.0.0", Path.of("/ws", name), Set.of(), Set.of(), Set.of()));
        }
        return nodes;
    }

    @Test
    void derivesReverseEdgesFromForwardEdges() {
        final Map<String, Set<String>> forward = new LinkedHashMap<>();
        forward.put("a", Set.of());
        forward.put("b", Set.of("a"));
        forward.put("c", Set.of("a"));

        final DependencyGraph graph = new DependencyGraph(nodes("a", "b", "c"), forward);

        assertThat(graph.directDependents("a")).containsExactly("b", "c");
        assertThat(graph.reverseEdges()).containsOnlyKeys("a");
    }

    @Test
    void rejectsReverseEdgesThatAreNotTheTranspose() {
        final Map<String, Set<String>> forward = new LinkedHashMap<>();
        forward.put("a", Set.of());
        forward.put("b", Set.of("a"));

        assertThatThrownBy(() -> new DependencyGraph(nodes("a", "b"), forward, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not the transpose");
        assertThatThrownBy(() -> new DependencyGraph(nodes("a", "b"), forward, Map.of("b", Set.of("a"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acceptsEmptyDependentSetsAndDropsThem() {
        final Map<String, Set<String>> forward = new LinkedHashMap<>();
        forward.put("a", Set.of());
        forward.put("b", Set.of("a"));

        final DependencyGraph graph = new DependencyGraph(nodes("a", "b"), forward,
                Map.of("a", Set.of("b"), "b", Set.of()));

        assertThat(graph.reverseEdges()).isEqualTo(Map.of("a", Set.of("b")));
        assertThat(graph.directDependents("b")).isEmpty();
    }

    @Test
    void edgeMapsAreUnmodifiable() {
        final DependencyGraph graph = new DependencyGraph(nodes("a", "b"), Map.of("b", Set.of("a")));

        assertThatThrownBy(() -> graph.forwardEdges().put("c", Set.of()))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> graph.directDependents("a").add("c"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
