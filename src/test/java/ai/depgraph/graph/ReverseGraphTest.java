package ai.depgraph.graph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import ai.depgraph.TestGraphs;
import ai.depgraph.model.DependencyGraph;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReverseGraph}.
 */
@Tag("unit")
class ReverseGraphTest {

    @Test
    void reversesEveryEdge() {
        final Map<String, Set<String>> forward = new LinkedHashMap<>();
        forward.put("a", Set.of());
        forward.put("b", Set.of("a"));
        forward.put("c", Set.of("a", "b"));

        final Map<String, Set<String>> reverse = ReverseGraph.reverse(forward);

        assertThat(reverse).containsOnlyKeys("a", "b");
        assertThat(reverse.get("a")).containsExactlyInAnyOrder("b", "c");
        assertThat(reverse.get("b")).containsExactly("c");
    }

    @Test
    void omitsNamesWithoutDependents() {
        final Map<String, Set<String>> reverse = ReverseGraph.reverse(Map.of("solo", Set.of()));

        assertThat(reverse).isEmpty();
    }

    @Test
    void keepsTargetsThatAreNotSources() {
        final Map<String, Set<String>> reverse = ReverseGraph.reverse(Map.of("a", Set.of("external")));

        assertThat(reverse).containsEntry("external", Set.of("a"));
    }

    @Test
    void graphReverseEdgesAreTransposeOfForwardEdges() {
        final DependencyGraph graph = TestGraphs.complex();

        assertThat(ReverseGraph.reverse(graph.forwardEdges())).isEqualTo(graph.reverseEdges());
    }
}
