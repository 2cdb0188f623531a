package ai.depgraph.io;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import ai.depgraph.TestGraphs;
import ai.depgraph.graph.GraphValidator;
import ai.depgraph.graph.ValidationResult;
import ai.depgraph.model.DependencyGraph;
import ai.depgraph.model.PackageNode;
import ai.depgraph.model.SerializedGraph;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link GraphCodec}.
 */
@Tag("unit")
class GraphCodecTest {

    @Test
    void serializeEmitsOneRecordAndOneEdgePairPerPackage() {
        final SerializedGraph data = GraphCodec.serialize(TestGraphs.diamond());

        assertThat(data.packages()).extracting(SerializedGraph.NodeRecord::name)
                .containsExactly("package-a", "package-b", "package-c", "package-d");
        final SerializedGraph.NodeRecord d = data.packages().get(3);
        assertThat(d.version()).isEqualTo("1.0.0");
        assertThat(d.location()).isEqualTo(Path.of("/fake/path/package-d").toString());
        assertThat(d.dependencies()).containsExactly("package-b", "package-c");
        assertThat(data.edges()).hasSize(4);
        assertThat(data.edges().get(3).name()).isEqualTo("package-d");
        assertThat(data.edges().get(3).dependencies()).containsExactly("package-b", "package-c");
    }

    @Test
    void roundTripPreservesNodesAndEdges() {
        final DependencyGraph original = TestGraphs.complex();

        final DependencyGraph restored = GraphCodec.deserialize(GraphCodec.serialize(original));

        assertThat(restored.nodes().keySet()).containsExactlyElementsOf(original.nodes().keySet());
        for (PackageNode node : original.nodes().values()) {
            final PackageNode copy = restored.nodes().get(node.name());
            assertThat(copy.version()).isEqualTo(node.version());
            assertThat(copy.location()).isEqualTo(node.location());
            assertThat(copy.declaredDependencies()).isEqualTo(node.declaredDependencies());
        }
        assertThat(restored.forwardEdges()).isEqualTo(original.forwardEdges());
        assertThat(restored.reverseEdges()).isEqualTo(original.reverseEdges());
    }

    @Test
    void roundTripPreservesRandomAcyclicGraphs() {
        final Random random = new Random(7);
        for (int round = 0; round < 100; round++) {
            final DependencyGraph original = TestGraphs.randomAcyclic(random);

            final DependencyGraph restored = GraphCodec.deserialize(GraphCodec.serialize(original));

            assertThat(restored.nodes().keySet()).containsExactlyElementsOf(original.nodes().keySet());
            for (PackageNode node : original.nodes().values()) {
                final PackageNode copy = restored.nodes().get(node.name());
                assertThat(copy.version()).isEqualTo(node.version());
                assertThat(copy.location()).isEqualTo(node.location());
            }
            assertThat(restored.forwardEdges()).isEqualTo(original.forwardEdges());
            assertThat(restored.reverseEdges()).isEqualTo(original.reverseEdges());
        }
    }

    @Test
    void roundTripDropsDevAndLocalDependencies() {
        final Set<String> deps = Set.of("b", "jest");
        final PackageNode a = new PackageNode("a", "1.0.0", Path.of("/ws/a"), deps, Set.of("jest"), Set.of("b"));
        final PackageNode b = new PackageNode("b", "1.0.0", Path.of("/ws/b"), Set.of(), Set.of(), Set.of());
        final DependencyGraph graph = new DependencyGraph(
                Map.of("a", a, "b", b),
                Map.of("a", Set.of("b"), "b", Set.of()));

        final DependencyGraph restored = GraphCodec.deserialize(GraphCodec.serialize(graph));

        // local dependencies are not recomputed even though "b" is a restored node
        assertThat(restored.nodes().get("a").localDependencies()).isEmpty();
        assertThat(restored.nodes().get("a").declaredDevDependencies()).isEmpty();
        assertThat(restored.nodes().get("a").declaredDependencies()).containsExactlyInAnyOrder("b", "jest");
        assertThat(restored.dependenciesOf("a")).containsExactly("b");
        assertThat(restored.directDependents("b")).containsExactly("a");
    }

    @Test
    void restoresEdgesVerbatimEvenWhenTargetIsUnknown() {
        final SerializedGraph tampered = new SerializedGraph(
                List.of(new SerializedGraph.NodeRecord("a", "1.0.0", "/ws/a", List.of("zombie"))),
                List.of(new SerializedGraph.EdgePair("a", List.of("zombie"))));

        final DependencyGraph restored = GraphCodec.deserialize(tampered);
        final ValidationResult result = new GraphValidator().validate(restored);

        assertThat(restored.dependenciesOf("a")).containsExactly("zombie");
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("Package a depends on zombie which doesn't exist");
    }

    @Test
    void emptyGraphRoundTrips() {
        final DependencyGraph restored = GraphCodec.deserialize(GraphCodec.serialize(TestGraphs.empty()));

        assertThat(restored.nodes()).isEmpty();
        assertThat(restored.forwardEdges()).isEmpty();
    }
}
