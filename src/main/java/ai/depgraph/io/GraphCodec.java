package ai.depgraph.io;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.depgraph.model.DependencyGraph;
import ai.depgraph.model.PackageNode;
import ai.depgraph.model.SerializedGraph;

/**
 * Converts between {@link DependencyGraph} and its flat {@link SerializedGraph} form.
 * <p>
 * Dev dependencies and local dependencies are not persisted; a restored graph carries
 * empty sets for both. Forward edges are restored as stored and reverse edges re-derived.
 */
public final class GraphCodec {

    private GraphCodec() {
    }

    public static SerializedGraph serialize(DependencyGraph graph) {
        Objects.requireNonNull(graph, "graph");
        final List<SerializedGraph.NodeRecord> packages = new ArrayList<>(graph.size());
        for (PackageNode node : graph.nodes().values()) {
            packages.add(new SerializedGraph.NodeRecord(
                    node.name(),
                    node.version(),
                    node.location().toString(),
                    new ArrayList<>(node.declaredDependencies())));
        }

        final List<SerializedGraph.EdgePair> edges = new ArrayList<>(graph.forwardEdges().size());
        for (var e : graph.forwardEdges().entrySet()) {
            edges.add(new SerializedGraph.EdgePair(e.getKey(), new ArrayList<>(e.getValue())));
        }
        return new SerializedGraph(packages, edges);
    }

    public static DependencyGraph deserialize(SerializedGraph data) {
        Objects.requireNonNull(data, "data");
        final Map<String, PackageNode> nodes = new LinkedHashMap<>();
        for (SerializedGraph.NodeRecord r : data.packages()) {
            nodes.put(r.name(), new PackageNode(
                    r.name(),
                    r.version(),
                    Path.of(r.location()),
                    new LinkedHashSet<>(r.dependencies()),
                    Set.of(),
                    Set.of()));
        }

        final Map<String, Set<String>> forward = new LinkedHashMap<>();
        for (SerializedGraph.EdgePair pair : data.edges()) {
            forward.put(pair.name(), new LinkedHashSet<>(pair.dependencies()));
        }

        return new DependencyGraph(nodes, forward);
    }
}
