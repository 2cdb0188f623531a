package ai.depgraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.depgraph.graph.ReverseGraph;

/**
 * Immutable snapshot of a workspace dependency graph.
 * <ul>
 *   <li>{@code nodes}: package name -> node, in insertion order</li>
 *   <li>{@code forwardEdges}: package name -> names of the local packages it depends on</li>
 *   <li>{@code reverseEdges}: package name -> names of the packages depending on it
 *       (the transpose of {@code forwardEdges}; names without dependents are absent)</li>
 * </ul>
 * Reverse edges are always derived from the forward edges; a supplied reverse map that is not
 * their exact transpose is rejected.
 */
public record DependencyGraph(
        Map<String, PackageNode> nodes,
        Map<String, Set<String>> forwardEdges,
        Map<String, Set<String>> reverseEdges
) {

    public DependencyGraph {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(forwardEdges, "forwardEdges");
        Objects.requireNonNull(reverseEdges, "reverseEdges");
        final Map<String, Set<String>> derived = ReverseGraph.reverse(forwardEdges);
        if (!withoutEmpty(reverseEdges).equals(derived)) {
            throw new IllegalArgumentException("Reverse edges " + reverseEdges
                    + " are not the transpose of forward edges " + forwardEdges);
        }
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        forwardEdges = freeze(forwardEdges);
        reverseEdges = freeze(derived);
    }

    public DependencyGraph(Map<String, PackageNode> nodes, Map<String, Set<String>> forwardEdges) {
        this(nodes, forwardEdges, ReverseGraph.reverse(Objects.requireNonNull(forwardEdges, "forwardEdges")));
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    public int size() {
        return nodes.size();
    }

    /** Direct local dependencies of {@code name}; empty when unknown. */
    public Set<String> dependenciesOf(String name) {
        return forwardEdges.getOrDefault(name, Set.of());
    }

    /** Direct dependents of {@code name}; empty when unknown or nothing depends on it. */
    public Set<String> directDependents(String name) {
        return reverseEdges.getOrDefault(name, Set.of());
    }

    // absent and empty mean the same: no dependents
    private static Map<String, Set<String>> withoutEmpty(Map<String, Set<String>> edges) {
        final Map<String, Set<String>> out = new LinkedHashMap<>();
        for (var e : edges.entrySet()) {
            if (!e.getValue().isEmpty()) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> edges) {
        final Map<String, Set<String>> out = new LinkedHashMap<>();
        for (var e : edges.entrySet()) {
            out.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
        }
        return Collections.unmodifiableMap(out);
    }
}
