package ai.depgraph.graph;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Transposes forward edges (package -> dependencies) into reverse edges (package -> dependents).
 */
public final class ReverseGraph {

    private ReverseGraph() {
    }

    /**
     * Names nobody depends on are absent from the result rather than mapped to an empty set.
     */
    public static Map<String, Set<String>> reverse(Map<String, Set<String>> forwardEdges) {
        Objects.requireNonNull(forwardEdges, "forwardEdges");
        final Map<String, Set<String>> reverse = new LinkedHashMap<>();
        for (var e : forwardEdges.entrySet()) {
            for (String target : e.getValue()) {
                reverse.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(e.getKey());
            }
        }
        return reverse;
    }
}
