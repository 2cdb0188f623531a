package ai.depgraph.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import ai.depgraph.model.DependencyGraph;

/**
 * Structural checks on a graph. Never throws for a malformed graph; problems are returned as messages:
 * first one per forward edge whose target is not a node, then at most one cycle message.
 */
public final class GraphValidator {

    private final GraphAnalyzer analyzer;

    public GraphValidator() {
        this(new GraphAnalyzer());
    }

    public GraphValidator(GraphAnalyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    }

    public ValidationResult validate(DependencyGraph graph) {
        Objects.requireNonNull(graph, "graph");
        final List<String> errors = new ArrayList<>();

        for (var e : graph.forwardEdges().entrySet()) {
            for (String target : e.getValue()) {
                if (!graph.contains(target)) {
                    errors.add("Package " + e.getKey() + " depends on " + target + " which doesn't exist");
                }
            }
        }

        try {
            analyzer.sort(graph);
        } catch (CycleException ex) {
            errors.add(ex.getMessage());
        }

        return ValidationResult.of(errors);
    }
}
