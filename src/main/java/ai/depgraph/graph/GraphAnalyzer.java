package ai.depgraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import ai.depgraph.model.DependencyGraph;

/**
 * Ordering and impact queries over a built {@link DependencyGraph}.
 * Traversals use explicit stacks, so workspace depth is not bounded by the call stack.
 */
public final class GraphAnalyzer {

    private enum Mark {
        IN_PROGRESS,
        DONE
    }

    private final Logger log;

    public GraphAnalyzer() {
        this(NOPLogger.NOP_LOGGER);
    }

    public GraphAnalyzer(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Build order: every node exactly once, each after all of its local dependencies.
     * Roots are taken in node-map order, dependencies in edge order.
     *
     * @throws CycleException if a node is reached again while still in progress
     */
    public List<String> sort(DependencyGraph graph) {
        Objects.requireNonNull(graph, "graph");
        final Map<String, Mark> marks = new HashMap<>();
        final List<String> result = new ArrayList<>(graph.size());
        final Deque<Frame> stack = new ArrayDeque<>();

        for (String root : graph.nodes().keySet()) {
            if (marks.containsKey(root)) {
                continue;
            }
            marks.put(root, Mark.IN_PROGRESS);
            stack.push(new Frame(root, graph.dependenciesOf(root).iterator()));

            while (!stack.isEmpty()) {
                final Frame top = stack.peek();
                if (!top.pending.hasNext()) {
                    stack.pop();
                    marks.put(top.name, Mark.DONE);
                    result.add(top.name);
                    continue;
                }
                final String dep = top.pending.next();
                if (!graph.contains(dep)) {
                    // dangling edge, reported by GraphValidator
                    continue;
                }
                final Mark mark = marks.get(dep);
                if (mark == Mark.DONE) {
                    continue;
                }
                if (mark == Mark.IN_PROGRESS) {
                    throw new CycleException(dep);
                }
                marks.put(dep, Mark.IN_PROGRESS);
                stack.push(new Frame(dep, graph.dependenciesOf(dep).iterator()));
            }
        }

        log.debug("Topological sort completed. Build order determined for {} packages.", result.size());
        return result;
    }

    /**
     * Every package depending on {@code name} directly or transitively.
     * Unknown names and packages without dependents yield an empty set.
     */
    public Set<String> dependentsOf(String name, DependencyGraph graph) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(graph, "graph");
        final Set<String> visited = new HashSet<>();
        final Set<String> dependents = new LinkedHashSet<>();
        final Deque<String> queue = new ArrayDeque<>();
        visited.add(name);
        queue.add(name);

        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (String dependent : graph.directDependents(current)) {
                if (visited.add(dependent)) {
                    dependents.add(dependent);
                    queue.add(dependent);
                }
            }
        }
        return Collections.unmodifiableSet(dependents);
    }

    private static final class Frame {
        final String name;
        final Iterator<String> pending;

        private Frame(String name, Iterator<String> pending) {
            this.name = name;
            this.pending = pending;
        }
    }
}
