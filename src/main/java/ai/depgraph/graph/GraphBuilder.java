package ai.depgraph.graph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import ai.depgraph.descriptor.DescriptorException;
import ai.depgraph.descriptor.DescriptorParser;
import ai.depgraph.model.DependencyGraph;
import ai.depgraph.model.PackageDescriptor;
import ai.depgraph.model.PackageNode;

/**
 * Builds a {@link DependencyGraph} from manifest paths in two passes:
 * 1) parse every manifest into a node (later manifests win on duplicate names)
 * 2) once all nodes are known, keep the declared dependencies that name another node
 *    as that node's local dependencies and forward edges
 * Reverse edges are derived from the forward edges.
 */
public final class GraphBuilder {

    private final DescriptorParser parser;
    private final boolean rejectDuplicateNames;
    private final Logger log;

    public GraphBuilder(DescriptorParser parser) {
        this(parser, false, NOPLogger.NOP_LOGGER);
    }

    public GraphBuilder(DescriptorParser parser, boolean rejectDuplicateNames, Logger log) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.rejectDuplicateNames = rejectDuplicateNames;
        this.log = Objects.requireNonNull(log, "log");
    }

    public DependencyGraph build(List<Path> manifestPaths) throws DescriptorException {
        Objects.requireNonNull(manifestPaths, "manifestPaths");
        final List<PackageDescriptor> descriptors = new ArrayList<>(manifestPaths.size());
        for (Path manifestPath : manifestPaths) {
            descriptors.add(parser.parse(manifestPath));
        }
        return assemble(manifestPaths, descriptors);
    }

    /**
     * Same as {@link #build(List)}, with manifests parsed on {@code executor}.
     * Nodes are still inserted in path order, so duplicate handling matches the sequential build.
     */
    public DependencyGraph build(List<Path> manifestPaths, ExecutorService executor)
            throws DescriptorException, InterruptedException {
        Objects.requireNonNull(manifestPaths, "manifestPaths");
        Objects.requireNonNull(executor, "executor");

        final List<Future<PackageDescriptor>> futures = new ArrayList<>(manifestPaths.size());
        for (Path manifestPath : manifestPaths) {
            futures.add(executor.submit(() -> parser.parse(manifestPath)));
        }

        // all parses must finish before local dependencies can be resolved
        final List<PackageDescriptor> descriptors = new ArrayList<>(futures.size());
        try {
            for (Future<PackageDescriptor> f : futures) {
                descriptors.add(f.get());
            }
        } catch (ExecutionException ex) {
            futures.forEach(f -> f.cancel(true));
            final Throwable cause = ex.getCause();
            if (cause instanceof DescriptorException) {
                throw (DescriptorException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Manifest parsing failed", cause);
        } catch (InterruptedException | CancellationException ex) {
            futures.forEach(f -> f.cancel(true));
            throw ex;
        }
        return assemble(manifestPaths, descriptors);
    }

    private DependencyGraph assemble(List<Path> manifestPaths, List<PackageDescriptor> descriptors)
            throws DuplicatePackageException {
        // Pass 1: nodes
        final Map<String, PackageNode> nodes = new LinkedHashMap<>();
        final Map<String, Path> manifestByName = new HashMap<>();
        for (int i = 0; i < descriptors.size(); i++) {
            final Path manifestPath = manifestPaths.get(i);
            final PackageNode node = PackageNode.fromDescriptor(descriptors.get(i), manifestPath);

            final Path previous = manifestByName.put(node.name(), manifestPath);
            if (previous != null) {
                if (rejectDuplicateNames) {
                    throw new DuplicatePackageException(node.name(), previous, manifestPath);
                }
                log.warn("Package {} at {} replaces the one at {}", node.name(), manifestPath, previous);
            }
            nodes.put(node.name(), node);
            log.debug("Parsed package: {} at {}", node.name(), node.location());
        }

        // Pass 2: local dependencies + forward edges
        final Map<String, Set<String>> forward = new LinkedHashMap<>();
        for (var e : nodes.entrySet()) {
            final String name = e.getKey();
            final Set<String> local = new LinkedHashSet<>();
            for (String dep : e.getValue().declaredDependencies()) {
                if (nodes.containsKey(dep)) {
                    local.add(dep);
                    log.debug("{} depends on local package: {}", name, dep);
                }
            }
            e.setValue(e.getValue().withLocalDependencies(local));
            forward.put(name, local);
        }

        return new DependencyGraph(nodes, forward);
    }
}
