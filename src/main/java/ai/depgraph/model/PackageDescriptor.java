package ai.depgraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parsed manifest of a single workspace package.
 * Dependency maps are name -> version range; only the names matter to the graph.
 */
public record PackageDescriptor(
        String name,
        String version,                        // null when the manifest has none
        Map<String, String> dependencies,
        Map<String, String> devDependencies,
        Map<String, String> peerDependencies,
        Map<String, String> optionalDependencies
) {

    public PackageDescriptor {
        Objects.requireNonNull(name, "name");
        dependencies = copyOf(dependencies);
        devDependencies = copyOf(devDependencies);
        peerDependencies = copyOf(peerDependencies);
        optionalDependencies = copyOf(optionalDependencies);
    }

    public static PackageDescriptor of(String name, String version, Map<String, String> dependencies) {
        return new PackageDescriptor(name, version, dependencies, null, null, null);
    }

    /**
     * Union of every dependency category, in declaration order:
     * runtime, development, peer, optional.
     */
    public Set<String> allDependencyNames() {
        final Set<String> out = new LinkedHashSet<>();
        out.addAll(dependencies.keySet());
        out.addAll(devDependencies.keySet());
        out.addAll(peerDependencies.keySet());
        out.addAll(optionalDependencies.keySet());
        return out;
    }

    public Set<String> devDependencyNames() {
        return new LinkedHashSet<>(devDependencies.keySet());
    }

    private static Map<String, String> copyOf(Map<String, String> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        // Map.copyOf would drop declaration order
        return Collections.unmodifiableMap(new LinkedHashMap<>(in));
    }
}
