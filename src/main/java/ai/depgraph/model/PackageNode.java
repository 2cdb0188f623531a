package ai.depgraph.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One workspace package, keyed by {@link #name()} in a {@link DependencyGraph}.
 * <p>
 * {@code declaredDependencies} is the union of all dependency categories;
 * {@code declaredDevDependencies} and {@code localDependencies} are subsets of it.
 * {@code localDependencies} can only be filled once every node of the workspace is known,
 * see {@link #withLocalDependencies(Set)}.
 */
public record PackageNode(
        String name,
        String version,
        Path location,                  // directory holding the manifest
        Set<String> declaredDependencies,
        Set<String> declaredDevDependencies,
        Set<String> localDependencies
) {

    public static final String DEFAULT_VERSION = "0.0.0";

    public PackageNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(location, "location");
        version = version == null ? DEFAULT_VERSION : version;
        declaredDependencies = orderedCopy(declaredDependencies);
        declaredDevDependencies = orderedCopy(declaredDevDependencies);
        localDependencies = orderedCopy(localDependencies);
        if (!declaredDependencies.containsAll(localDependencies)) {
            throw new IllegalArgumentException("Local dependencies of " + name
                    + " must be declared dependencies: " + localDependencies);
        }
    }

    /**
     * Node for a freshly parsed manifest; local dependencies stay empty until the
     * whole workspace has been read.
     */
    public static PackageNode fromDescriptor(PackageDescriptor descriptor, Path manifestPath) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(manifestPath, "manifestPath");
        final Path parent = manifestPath.getParent();
        return new PackageNode(
                descriptor.name(),
                descriptor.version(),
                parent != null ? parent : Path.of("."),
                descriptor.allDependencyNames(),
                descriptor.devDependencyNames(),
                Set.of());
    }

    public PackageNode withLocalDependencies(Set<String> local) {
        return new PackageNode(name, version, location, declaredDependencies, declaredDevDependencies, local);
    }

    private static Set<String> orderedCopy(Set<String> in) {
        if (in == null || in.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(in));
    }
}
