package ai.depgraph.graph;

import java.util.Objects;

/**
 * A package was reached again while its own dependencies were still being ordered.
 */
public class CycleException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String involvedPackage;

    public CycleException(String involvedPackage) {
        super("Circular dependency detected involving package: " + involvedPackage);
        this.involvedPackage = Objects.requireNonNull(involvedPackage, "involvedPackage");
    }

    /** One package on the cycle; not necessarily its "first" member. */
    public String involvedPackage() {
        return involvedPackage;
    }
}
