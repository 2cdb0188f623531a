package ai.depgraph.graph;

import java.nio.file.Path;

import ai.depgraph.descriptor.DescriptorException;

/**
 * Two manifests declare the same package name while duplicate names are rejected.
 */
public class DuplicatePackageException extends DescriptorException {

    private static final long serialVersionUID = 1L;

    private final String packageName;

    public DuplicatePackageException(String packageName, Path firstManifest, Path secondManifest) {
        super(secondManifest, "Package " + packageName + " is declared by both "
                + firstManifest + " and " + secondManifest);
        this.packageName = packageName;
    }

    public String packageName() {
        return packageName;
    }
}
