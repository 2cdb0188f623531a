package ai.depgraph.descriptor;

import java.nio.file.Path;

import ai.depgraph.model.PackageDescriptor;

/**
 * Reads one package manifest.
 */
@FunctionalInterface
public interface DescriptorParser {

    /**
     * @param manifestPath path of the manifest file itself (not its directory)
     * @return the validated descriptor; never null
     * @throws DescriptorException if the file is unreadable, malformed or has no name
     */
    PackageDescriptor parse(Path manifestPath) throws DescriptorException;
}
