package ai.depgraph.descriptor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A package manifest could not be read, is not valid JSON, or lacks a usable name.
 * Aborts the graph build it occurs in.
 */
public class DescriptorException extends IOException {

    private static final long serialVersionUID = 1L;

    private final transient Path manifestPath;

    public DescriptorException(Path manifestPath, String message) {
        super(message);
        this.manifestPath = manifestPath;
    }

    public DescriptorException(Path manifestPath, String message, Throwable cause) {
        super(message, cause);
        this.manifestPath = manifestPath;
    }

    public Path manifestPath() {
        return manifestPath;
    }
}
