package ai.depgraph.scan;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The workspace root is missing or could not be listed.
 */
public class ScanException extends IOException {

    private static final long serialVersionUID = 1L;

    private final transient Path directory;

    public ScanException(Path directory, String message, Throwable cause) {
        super(message, cause);
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }
}
