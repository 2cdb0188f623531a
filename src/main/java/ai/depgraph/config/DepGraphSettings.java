package ai.depgraph.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.typesafe.config.Config;

/**
 * Typed view of the {@code depgraph} configuration block.
 */
public record DepGraphSettings(
        String manifestFileName,
        int scanMaxDepth,
        List<String> excludePatterns,
        Set<String> skipDirectories,
        boolean rejectDuplicateNames,
        int parallelism,
        String snapshotFile
) {

    public static final String ROOT = "depgraph";

    public DepGraphSettings {
        Objects.requireNonNull(manifestFileName, "manifestFileName");
        Objects.requireNonNull(snapshotFile, "snapshotFile");
        excludePatterns = List.copyOf(excludePatterns);
        skipDirectories = Set.copyOf(skipDirectories);
        if (scanMaxDepth < 0) {
            throw new IllegalArgumentException("scan.max-depth must be >= 0: " + scanMaxDepth);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("build.parallelism must be >= 1: " + parallelism);
        }
    }

    public static DepGraphSettings from(Config config) {
        final Config c = config.getConfig(ROOT);
        return new DepGraphSettings(
                c.getString("manifest-file-name"),
                c.getInt("scan.max-depth"),
                c.getStringList("scan.exclude"),
                Set.copyOf(c.getStringList("scan.skip-directories")),
                c.getBoolean("build.reject-duplicate-names"),
                c.getInt("build.parallelism"),
                c.getString("snapshot.file"));
    }

    public DepGraphSettings withExtraExcludes(List<String> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        final List<String> merged = new ArrayList<>(excludePatterns);
        merged.addAll(extra);
        return new DepGraphSettings(manifestFileName, scanMaxDepth, merged, skipDirectories,
                rejectDuplicateNames, parallelism, snapshotFile);
    }
}
