package ai.depgraph.scan;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

/**
 * Finds package manifests in a workspace:
 * - {@code <root>/<manifest>}
 * - {@code <root>/<dir>/<manifest>} and deeper, up to {@code maxDepth} directory levels
 * <p>
 * The root manifest comes first, the rest in path order.
 */
public final class WorkspaceScanner {

    public static final String DEFAULT_MANIFEST = "package.json";
    public static final Set<String> DEFAULT_SKIP_DIRS = Set.of("node_modules", ".git");

    private final String manifestFileName;
    private final int maxDepth;
    private final Set<String> skipDirectories;
    private final ExclusionMatcher exclusions;
    private final Logger log;

    public WorkspaceScanner(ExclusionMatcher exclusions) {
        this(DEFAULT_MANIFEST, 1, DEFAULT_SKIP_DIRS, exclusions, NOPLogger.NOP_LOGGER);
    }

    public WorkspaceScanner(String manifestFileName, int maxDepth, Set<String> skipDirectories,
                            ExclusionMatcher exclusions, Logger log) {
        this.manifestFileName = Objects.requireNonNull(manifestFileName, "manifestFileName");
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.skipDirectories = Set.copyOf(Objects.requireNonNull(skipDirectories, "skipDirectories"));
        this.exclusions = Objects.requireNonNull(exclusions, "exclusions");
        this.log = Objects.requireNonNull(log, "log");
    }

    public List<Path> scan(Path root) throws ScanException {
        Objects.requireNonNull(root, "root");
        if (!Files.isDirectory(root)) {
            final ScanException ex = new ScanException(root, "Not a directory: " + root, null);
            log.error("DEPENDENCY_GRAPH_SCAN_FAILED: Failed to scan directory | Directory: {} | Error: {}",
                    root, ex.getMessage());
            throw ex;
        }

        final List<Path> found = new ArrayList<>();
        final Path rootManifest = root.resolve(manifestFileName);
        if (Files.isRegularFile(rootManifest)) {
            accept(rootManifest, found);
        }

        final List<Path> nested = new ArrayList<>();
        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), maxDepth, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                    if (skipDirectories.contains(name)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    final Path manifest = dir.resolve(manifestFileName);
                    if (Files.isRegularFile(manifest)) {
                        nested.add(manifest);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    // at maxDepth directories arrive here instead of preVisitDirectory
                    if (attrs.isDirectory()) {
                        return preVisitDirectory(file, attrs);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    if (file.equals(root)) {
                        throw exc;
                    }
                    log.warn("Skipping unreadable path {}: {}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            log.error("DEPENDENCY_GRAPH_SCAN_FAILED: Failed to scan directory | Directory: {} | Error: {}",
                    root, ex.toString());
            throw new ScanException(root, "Failed to scan " + root + ": " + ex.getMessage(), ex);
        }

        Collections.sort(nested);
        for (Path manifest : nested) {
            accept(manifest, found);
        }
        return found;
    }

    private void accept(Path manifest, List<Path> found) {
        if (exclusions.shouldExclude(manifest)) {
            log.debug("Excluding {} at: {} (matches exclusion pattern)", manifestFileName, manifest);
            return;
        }
        log.debug("Found {} at: {}", manifestFileName, manifest);
        found.add(manifest);
    }
}
