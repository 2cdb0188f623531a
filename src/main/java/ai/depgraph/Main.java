package ai.depgraph;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.depgraph.config.ConfigLoader;
import ai.depgraph.config.DepGraphSettings;
import ai.depgraph.descriptor.PackageJsonParser;
import ai.depgraph.graph.CycleException;
import ai.depgraph.graph.GraphAnalyzer;
import ai.depgraph.graph.GraphBuilder;
import ai.depgraph.graph.GraphValidator;
import ai.depgraph.graph.ValidationResult;
import ai.depgraph.io.GraphSnapshotStore;
import ai.depgraph.model.DependencyGraph;
import ai.depgraph.scan.ExclusionMatcher;
import ai.depgraph.scan.WorkspaceScanner;

public final class Main {

    static final int OK = 0;
    static final int ANALYSIS_FAILED = 1;
    static final int USAGE_OR_IO = 2;

    private enum Action {
        ORDER,
        DEPENDENTS,
        VALIDATE
    }

    private Main() {
    }

    public static void main(String[] args) {
        final int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path workspaceRoot = null;
        Path configFile = null;
        Action action = Action.ORDER;
        String dependentsOf = null;
        boolean saveSnapshot = false;
        boolean fromSnapshot = false;
        Path snapshotOverride = null;
        final List<String> extraExcludes = new ArrayList<>();

        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                printUsage(out);
                return OK;
            }
            if ("--order".equals(arg)) {
                action = Action.ORDER;
                continue;
            }
            if ("--validate".equals(arg)) {
                action = Action.VALIDATE;
                continue;
            }
            if (arg.startsWith("--dependents=")) {
                action = Action.DEPENDENTS;
                dependentsOf = arg.substring("--dependents=".length()).trim();
                continue;
            }
            if (arg.startsWith("--exclude=")) {
                Arrays.stream(arg.substring("--exclude=".length()).split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .forEach(extraExcludes::add);
                continue;
            }
            if (arg.startsWith("--config=")) {
                configFile = Paths.get(arg.substring("--config=".length()));
                continue;
            }
            if ("--save-snapshot".equals(arg) || arg.startsWith("--save-snapshot=")) {
                saveSnapshot = true;
                snapshotOverride = optionalPath(arg, "--save-snapshot=", snapshotOverride);
                continue;
            }
            if ("--from-snapshot".equals(arg) || arg.startsWith("--from-snapshot=")) {
                fromSnapshot = true;
                snapshotOverride = optionalPath(arg, "--from-snapshot=", snapshotOverride);
                continue;
            }
            if ("--verbose".equals(arg)) {
                // must be set before the first logger is created
                System.setProperty("depgraph.log.level", "DEBUG");
                continue;
            }
            if (arg.startsWith("--")) {
                err.println("ERROR: unknown argument: " + arg);
                printUsage(err);
                return USAGE_OR_IO;
            }
            if (workspaceRoot == null) {
                workspaceRoot = Paths.get(arg);
                continue;
            }
            err.println("ERROR: unexpected argument: " + arg);
            printUsage(err);
            return USAGE_OR_IO;
        }

        if (action == Action.DEPENDENTS && (dependentsOf == null || dependentsOf.isEmpty())) {
            err.println("ERROR: --dependents needs a package name");
            return USAGE_OR_IO;
        }
        if (workspaceRoot == null) {
            workspaceRoot = Paths.get(".");
        }
        workspaceRoot = workspaceRoot.toAbsolutePath().normalize();

        final Logger log = LoggerFactory.getLogger(Main.class);
        try {
            final DepGraphSettings settings = DepGraphSettings
                    .from(ConfigLoader.resolve(configFile, workspaceRoot))
                    .withExtraExcludes(extraExcludes);

            Path snapshotFile = snapshotOverride != null ? snapshotOverride : Paths.get(settings.snapshotFile());
            if (!snapshotFile.isAbsolute()) {
                snapshotFile = workspaceRoot.resolve(snapshotFile).normalize();
            }

            final GraphSnapshotStore store = new GraphSnapshotStore(LoggerFactory.getLogger(GraphSnapshotStore.class));
            final DependencyGraph graph = fromSnapshot
                    ? store.read(snapshotFile)
                    : buildGraph(workspaceRoot, settings);
            log.info("Graph has {} packages", graph.size());

            if (saveSnapshot) {
                store.write(graph, snapshotFile);
                err.println("Snapshot written to: " + snapshotFile);
            }

            final GraphAnalyzer analyzer = new GraphAnalyzer(LoggerFactory.getLogger(GraphAnalyzer.class));
            switch (action) {
                case VALIDATE: {
                    final ValidationResult result = new GraphValidator(analyzer).validate(graph);
                    if (result.valid()) {
                        out.println("Graph is valid (" + graph.size() + " packages)");
                        return OK;
                    }
                    result.errors().forEach(out::println);
                    return ANALYSIS_FAILED;
                }
                case DEPENDENTS: {
                    analyzer.dependentsOf(dependentsOf, graph).forEach(out::println);
                    return OK;
                }
                case ORDER:
                default: {
                    analyzer.sort(graph).forEach(out::println);
                    return OK;
                }
            }
        } catch (CycleException ex) {
            err.println("ERROR: " + ex.getMessage());
            return ANALYSIS_FAILED;
        } catch (IOException ex) {
            err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return USAGE_OR_IO;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            err.println("ERROR: interrupted");
            return USAGE_OR_IO;
        } catch (Exception ex) {
            err.println("ERROR: failed to build graph: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return USAGE_OR_IO;
        }
    }

    static DependencyGraph buildGraph(Path workspaceRoot, DepGraphSettings settings)
            throws IOException, InterruptedException {
        final ExclusionMatcher exclusions = new ExclusionMatcher(settings.excludePatterns(), Paths.get(""));
        final WorkspaceScanner scanner = new WorkspaceScanner(
                settings.manifestFileName(),
                settings.scanMaxDepth(),
                settings.skipDirectories(),
                exclusions,
                LoggerFactory.getLogger(WorkspaceScanner.class));
        final List<Path> manifests = scanner.scan(workspaceRoot);

        final GraphBuilder builder = new GraphBuilder(
                new PackageJsonParser(LoggerFactory.getLogger(PackageJsonParser.class)),
                settings.rejectDuplicateNames(),
                LoggerFactory.getLogger(GraphBuilder.class));

        if (settings.parallelism() <= 1) {
            return builder.build(manifests);
        }
        final ExecutorService pool = Executors.newFixedThreadPool(settings.parallelism());
        try {
            return builder.build(manifests, pool);
        } finally {
            pool.shutdownNow();
        }
    }

    private static Path optionalPath(String arg, String prefix, Path current) {
        if (arg.startsWith(prefix)) {
            return Paths.get(arg.substring(prefix.length()));
        }
        return current;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: depgraph [workspaceRoot] [options]");
        out.println("Options:");
        out.println("  --order                    Print the build order (default)");
        out.println("  --dependents=<name>        Print every package depending on <name>");
        out.println("  --validate                 Check for missing edge targets and cycles");
        out.println("  --exclude=<p1,p2>          Extra glob patterns of manifests to skip");
        out.println("  --config=<file>            Configuration file (default: <workspaceRoot>/depgraph.conf)");
        out.println("  --save-snapshot[=<file>]   Write the graph snapshot after building");
        out.println("  --from-snapshot[=<file>]   Load the graph from a snapshot instead of scanning");
        out.println("  --verbose                  Debug logging to stderr");
        out.println("  --help, -h                 Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
