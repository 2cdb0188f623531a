package ai.depgraph.config;

import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Composes the HOCON configuration, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Ddepgraph.scan.max-depth=2})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file ({@code --config} or {@code <workspace>/depgraph.conf})</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after all layers are stacked, so user overrides reach every reference.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String WORKSPACE_CONFIG_FILE = "depgraph.conf";

    private ConfigLoader() {
    }

    /**
     * @param explicitConfigFile file given on the command line, or {@code null}
     * @param workspaceRoot      searched for {@value #WORKSPACE_CONFIG_FILE} when no file is given
     * @throws IllegalArgumentException if {@code explicitConfigFile} does not exist
     */
    public static Config resolve(Path explicitConfigFile, Path workspaceRoot) {
        if (explicitConfigFile != null) {
            if (!Files.isRegularFile(explicitConfigFile)) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.toAbsolutePath());
            }
            log.info("Using configuration file {}", explicitConfigFile.toAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        if (workspaceRoot != null) {
            final Path workspaceConfig = workspaceRoot.resolve(WORKSPACE_CONFIG_FILE);
            if (Files.isRegularFile(workspaceConfig)) {
                log.info("Using workspace configuration file {}", workspaceConfig);
                return loadFromFile(workspaceConfig);
            }
        }

        log.debug("No configuration file found, using defaults");
        return loadDefaults();
    }

    public static Config loadFromFile(Path configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(configFile.toFile()))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    public static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }
}
