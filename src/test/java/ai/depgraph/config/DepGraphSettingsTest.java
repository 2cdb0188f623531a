package ai.depgraph.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.ConfigFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader} and {@link DepGraphSettings}.
 */
@Tag("unit")
class DepGraphSettingsTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("depgraph.scan.max-depth");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void defaultsComeFromReferenceConf() {
        final DepGraphSettings settings = DepGraphSettings.from(ConfigLoader.loadDefaults());

        assertThat(settings.manifestFileName()).isEqualTo("package.json");
        assertThat(settings.scanMaxDepth()).isEqualTo(1);
        assertThat(settings.excludePatterns()).isEmpty();
        assertThat(settings.skipDirectories()).containsExactlyInAnyOrder("node_modules", ".git");
        assertThat(settings.rejectDuplicateNames()).isFalse();
        assertThat(settings.parallelism()).isEqualTo(1);
        assertThat(settings.snapshotFile()).isEqualTo(".depgraph/graph.json");
    }

    @Test
    void fileOverridesDefaults() throws Exception {
        final Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "depgraph.scan.max-depth = 3\n"
                + "depgraph.scan.exclude = [\"**/dist/**\"]\n"
                + "depgraph.build.reject-duplicate-names = true\n");

        final DepGraphSettings settings = DepGraphSettings.from(ConfigLoader.resolve(file, null));

        assertThat(settings.scanMaxDepth()).isEqualTo(3);
        assertThat(settings.excludePatterns()).containsExactly("**/dist/**");
        assertThat(settings.rejectDuplicateNames()).isTrue();
        assertThat(settings.manifestFileName()).isEqualTo("package.json");
    }

    @Test
    void workspaceFileIsPickedUpWhenNoFileGiven() throws Exception {
        Files.writeString(tempDir.resolve(ConfigLoader.WORKSPACE_CONFIG_FILE), "depgraph.build.parallelism = 4\n");

        final DepGraphSettings settings = DepGraphSettings.from(ConfigLoader.resolve(null, tempDir));

        assertThat(settings.parallelism()).isEqualTo(4);
    }

    @Test
    void systemPropertyOverridesFile() throws Exception {
        final Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "depgraph.scan.max-depth = 3\n");
        System.setProperty("depgraph.scan.max-depth", "5");
        ConfigFactory.invalidateCaches();

        final DepGraphSettings settings = DepGraphSettings.from(ConfigLoader.loadFromFile(file));

        assertThat(settings.scanMaxDepth()).isEqualTo(5);
    }

    @Test
    void missingExplicitFileFails() {
        assertThatThrownBy(() -> ConfigLoader.resolve(tempDir.resolve("nope.conf"), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Configuration file not found");
    }

    @Test
    void extraExcludesAreAppended() {
        final DepGraphSettings settings = DepGraphSettings.from(ConfigLoader.loadDefaults())
                .withExtraExcludes(List.of("legacy-*"));

        assertThat(settings.excludePatterns()).containsExactly("legacy-*");
    }

    @Test
    void rejectsInvalidParallelism() {
        assertThatThrownBy(() -> new DepGraphSettings("package.json", 1, List.of(),
                Set.of(), false, 0, "graph.json"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
