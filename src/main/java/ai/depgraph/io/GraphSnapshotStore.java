package ai.depgraph.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.depgraph.model.DependencyGraph;
import ai.depgraph.model.SerializedGraph;

/**
 * Stores graph snapshots as pretty-printed JSON so a later run can skip scanning and parsing.
 */
public final class GraphSnapshotStore {

    private final ObjectMapper jsonMapper;
    private final Logger log;

    public GraphSnapshotStore() {
        this(NOPLogger.NOP_LOGGER);
    }

    public GraphSnapshotStore(Logger log) {
        this.jsonMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.log = Objects.requireNonNull(log, "log");
    }

    public void write(DependencyGraph graph, Path file) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(file, "file");

        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        jsonMapper.writeValue(file.toFile(), GraphCodec.serialize(graph));
        log.debug("Wrote graph snapshot with {} packages to {}", graph.size(), file);
    }

    public DependencyGraph read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Snapshot not found: " + file);
        }
        final SerializedGraph data = jsonMapper.readValue(file.toFile(), SerializedGraph.class);
        final DependencyGraph graph = GraphCodec.deserialize(data);
        log.debug("Restored graph snapshot with {} packages from {}", graph.size(), file);
        return graph;
    }

    /** JSON text of a snapshot, as {@link #write} would store it. */
    public String toJson(DependencyGraph graph) throws IOException {
        return jsonMapper.writeValueAsString(GraphCodec.serialize(graph));
    }

    public DependencyGraph fromJson(String json) throws IOException {
        Objects.requireNonNull(json, "json");
        return GraphCodec.deserialize(jsonMapper.readValue(json, SerializedGraph.class));
    }
}
