package ai.depgraph.model;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

/**
 * Flat, order-preserving form of a {@link DependencyGraph}, written as JSON:
 * <pre>
 * {
 *   "packages": [ {"name": "a", "version": "1.0.0", "location": "/ws/a", "dependencies": ["b"]} ],
 *   "edges":    [ ["a", ["b"]] ]
 * }
 * </pre>
 * Reverse edges, dev dependencies and local dependencies are not stored. Node records read
 * {@code path} as an alias of {@code location}; a record with neither is rejected.
 */
@JsonPropertyOrder({"packages", "edges"})
public record SerializedGraph(
        List<NodeRecord> packages,
        List<EdgePair> edges
) {

    @JsonCreator
    public SerializedGraph(@JsonProperty("packages") List<NodeRecord> packages,
                           @JsonProperty("edges") List<EdgePair> edges) {
        this.packages = packages == null ? List.of() : List.copyOf(packages);
        this.edges = edges == null ? List.of() : List.copyOf(edges);
    }

    @JsonPropertyOrder({"name", "version", "location", "dependencies"})
    public record NodeRecord(
            String name,
            String version,
            String location,
            List<String> dependencies
    ) {

        @JsonCreator
        public NodeRecord(@JsonProperty("name") String name,
                          @JsonProperty("version") String version,
                          @JsonProperty("location") @JsonAlias("path") String location,
                          @JsonProperty("dependencies") List<String> dependencies) {
            this.name = Objects.requireNonNull(name, "name");
            this.version = version;
            this.location = Objects.requireNonNull(location, "location");
            this.dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        }
    }

    /**
     * Written as a two-element JSON array: {@code ["name", ["dep", ...]]}.
     */
    @JsonSerialize(using = EdgePairSerializer.class)
    @JsonDeserialize(using = EdgePairDeserializer.class)
    public record EdgePair(
            String name,
            List<String> dependencies
    ) {

        public EdgePair {
            Objects.requireNonNull(name, "name");
            dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        }
    }

    public static final class EdgePairSerializer extends StdSerializer<EdgePair> {

        private static final long serialVersionUID = 1L;

        public EdgePairSerializer() {
            super(EdgePair.class);
        }

        @Override
        public void serialize(EdgePair pair, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartArray();
            gen.writeString(pair.name());
            gen.writeStartArray();
            for (String dep : pair.dependencies()) {
                gen.writeString(dep);
            }
            gen.writeEndArray();
            gen.writeEndArray();
        }
    }

    public static final class EdgePairDeserializer extends StdDeserializer<EdgePair> {

        private static final long serialVersionUID = 1L;

        public EdgePairDeserializer() {
            super(EdgePair.class);
        }

        @Override
        public EdgePair deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            final JsonNode node = p.getCodec().readTree(p);
            if (!node.isArray() || node.size() != 2 || !node.get(0).isTextual() || !node.get(1).isArray()) {
                throw JsonMappingException.from(p, "Edge must be [name, [dependencies...]], got " + node);
            }
            final List<String> deps = new ArrayList<>(node.get(1).size());
            for (JsonNode dep : node.get(1)) {
                if (!dep.isTextual()) {
                    throw JsonMappingException.from(p, "Edge dependency of " + node.get(0).asText()
                            + " must be a string, got " + dep);
                }
                deps.add(dep.asText());
            }
            return new EdgePair(node.get(0).asText(), deps);
        }
    }
}
