package ai.depgraph.descriptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.depgraph.model.PackageDescriptor;

/**
 * Parses npm-style {@code package.json} manifests.
 */
public final class PackageJsonParser implements DescriptorParser {

    private final ObjectMapper mapper;
    private final Logger log;

    public PackageJsonParser() {
        this(NOPLogger.NOP_LOGGER);
    }

    public PackageJsonParser(Logger log) {
        this.mapper = new ObjectMapper();
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public PackageDescriptor parse(Path manifestPath) throws DescriptorException {
        Objects.requireNonNull(manifestPath, "manifestPath");
        try {
            return read(manifestPath);
        } catch (DescriptorException ex) {
            log.error("DEPENDENCY_GRAPH_PARSE_FAILED: Failed to parse package.json | Path: {} | Error: {}",
                    manifestPath, ex.getMessage());
            throw ex;
        }
    }

    private PackageDescriptor read(Path manifestPath) throws DescriptorException {
        final String content;
        try {
            content = Files.readString(manifestPath);
        } catch (IOException ex) {
            throw new DescriptorException(manifestPath, "Cannot read " + manifestPath + ": " + ex, ex);
        }

        final JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException ex) {
            throw new DescriptorException(manifestPath,
                    "Invalid JSON in " + manifestPath + ": " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new DescriptorException(manifestPath, "Manifest " + manifestPath + " is not a JSON object");
        }

        final JsonNode name = root.get("name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            throw new DescriptorException(manifestPath, "Package at " + manifestPath + " has no name field");
        }

        final JsonNode version = root.get("version");
        if (version != null && !version.isNull() && !version.isTextual()) {
            throw new DescriptorException(manifestPath, "Field 'version' in " + manifestPath + " must be a string");
        }

        return new PackageDescriptor(
                name.asText(),
                version == null || version.isNull() ? null : version.asText(),
                dependencySection(root, "dependencies", manifestPath),
                dependencySection(root, "devDependencies", manifestPath),
                dependencySection(root, "peerDependencies", manifestPath),
                dependencySection(root, "optionalDependencies", manifestPath));
    }

    private static Map<String, String> dependencySection(JsonNode root, String field, Path manifestPath)
            throws DescriptorException {
        final JsonNode section = root.get(field);
        if (section == null || section.isNull()) {
            return Map.of();
        }
        if (!section.isObject()) {
            throw new DescriptorException(manifestPath,
                    "Field '" + field + "' in " + manifestPath + " must be an object");
        }
        final Map<String, String> out = new LinkedHashMap<>();
        section.fields().forEachRemaining(e -> out.put(e.getKey(), e.getValue().asText()));
        return out;
    }
}
