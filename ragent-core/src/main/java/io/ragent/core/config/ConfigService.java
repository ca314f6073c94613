package io.ragent.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.ragent.core.config.model.AgentDefaults;
import io.ragent.core.config.model.RagentConfig;
import io.ragent.core.config.model.RetrievalConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes {@link RagentConfig} JSON. A file on disk only needs the keys it changes:
 * it is layered over the defaults, and the result is checked before it reaches the agent.
 */
public final class ConfigService {
    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * @throws IllegalArgumentException if the merged configuration cannot drive a run
     */
    public RagentConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        RagentConfig config = Files.exists(configPath) ? readLayered(configPath) : RagentConfig.defaults();
        validate(config);
        return config;
    }

    public void save(Path configPath, RagentConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        validate(Objects.requireNonNull(config, "config must not be null"));
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    /**
     * Writes the defaults, or with {@code overwrite == false} the existing file filled in with
     * any keys it lacks.
     *
     * @return true if the file did not exist before
     */
    public boolean onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        save(configPath, created || overwrite ? RagentConfig.defaults() : load(configPath));
        return created;
    }

    public String toPrettyJson(RagentConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    static void validate(RagentConfig config) {
        AgentDefaults agent = config.agent();
        if (agent.maxIterations() < 1) {
            throw new IllegalArgumentException("agent.maxIterations must be at least 1, got " + agent.maxIterations());
        }
        if (agent.toolParallelism() < 1) {
            throw new IllegalArgumentException("agent.toolParallelism must be at least 1, got " + agent.toolParallelism());
        }
        if (agent.provider() != null && !agent.provider().isBlank()) {
            config.providers().byName(agent.provider());
        }

        RetrievalConfig retrieval = config.retrieval();
        if (retrieval.chunkSize() < 1 || retrieval.chunkOverlap() < 0 || retrieval.chunkOverlap() >= retrieval.chunkSize()) {
            throw new IllegalArgumentException("retrieval.chunkOverlap must be in [0, chunkSize), got "
                + retrieval.chunkOverlap() + " with chunkSize " + retrieval.chunkSize());
        }
        if (retrieval.topK() < 1) {
            throw new IllegalArgumentException("retrieval.topK must be at least 1, got " + retrieval.topK());
        }
        config.providers().byName(retrieval.embeddingProvider());
    }

    private RagentConfig readLayered(Path configPath) throws IOException {
        ObjectNode layered = mapper.valueToTree(RagentConfig.defaults());
        JsonNode onDisk = mapper.readTree(Files.readString(configPath));
        if (onDisk != null && onDisk.isObject()) {
            overlay(layered, (ObjectNode) onDisk);
        }
        return mapper.treeToValue(layered, RagentConfig.class);
    }

    /** Copies {@code source} into {@code target}, descending into objects both sides define. */
    private static void overlay(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            JsonNode current = target.get(field.getKey());
            if (current != null && current.isObject() && value.isObject()) {
                overlay((ObjectNode) current, (ObjectNode) value);
            } else {
                target.set(field.getKey(), value.deepCopy());
            }
        }
    }
}
