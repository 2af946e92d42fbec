package dev.jobmatcher.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * JSON schemas sent with structured-output calls, loaded once from the classpath.
 */
@Component
public class GenerationSchemas {

    private final JsonNode searchSpec;
    private final JsonNode enrichBatch;
    private final JsonNode rankBatch;

    public GenerationSchemas(ObjectMapper objectMapper) {
        this.searchSpec = load(objectMapper, "schemas/search-spec.schema.json");
        this.enrichBatch = load(objectMapper, "schemas/enrich-batch.schema.json");
        this.rankBatch = load(objectMapper, "schemas/rank-batch.schema.json");
    }

    public JsonNode searchSpec() {
        return searchSpec;
    }

    public JsonNode enrichBatch() {
        return enrichBatch;
    }

    public JsonNode rankBatch() {
        return rankBatch;
    }

    private static JsonNode load(ObjectMapper objectMapper, String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Could not load schema " + path, e);
        }
    }
}
