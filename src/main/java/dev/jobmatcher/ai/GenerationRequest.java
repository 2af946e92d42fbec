package dev.jobmatcher.ai;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One structured-output call: fixed instructions, the input document and the JSON schema
 * the answer must follow.
 *
 * @param operation short name used in logs and metrics
 * @param model     model override, or null for the client's default
 */
public record GenerationRequest(
        String operation,
        String model,
        String instructions,
        String input,
        String schemaName,
        JsonNode schema) {
}
