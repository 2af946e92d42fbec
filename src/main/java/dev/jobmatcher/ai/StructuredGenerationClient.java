package dev.jobmatcher.ai;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Issues a single schema-constrained generation call.
 * Implementations apply an explicit deadline and never retry on their own.
 */
public interface StructuredGenerationClient {

    /**
     * @return the parsed JSON answer; errors with
     *         {@link dev.jobmatcher.exception.GenerationCallException} on transport failure or
     *         {@link dev.jobmatcher.exception.InvalidGenerationOutputException} when the answer
     *         is not JSON
     */
    Mono<JsonNode> generate(GenerationRequest request);
}
