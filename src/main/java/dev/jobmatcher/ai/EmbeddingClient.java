package dev.jobmatcher.ai;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Turns text into a dense vector.
 */
public interface EmbeddingClient {

    Mono<List<Double>> embed(String text);

    /**
     * Embeds several texts in one call. The result holds one vector per text, in input order.
     */
    Mono<List<List<Double>>> embedAll(List<String> texts);

    /**
     * Identifier of the model that produced the vectors, stored next to them.
     */
    String modelName();
}
