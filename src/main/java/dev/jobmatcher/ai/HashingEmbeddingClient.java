package dev.jobmatcher.ai;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Feature-hashed bag of words, L2 normalized. Deterministic and offline; similar texts
 * land near each other but nothing beyond shared tokens is captured.
 */
@Component
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "none", matchIfMissing = true)
public class HashingEmbeddingClient implements EmbeddingClient {

    static final int DIMENSIONS = 256;

    @Override
    public Mono<List<Double>> embed(String text) {
        return Mono.fromSupplier(() -> vectorize(text));
    }

    @Override
    public Mono<List<List<Double>>> embedAll(List<String> texts) {
        return Mono.fromSupplier(() -> texts.stream().map(this::vectorize).toList());
    }

    @Override
    public String modelName() {
        return "hashing-" + DIMENSIONS;
    }

    List<Double> vectorize(String text) {
        double[] vector = new double[DIMENSIONS];
        if (text != null) {
            for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}+#]+")) {
                if (token.isEmpty()) {
                    continue;
                }
                int hash = token.hashCode();
                int bucket = Math.floorMod(hash, DIMENSIONS);
                vector[bucket] += (hash & 0x100) == 0 ? 1 : -1;
            }
        }

        double norm = 0;
        for (double value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);

        List<Double> result = new ArrayList<>(DIMENSIONS);
        for (double value : vector) {
            result.add(norm == 0 ? 0.0 : value / norm);
        }
        return result;
    }
}
