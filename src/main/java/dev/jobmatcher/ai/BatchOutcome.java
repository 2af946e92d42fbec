package dev.jobmatcher.ai;

import java.util.ArrayList;
import java.util.List;

/**
 * Accepted results in input order plus the ids dropped in best-effort mode.
 */
public record BatchOutcome<T>(List<T> results, List<String> rejectedIds) {

    public BatchOutcome {
        results = List.copyOf(results);
        rejectedIds = List.copyOf(rejectedIds);
    }

    public static <T> BatchOutcome<T> empty() {
        return new BatchOutcome<>(List.of(), List.of());
    }

    public BatchOutcome<T> merge(BatchOutcome<T> other) {
        List<T> mergedResults = new ArrayList<>(results);
        mergedResults.addAll(other.results);
        List<String> mergedRejected = new ArrayList<>(rejectedIds);
        mergedRejected.addAll(other.rejectedIds);
        return new BatchOutcome<>(mergedResults, mergedRejected);
    }
}
