package dev.jobmatcher.ai;

import dev.jobmatcher.exception.BatchIdentityMismatchException;
import dev.jobmatcher.exception.InvalidGenerationOutputException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Matches batch output to batch input by id, never by position.
 */
@Slf4j
public final class BatchIdentityVerifier {

    private BatchIdentityVerifier() {
    }

    /**
     * Reconciles the entries a batch call returned with the ids that were sent.
     * <ul>
     * <li>unexpected or duplicated ids always fail with {@link BatchIdentityMismatchException}</li>
     * <li>missing ids fail in strict mode and are rejected in best-effort mode</li>
     * <li>malformed entries fail in strict mode with {@link InvalidGenerationOutputException}
     * and are rejected in best-effort mode</li>
     * </ul>
     *
     * @return accepted values in the order of {@code inputIds}
     */
    public static <T> BatchOutcome<T> reconcile(String operation, List<String> inputIds, List<BatchEntry<T>> entries,
            BatchMode mode) {
        Set<String> expected = new LinkedHashSet<>(inputIds);
        Map<String, BatchEntry<T>> byId = new HashMap<>();
        Set<String> unexpected = new LinkedHashSet<>();
        Set<String> duplicated = new LinkedHashSet<>();

        for (BatchEntry<T> entry : entries) {
            String id = entry.id();
            if (id == null || !expected.contains(id)) {
                unexpected.add(String.valueOf(id));
            } else if (byId.putIfAbsent(id, entry) != null) {
                duplicated.add(id);
            }
        }

        Set<String> missing = new LinkedHashSet<>(expected);
        missing.removeAll(byId.keySet());

        boolean strict = mode == BatchMode.STRICT;
        if (!unexpected.isEmpty() || !duplicated.isEmpty() || (strict && !missing.isEmpty())) {
            log.error("{} batch identity mismatch: missing={}, unexpected={}, duplicated={}",
                    operation, missing, unexpected, duplicated);
            throw new BatchIdentityMismatchException(operation, missing, unexpected, duplicated);
        }

        List<String> violations = new ArrayList<>();
        List<T> results = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String id : inputIds) {
            if (!seen.add(id)) {
                continue;
            }
            BatchEntry<T> entry = byId.get(id);
            if (entry == null) {
                rejected.add(id);
            } else if (entry.isMalformed()) {
                violations.add(id + ": " + entry.error());
                rejected.add(id);
            } else {
                results.add(entry.value());
            }
        }

        if (strict && !violations.isEmpty()) {
            throw new InvalidGenerationOutputException(operation + " batch contained malformed entries", violations);
        }
        if (!rejected.isEmpty()) {
            log.warn("{} batch dropped {} entries: {}", operation, rejected.size(), rejected);
        }
        return new BatchOutcome<>(results, rejected);
    }
}
