package dev.jobmatcher.ai;

/**
 * How a batch call treats individual bad entries.
 */
public enum BatchMode {
    /**
     * Any malformed entry or id mismatch fails the whole batch.
     */
    STRICT,
    /**
     * Malformed or missing entries are dropped and reported; unexpected or duplicated ids
     * still fail the batch.
     */
    BEST_EFFORT
}
