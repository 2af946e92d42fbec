package dev.jobmatcher.queue;

/**
 * What one worker pass did.
 *
 * @param skipped items completed without work because a newer item superseded them
 */
public record DrainSummary(int claimed, int completed, int failed, int skipped) {

    public static DrainSummary empty() {
        return new DrainSummary(0, 0, 0, 0);
    }
}
