package dev.jobmatcher.exception;

/**
 * A recompute queue item was asked to move between states its lifecycle does not allow.
 */
public class IllegalQueueTransitionException extends JobMatcherException {

    private static final String DEFAULT_ERROR_CODE = "ERR-QUEUE-001";

    public IllegalQueueTransitionException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
