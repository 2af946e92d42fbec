package dev.jobmatcher.exception;

/**
 * An agent run in a terminal state was asked to change state again.
 */
public class IllegalRunTransitionException extends JobMatcherException {

    private static final String DEFAULT_ERROR_CODE = "ERR-RUN-001";

    public IllegalRunTransitionException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
