package dev.jobmatcher.exception;

/**
 * A profile version write that does not move the version forward by exactly one.
 */
public class InvalidVersionTransitionException extends JobMatcherException {

    private static final String DEFAULT_ERROR_CODE = "ERR-VER-001";

    public InvalidVersionTransitionException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
