package dev.jobmatcher.exception;

/**
 * Transport-level failure of a generation or embedding call (HTTP error,
 * timeout, unreachable endpoint). The call is not retried implicitly.
 */
public class GenerationCallException extends JobMatcherException {

    private static final String DEFAULT_ERROR_CODE = "ERR-GEN-002";

    public GenerationCallException(String message) {
        super(message);
    }

    public GenerationCallException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
