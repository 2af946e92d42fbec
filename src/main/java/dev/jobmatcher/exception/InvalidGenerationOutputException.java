package dev.jobmatcher.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a structured generation call returns output that does not match
 * its declared schema or constraints. Such output is never cached or persisted.
 */
@Getter
public class InvalidGenerationOutputException extends JobMatcherException {

    private static final String DEFAULT_ERROR_CODE = "ERR-GEN-001";

    private final List<String> violations;

    public InvalidGenerationOutputException(String message, List<String> violations) {
        super(message + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public InvalidGenerationOutputException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(cause.getMessage() != null ? cause.getMessage() : message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
