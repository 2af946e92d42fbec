package dev.jobmatcher.exception;

/**
 * Thrown when a persisted entity or an external profile cannot be found.
 */
public class EntityNotFoundException extends JobMatcherException {

    private static final String DEFAULT_ERROR_CODE = "ERR-DB-001";

    public EntityNotFoundException(String message) {
        super(message);
    }

    public EntityNotFoundException(String entityType, Object identifier) {
        super(String.format("%s with identifier %s not found", entityType, identifier));
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
