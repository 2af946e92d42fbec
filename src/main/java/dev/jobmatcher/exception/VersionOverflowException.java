package dev.jobmatcher.exception;

public class VersionOverflowException extends JobMatcherException {

    private static final String DEFAULT_ERROR_CODE = "ERR-VER-002";

    public VersionOverflowException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
