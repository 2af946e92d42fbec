package dev.jobmatcher.exception;

public class TaskRunnerException extends JobMatcherException {

    private static final String DEFAULT_ERROR_CODE = "ERR-RUN-002";

    public TaskRunnerException(String message) {
        super(message);
    }

    public TaskRunnerException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
