package dev.jobmatcher.exception;

import lombok.Getter;

import java.util.Set;

/**
 * The ids returned by a batch call do not match the ids that were sent.
 */
@Getter
public class BatchIdentityMismatchException extends JobMatcherException {

    private static final String DEFAULT_ERROR_CODE = "ERR-BATCH-001";

    private final Set<String> missing;
    private final Set<String> unexpected;
    private final Set<String> duplicated;

    public BatchIdentityMismatchException(String operation, Set<String> missing, Set<String> unexpected,
            Set<String> duplicated) {
        super(String.format("%s batch returned mismatched ids (missing=%s, unexpected=%s, duplicated=%s)",
                operation, missing, unexpected, duplicated));
        this.missing = Set.copyOf(missing);
        this.unexpected = Set.copyOf(unexpected);
        this.duplicated = Set.copyOf(duplicated);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
