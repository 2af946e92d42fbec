package dev.jobmatcher.ai;

/**
 * One entry of a batch response: either a parsed value or the reason it could not be
 * parsed. The id is whatever the response claimed.
 */
public record BatchEntry<T>(String id, T value, String error) {

    public static <T> BatchEntry<T> ok(String id, T value) {
        return new BatchEntry<>(id, value, null);
    }

    public static <T> BatchEntry<T> malformed(String id, String error) {
        return new BatchEntry<>(id, null, error);
    }

    public boolean isMalformed() {
        return value == null;
    }
}
