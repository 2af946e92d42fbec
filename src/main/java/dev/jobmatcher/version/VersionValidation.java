package dev.jobmatcher.version;

public record VersionValidation(boolean valid, String error) {

    public static VersionValidation ok() {
        return new VersionValidation(true, null);
    }

    public static VersionValidation invalid(String error) {
        return new VersionValidation(false, error);
    }
}
