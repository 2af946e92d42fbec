package dev.jobmatcher.version;

import dev.jobmatcher.exception.InvalidVersionTransitionException;
import dev.jobmatcher.exception.VersionOverflowException;

/**
 * Rules for the monotonically increasing profile version counter.
 * A version starts at 1, moves forward by exactly one per profile change and
 * never exceeds {@link #MAX_PROFILE_VERSION}.
 */
public final class ProfileVersions {

    public static final int MIN_PROFILE_VERSION = 1;
    public static final int MAX_PROFILE_VERSION = 1_000_000;

    private ProfileVersions() {
    }

    /**
     * Returns the version that follows {@code current}. Does not validate the bound;
     * pass the result through {@link #validateTransition(int, int)} before storing it.
     */
    public static int nextVersion(int current) {
        return current + 1;
    }

    /**
     * Checks a proposed version write without throwing.
     * Decrements and no-ops are reported first, then skips, then overflow.
     */
    public static VersionValidation validateVersionUpdate(int oldVersion, int newVersion) {
        if (newVersion <= oldVersion) {
            return VersionValidation.invalid(
                    String.format("Version cannot decrement: %d -> %d", oldVersion, newVersion));
        }
        if (newVersion != oldVersion + 1) {
            return VersionValidation.invalid(String.format("Version must increment by 1: %d -> %d (expected %d)",
                    oldVersion, newVersion, oldVersion + 1));
        }
        if (newVersion > MAX_PROFILE_VERSION) {
            return VersionValidation.invalid(
                    String.format("Version exceeds maximum (%d): %d", MAX_PROFILE_VERSION, newVersion));
        }
        return VersionValidation.ok();
    }

    /**
     * Same rules as {@link #validateVersionUpdate(int, int)} but throws on violation.
     *
     * @throws VersionOverflowException          when the next version would pass the maximum
     * @throws InvalidVersionTransitionException for any other illegal write
     */
    public static void validateTransition(int oldVersion, int newVersion) {
        VersionValidation validation = validateVersionUpdate(oldVersion, newVersion);
        if (validation.valid()) {
            return;
        }
        if (newVersion == oldVersion + 1) {
            throw new VersionOverflowException(validation.error());
        }
        throw new InvalidVersionTransitionException(validation.error());
    }
}
