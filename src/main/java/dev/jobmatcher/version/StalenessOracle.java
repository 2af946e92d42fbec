package dev.jobmatcher.version;

/**
 * Pure staleness checks. An artifact is stale when it was computed from a profile
 * version older than the current one.
 */
public final class StalenessOracle {

    private StalenessOracle() {
    }

    public static StalenessVerdict checkStaleness(int dataVersion, int currentVersion) {
        boolean stale = dataVersion < currentVersion;
        int gap = Math.max(0, currentVersion - dataVersion);
        String reason = stale
                ? String.format("Data version (%d) is %d version%s behind current (%d)",
                        dataVersion, gap, gap == 1 ? "" : "s", currentVersion)
                : null;
        return new StalenessVerdict(stale, dataVersion, currentVersion, gap, reason);
    }

    public static boolean isStale(int dataVersion, int currentVersion) {
        return dataVersion < currentVersion;
    }

    public static boolean isFresh(int dataVersion, int currentVersion) {
        return dataVersion >= currentVersion;
    }

    public static StalenessVerdict checkStaleness(VersionedArtifact artifact, int currentVersion) {
        return checkStaleness(artifact.getProfileVersion(), currentVersion);
    }
}
