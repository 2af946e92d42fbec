package dev.jobmatcher.version;

import java.time.Instant;

public record StaleItem(String id, int profileVersion, int versionGap, Instant createdAt) {
}
