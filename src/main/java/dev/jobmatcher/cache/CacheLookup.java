package dev.jobmatcher.cache;

import dev.jobmatcher.spec.SearchSpec;

/**
 * Result of a cache lookup. {@code spec} is null on a miss.
 */
public record CacheLookup(boolean hit, SearchSpec spec, String key) {

    public static CacheLookup hit(String key, SearchSpec spec) {
        return new CacheLookup(true, spec, key);
    }

    public static CacheLookup miss(String key) {
        return new CacheLookup(false, null, key);
    }
}
