package dev.jobmatcher.cache;

import dev.jobmatcher.spec.SearchSpec;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Search specs keyed by user and profile version.
 * <p>
 * A profile update changes the version and therefore the key, so the next lookup misses
 * without any explicit invalidation. Entries for older versions stay readable until they
 * expire or are invalidated. There is no single-flight guarantee: two concurrent misses
 * may both generate and the last write wins.
 */
public class SearchSpecCache {

    private static final String KEY_PREFIX = "search_spec";

    private final SearchSpecCacheStorage storage;
    private final Duration defaultTtl;

    public SearchSpecCache(SearchSpecCacheStorage storage, Duration defaultTtl) {
        this.storage = storage;
        this.defaultTtl = defaultTtl;
    }

    public SearchSpecCache(SearchSpecCacheStorage storage) {
        this(storage, null);
    }

    public static String cacheKey(String userId, int profileVersion) {
        return String.format("%s:%s:v%d", KEY_PREFIX, userId, profileVersion);
    }

    public Mono<SearchSpec> get(String userId, int profileVersion) {
        return storage.get(cacheKey(userId, profileVersion));
    }

    /**
     * Stores the spec under the key derived from its own user and profile version.
     */
    public Mono<Void> set(SearchSpec spec) {
        return set(spec, defaultTtl);
    }

    public Mono<Void> set(SearchSpec spec, Duration ttl) {
        return storage.set(cacheKey(spec.userId(), spec.profileVersion()), spec, ttl);
    }

    public Mono<Void> invalidate(String userId, int profileVersion) {
        return storage.delete(cacheKey(userId, profileVersion));
    }

    public Mono<Boolean> has(String userId, int profileVersion) {
        return get(userId, profileVersion).hasElement();
    }

    public Mono<CacheLookup> lookup(String userId, int profileVersion) {
        String key = cacheKey(userId, profileVersion);
        return storage.get(key)
                .map(spec -> CacheLookup.hit(key, spec))
                .defaultIfEmpty(CacheLookup.miss(key));
    }
}
