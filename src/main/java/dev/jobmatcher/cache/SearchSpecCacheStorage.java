package dev.jobmatcher.cache;

import dev.jobmatcher.spec.SearchSpec;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Minimal key-value contract behind {@link SearchSpecCache}. Any store that can get, set
 * and delete by key satisfies it.
 */
public interface SearchSpecCacheStorage {

    /**
     * Completes empty when the key is absent or its entry has expired.
     */
    Mono<SearchSpec> get(String key);

    /**
     * @param ttl time to live, or null for no expiry
     */
    Mono<Void> set(String key, SearchSpec value, Duration ttl);

    Mono<Void> delete(String key);
}
