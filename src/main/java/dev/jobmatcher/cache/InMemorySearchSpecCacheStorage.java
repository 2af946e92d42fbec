package dev.jobmatcher.cache;

import dev.jobmatcher.spec.SearchSpec;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local storage for development and single-instance runs.
 * Expired entries are removed when they are next read; nothing sweeps them proactively.
 */
@Slf4j
public class InMemorySearchSpecCacheStorage implements SearchSpecCacheStorage {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySearchSpecCacheStorage(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<SearchSpec> get(String key) {
        return Mono.fromSupplier(() -> {
            Entry entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key, entry);
                log.debug("Evicted expired cache entry {}", key);
                return null;
            }
            return entry.value();
        });
    }

    @Override
    public Mono<Void> set(String key, SearchSpec value, Duration ttl) {
        return Mono.fromRunnable(() -> {
            Instant expiresAt = ttl != null ? clock.instant().plus(ttl) : null;
            entries.put(key, new Entry(value, expiresAt));
        });
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> entries.remove(key));
    }

    public void clear() {
        entries.clear();
    }

    /**
     * Number of stored entries, expired ones included until they are read.
     */
    public int size() {
        return entries.size();
    }

    private record Entry(SearchSpec value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
