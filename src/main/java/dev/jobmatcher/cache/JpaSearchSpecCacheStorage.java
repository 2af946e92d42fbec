package dev.jobmatcher.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatcher.spec.SearchSpec;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Relational cache backend shared by every worker that points at the same database.
 * Same lazy expiry as the in-memory store: an expired row is deleted when read.
 */
@Slf4j
public class JpaSearchSpecCacheStorage implements SearchSpecCacheStorage {

    private final CachedSearchSpecRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JpaSearchSpecCacheStorage(CachedSearchSpecRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Mono<SearchSpec> get(String key) {
        return Mono.fromCallable(() -> repository.findById(key)
                        .map(row -> {
                            if (row.getExpiresAt() != null && !clock.instant().isBefore(row.getExpiresAt())) {
                                repository.delete(row);
                                log.debug("Evicted expired cache row {}", key);
                                return null;
                            }
                            return readSpec(row);
                        })
                        .orElse(null))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> set(String key, SearchSpec value, Duration ttl) {
        return Mono.fromRunnable(() -> {
                    Instant now = clock.instant();
                    repository.save(CachedSearchSpec.builder()
                            .cacheKey(key)
                            .payload(writeSpec(value))
                            .expiresAt(ttl != null ? now.plus(ttl) : null)
                            .storedAt(now)
                            .build());
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> repository.deleteById(key))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private SearchSpec readSpec(CachedSearchSpec row) {
        try {
            return objectMapper.readValue(row.getPayload(), SearchSpec.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt cache row " + row.getCacheKey(), e);
        }
    }

    private String writeSpec(SearchSpec spec) {
        try {
            return objectMapper.writeValueAsString(spec);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize search spec for " + spec.userId(), e);
        }
    }
}
