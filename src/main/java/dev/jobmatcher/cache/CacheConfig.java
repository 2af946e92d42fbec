package dev.jobmatcher.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatcher.config.CacheProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the search spec cache with the storage backend selected by {@code app.cache.backend}.
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(name = "app.cache.backend", havingValue = "memory", matchIfMissing = true)
    public SearchSpecCacheStorage inMemorySearchSpecCacheStorage(Clock clock) {
        log.info("Search spec cache backend: in-memory");
        return new InMemorySearchSpecCacheStorage(clock);
    }

    @Bean
    @ConditionalOnProperty(name = "app.cache.backend", havingValue = "jpa")
    public SearchSpecCacheStorage jpaSearchSpecCacheStorage(CachedSearchSpecRepository repository,
            ObjectMapper objectMapper, Clock clock) {
        log.info("Search spec cache backend: jpa");
        return new JpaSearchSpecCacheStorage(repository, objectMapper, clock);
    }

    @Bean
    public SearchSpecCache searchSpecCache(SearchSpecCacheStorage storage, CacheProperties properties) {
        return new SearchSpecCache(storage, properties.getTtl());
    }
}
