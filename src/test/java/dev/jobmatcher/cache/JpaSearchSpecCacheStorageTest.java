package dev.jobmatcher.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.jobmatcher.Fixtures;
import dev.jobmatcher.spec.SearchSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * The relational backend behind the search spec cache. Reads and writes run on scheduler
 * threads, so each one commits on its own.
 */
@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaSearchSpecCacheStorageTest {

    @Autowired
    private CachedSearchSpecRepository repository;

    private Fixtures.MutableClock clock;
    private SearchSpecCache cache;

    @BeforeEach
    void setUp() {
        clock = new Fixtures.MutableClock(Fixtures.NOW);
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        cache = new SearchSpecCache(new JpaSearchSpecCacheStorage(repository, objectMapper, clock));
    }

    @AfterEach
    void tearDown() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("Should read back the stored spec for the same version")
    void shouldRoundTrip() {
        SearchSpec spec = Fixtures.searchSpec("user-1", 1);

        StepVerifier.create(cache.set(spec).then(cache.get("user-1", 1)))
                .assertNext(cached -> assertThat(cached).isEqualTo(spec))
                .verifyComplete();

        assertThat(repository.findById(SearchSpecCache.cacheKey("user-1", 1))).isPresent();
    }

    @Test
    @DisplayName("Should keep versions of the same user apart")
    void shouldIsolateVersions() {
        SearchSpec first = Fixtures.searchSpec("user-1", 1);
        SearchSpec second = Fixtures.searchSpec("user-1", 2);

        StepVerifier.create(cache.set(first).then(cache.set(second)).then(cache.get("user-1", 1)))
                .assertNext(cached -> assertThat(cached.profileVersion()).isEqualTo(1))
                .verifyComplete();
        StepVerifier.create(cache.get("user-1", 3))
                .verifyComplete();
        assertThat(repository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should expire an entry stored with a zero time to live and delete its row")
    void shouldExpireZeroTtl() {
        SearchSpecCache shortLived = new SearchSpecCache(
                new JpaSearchSpecCacheStorage(repository, new ObjectMapper().registerModule(new JavaTimeModule()),
                        clock), Duration.ZERO);

        StepVerifier.create(shortLived.set(Fixtures.searchSpec("user-1", 1)).then(shortLived.get("user-1", 1)))
                .verifyComplete();

        assertThat(repository.findById(SearchSpecCache.cacheKey("user-1", 1))).isEmpty();
    }

    @Test
    @DisplayName("Should serve an entry until its time to live has passed")
    void shouldExpireAfterTtl() {
        SearchSpecCache hourly = new SearchSpecCache(
                new JpaSearchSpecCacheStorage(repository, new ObjectMapper().registerModule(new JavaTimeModule()),
                        clock), Duration.ofHours(1));
        hourly.set(Fixtures.searchSpec("user-1", 1)).block();

        clock.advance(Duration.ofMinutes(59));
        StepVerifier.create(hourly.has("user-1", 1))
                .expectNext(true)
                .verifyComplete();

        clock.advance(Duration.ofMinutes(1));
        StepVerifier.create(hourly.has("user-1", 1))
                .expectNext(false)
                .verifyComplete();
    }
}
