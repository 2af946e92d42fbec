package dev.jobmatcher.cache;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Row of the relational cache backend. The value is the serialized search spec.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "search_spec_cache", indexes = {
        @Index(name = "idx_search_spec_cache_expires", columnList = "expiresAt")
})
public class CachedSearchSpec {

    @Id
    @Column(name = "cache_key", length = 300)
    private String cacheKey;

    @Column(nullable = false, length = 65535)
    private String payload;

    private Instant expiresAt;

    @Column(nullable = false)
    private Instant storedAt;
}
