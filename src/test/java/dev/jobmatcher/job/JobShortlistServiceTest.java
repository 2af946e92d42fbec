package dev.jobmatcher.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatcher.Fixtures;
import dev.jobmatcher.config.MatchingProperties;
import dev.jobmatcher.profile.ProfileEmbedding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobShortlistServiceTest {

    private static final String MODEL = "embed-test";

    @Mock
    private JobEmbeddingRepository embeddingRepository;

    private MatchingProperties properties;
    private JobShortlistService service;

    @BeforeEach
    void setUp() {
        properties = new MatchingProperties();
        service = new JobShortlistService(embeddingRepository, properties, new ObjectMapper());
    }

    private static ProfileEmbedding profileEmbedding(String vector) {
        return ProfileEmbedding.builder()
                .teamId(Fixtures.TEAM_ID)
                .userId("user-1")
                .profileVersion(1)
                .model(MODEL)
                .dimensions(2)
                .vector(vector)
                .createdAt(Fixtures.NOW)
                .build();
    }

    private static JobEmbedding jobEmbedding(String jobId, String vector, int dimensions) {
        return JobEmbedding.builder()
                .jobId(jobId)
                .teamId(Fixtures.TEAM_ID)
                .model(MODEL)
                .dimensions(dimensions)
                .vector(vector)
                .sourceTextHash("0".repeat(64))
                .sourceTextPreview(jobId)
                .createdAt(Fixtures.NOW)
                .build();
    }

    @Test
    @DisplayName("Should keep postings above the threshold, most similar first")
    void shouldRankBySimilarity() {
        when(embeddingRepository.findByTeamIdAndModel(Fixtures.TEAM_ID, MODEL)).thenReturn(List.of(
                jobEmbedding("job-close", "[0.8, 0.6]", 2),
                jobEmbedding("job-exact", "[1.0, 0.0]", 2),
                jobEmbedding("job-orthogonal", "[0.0, 1.0]", 2),
                jobEmbedding("job-opposite", "[-1.0, 0.0]", 2)));

        StepVerifier.create(service.shortlist(Fixtures.TEAM_ID, profileEmbedding("[1.0, 0.0]")))
                .assertNext(matches -> {
                    assertThat(matches).extracting(JobMatch::jobId).containsExactly("job-exact", "job-close");
                    assertThat(matches.get(1).similarity()).isCloseTo(0.8, within(1e-9));
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should exclude a posting exactly at the threshold")
    void shouldExcludeThresholdSimilarity() {
        properties.setSimilarityThreshold(0.0);
        when(embeddingRepository.findByTeamIdAndModel(Fixtures.TEAM_ID, MODEL)).thenReturn(List.of(
                jobEmbedding("job-at-threshold", "[0.0, 1.0]", 2),
                jobEmbedding("job-above", "[0.1, 1.0]", 2)));

        StepVerifier.create(service.shortlist(Fixtures.TEAM_ID, profileEmbedding("[1.0, 0.0]")))
                .assertNext(matches -> assertThat(matches).extracting(JobMatch::jobId).containsExactly("job-above"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should cap the shortlist size")
    void shouldCapShortlist() {
        properties.setShortlistSize(2);
        when(embeddingRepository.findByTeamIdAndModel(Fixtures.TEAM_ID, MODEL)).thenReturn(List.of(
                jobEmbedding("job-a", "[0.9, 0.1]", 2),
                jobEmbedding("job-b", "[0.8, 0.2]", 2),
                jobEmbedding("job-c", "[1.0, 0.0]", 2)));

        StepVerifier.create(service.shortlist(Fixtures.TEAM_ID, profileEmbedding("[1.0, 0.0]")))
                .assertNext(matches -> assertThat(matches).extracting(JobMatch::jobId)
                        .containsExactly("job-c", "job-a"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should skip embeddings whose dimensions differ from the profile")
    void shouldSkipDimensionMismatch() {
        when(embeddingRepository.findByTeamIdAndModel(Fixtures.TEAM_ID, MODEL)).thenReturn(List.of(
                jobEmbedding("job-3d", "[1.0, 0.0, 0.0]", 3),
                jobEmbedding("job-2d", "[1.0, 0.0]", 2)));

        StepVerifier.create(service.shortlist(Fixtures.TEAM_ID, profileEmbedding("[1.0, 0.0]")))
                .assertNext(matches -> assertThat(matches).extracting(JobMatch::jobId).containsExactly("job-2d"))
                .verifyComplete();
    }
}
