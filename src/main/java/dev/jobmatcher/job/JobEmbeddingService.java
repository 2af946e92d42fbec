package dev.jobmatcher.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatcher.ai.EmbeddingClient;
import dev.jobmatcher.config.MatchingProperties;
import dev.jobmatcher.exception.InvalidGenerationOutputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Embeds postings in batches so they can be shortlisted by similarity to a profile.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobEmbeddingService {

    static final int DESCRIPTION_LIMIT = 2000;
    private static final int PREVIEW_LIMIT = 200;

    private final EmbeddingClient embeddingClient;
    private final JobEmbeddingRepository embeddingRepository;
    private final JobPostingRepository jobPostingRepository;
    private final MatchingProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Embeds the team's postings that have no embedding under the current model, up to the
     * configured limit.
     *
     * @return number of postings embedded
     */
    public Mono<Integer> embedPending(String teamId) {
        String model = embeddingClient.modelName();
        return Mono.fromCallable(() -> jobPostingRepository.findPendingEmbedding(teamId, model,
                        PageRequest.of(0, properties.getEmbedLimit())))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(pending -> log.info("Found {} jobs without a {} embedding for team {}", pending.size(),
                        model, teamId))
                .flatMap(this::embed);
    }

    /**
     * Embeds the given postings. A failed batch fails the call; earlier batches stay stored.
     */
    public Mono<Integer> embed(List<JobPosting> jobs) {
        if (jobs.isEmpty()) {
            return Mono.just(0);
        }
        int batchSize = properties.getEmbedBatchSize();
        if (batchSize < 1) {
            return Mono.error(new IllegalArgumentException("Batch size must be positive but was " + batchSize));
        }
        List<List<JobPosting>> batches = new ArrayList<>();
        for (int i = 0; i < jobs.size(); i += batchSize) {
            batches.add(jobs.subList(i, Math.min(i + batchSize, jobs.size())));
        }

        return Flux.fromIterable(batches)
                .concatMap(this::embedBatch)
                .reduce(0, Integer::sum)
                .doOnNext(count -> log.info("Embedded {}/{} jobs", count, jobs.size()));
    }

    private Mono<Integer> embedBatch(List<JobPosting> batch) {
        List<String> texts = batch.stream().map(JobEmbeddingService::embeddingText).toList();
        return embeddingClient.embedAll(texts)
                .flatMap(vectors -> Mono.fromCallable(() -> store(batch, texts, vectors))
                        .subscribeOn(Schedulers.boundedElastic()));
    }

    private int store(List<JobPosting> batch, List<String> texts, List<List<Double>> vectors) {
        if (vectors.size() != batch.size()) {
            throw new InvalidGenerationOutputException("Got " + vectors.size() + " embeddings for "
                    + batch.size() + " jobs", List.of("embeddings: expected " + batch.size()));
        }
        String model = embeddingClient.modelName();
        List<JobEmbedding> rows = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            JobPosting job = batch.get(i);
            if (embeddingRepository.existsByJobIdAndModel(job.getId(), model)) {
                log.debug("Job {} already embedded with {}", job.getId(), model);
                continue;
            }
            String text = texts.get(i);
            rows.add(JobEmbedding.builder()
                    .jobId(job.getId())
                    .teamId(job.getTeamId())
                    .model(model)
                    .dimensions(vectors.get(i).size())
                    .vector(writeVector(vectors.get(i)))
                    .sourceTextHash(sha256(text))
                    .sourceTextPreview(text.length() > PREVIEW_LIMIT ? text.substring(0, PREVIEW_LIMIT) : text)
                    .createdAt(clock.instant())
                    .build());
        }
        embeddingRepository.saveAll(rows);
        return batch.size();
    }

    /**
     * Title and the start of the description, separated by a newline.
     */
    static String embeddingText(JobPosting job) {
        String description = job.getDescription() != null ? job.getDescription() : "";
        if (description.length() > DESCRIPTION_LIMIT) {
            description = description.substring(0, DESCRIPTION_LIMIT);
        }
        return job.getTitle() + "\n" + description;
    }

    private String writeVector(List<Double> vector) {
        try {
            return objectMapper.writeValueAsString(vector);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize embedding vector", e);
        }
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
