package dev.jobmatcher.ai;

import com.fasterxml.jackson.databind.JsonNode;
import dev.jobmatcher.config.AiProperties;
import dev.jobmatcher.exception.InvalidGenerationOutputException;
import dev.jobmatcher.job.JobPosting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Implementation of JobEnhancer backed by OpenAI structured output.
 * One call per batch; the answer is parsed entry by entry so a single bad entry can be
 * reported without discarding its neighbours.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "openai")
public class OpenAiJobEnhancer implements JobEnhancer {

  private static final double REPORTED_SCORE_TOLERANCE = 1.0;

  private final StructuredGenerationClient generationClient;
  private final GenerationSchemas schemas;
  private final String model;

  public OpenAiJobEnhancer(StructuredGenerationClient generationClient, GenerationSchemas schemas,
      AiProperties properties) {
    this.generationClient = generationClient;
    this.schemas = schemas;
    this.model = properties.getOpenai().getModel();
    log.info("OpenAI job enrichment and ranking enabled with model: {}", model);
  }

  @Override
  public Mono<List<BatchEntry<EnrichedJob>>> enrichBatch(List<JobPosting> jobs) {
    if (jobs.isEmpty()) {
      return Mono.just(List.of());
    }
    log.info("OpenAI enriching batch of {} jobs...", jobs.size());

    GenerationRequest request = new GenerationRequest("enrich", model, JobPrompts.ENRICH_INSTRUCTIONS,
        JobPrompts.enrichInput(jobs), "output", schemas.enrichBatch());
    return generationClient.generate(request).map(this::parseEnrichment);
  }

  @Override
  public Mono<List<BatchEntry<RankedJob>>> rankBatch(List<JobPosting> jobs, RankingContext context) {
    if (jobs.isEmpty()) {
      return Mono.just(List.of());
    }
    log.info("OpenAI ranking batch of {} jobs (tightness {})...", jobs.size(), context.tightness());

    GenerationRequest request = new GenerationRequest("rank", model, JobPrompts.RANK_INSTRUCTIONS,
        JobPrompts.rankInput(jobs, context.userContext()), "output", schemas.rankBatch());
    return generationClient.generate(request).map(this::parseRanking);
  }

  @Override
  public boolean isAiBacked() {
    return true;
  }

  List<BatchEntry<EnrichedJob>> parseEnrichment(JsonNode output) {
    List<BatchEntry<EnrichedJob>> entries = new ArrayList<>();
    for (JsonNode node : requireJobsArray("enrich", output)) {
      String id = text(node, "id");
      if (id == null) {
        entries.add(BatchEntry.malformed(null, "id missing"));
        continue;
      }
      try {
        EnrichedJob enriched = new EnrichedJob(id,
            JobSeniority.fromWire(requireText(node, "ai_seniority")),
            requireText(node, "ai_summary"),
            requireText(node, "description_md"));
        entries.add(BatchEntry.ok(id, enriched));
      } catch (IllegalArgumentException e) {
        entries.add(BatchEntry.malformed(id, e.getMessage()));
      }
    }
    return entries;
  }

  List<BatchEntry<RankedJob>> parseRanking(JsonNode output) {
    List<BatchEntry<RankedJob>> entries = new ArrayList<>();
    for (JsonNode node : requireJobsArray("rank", output)) {
      String id = text(node, "id");
      if (id == null) {
        entries.add(BatchEntry.malformed(null, "id missing"));
        continue;
      }
      try {
        JsonNode breakdown = node.get("breakdown");
        if (breakdown == null || !breakdown.isObject()) {
          throw new IllegalArgumentException("breakdown missing");
        }
        RankedJob ranked = new RankedJob(id, new ScoreBreakdown(
            requireNumber(breakdown, "skill_match"),
            requireNumber(breakdown, "budget_fit"),
            requireNumber(breakdown, "client_quality"),
            requireNumber(breakdown, "scope_fit"),
            requireNumber(breakdown, "win_probability")),
            text(node, "reasoning"));
        logScoreDrift(node, ranked);
        entries.add(BatchEntry.ok(id, ranked));
      } catch (IllegalArgumentException e) {
        entries.add(BatchEntry.malformed(id, e.getMessage()));
      }
    }
    return entries;
  }

  private void logScoreDrift(JsonNode node, RankedJob ranked) {
    JsonNode reported = node.get("score");
    if (reported != null && reported.isNumber()
        && Math.abs(reported.asDouble() - ranked.score()) > REPORTED_SCORE_TOLERANCE) {
      log.debug("Job {} reported score {} but breakdown gives {}; using breakdown",
          ranked.jobId(), reported.asDouble(), ranked.score());
    }
  }

  private JsonNode requireJobsArray(String operation, JsonNode output) {
    JsonNode jobs = output != null ? output.get("jobs") : null;
    if (jobs == null || !jobs.isArray()) {
      throw new InvalidGenerationOutputException(operation + " output has no jobs array", List.of("jobs: missing"));
    }
    return jobs;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.isTextual() ? value.asText() : null;
  }

  private static String requireText(JsonNode node, String field) {
    String value = text(node, field);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " missing");
    }
    return value;
  }

  private static double requireNumber(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isNumber()) {
      throw new IllegalArgumentException(field + " missing or not a number");
    }
    return value.asDouble();
  }
}
