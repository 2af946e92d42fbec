package dev.jobmatcher.profile;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatcher.config.ProfileSourceProperties;
import dev.jobmatcher.exception.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Reads normalized profiles from a JSON file (an array of profiles) for local runs.
 * The file is re-read on every call so edits are picked up without a restart.
 */
@Slf4j
@Component
public class JsonFileNormalizedProfileSource implements NormalizedProfileSource {

  private static final TypeReference<List<NormalizedProfile>> PROFILE_LIST = new TypeReference<>() {
  };

  private final ObjectMapper objectMapper;
  private final ProfileSourceProperties properties;

  public JsonFileNormalizedProfileSource(ObjectMapper objectMapper, ProfileSourceProperties properties) {
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public Mono<NormalizedProfile> load(String teamId, String userId) {
    return Mono.fromCallable(() -> readAll().stream()
        .filter(profile -> userId.equals(profile.userId()))
        .filter(profile -> teamId == null || profile.teamId() == null || teamId.equals(profile.teamId()))
        .findFirst()
        .orElseThrow(() -> new EntityNotFoundException("Normalized profile", userId)))
        .subscribeOn(Schedulers.boundedElastic());
  }

  List<NormalizedProfile> readAll() {
    File file = new File(properties.getFile());
    if (!file.exists()) {
      log.warn("{} not found. No normalized profiles available.", properties.getFile());
      return List.of();
    }

    try {
      List<NormalizedProfile> profiles = objectMapper.readValue(file, PROFILE_LIST);
      log.debug("Loaded {} normalized profiles from {}", profiles.size(), properties.getFile());
      return profiles;
    } catch (IOException e) {
      log.error("Failed to load {}. Ensure it matches the normalized profile structure.", properties.getFile(), e);
      throw new IllegalStateException("Could not load normalized profiles", e);
    }
  }
}
