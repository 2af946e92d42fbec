package dev.jobmatcher.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigPropertiesTest {

  private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
      .withUserConfiguration(PropertiesConfig.class);

  @EnableConfigurationProperties({AiProperties.class, MatchingProperties.class})
  static class PropertiesConfig {
  }

  @Test
  void shouldBindDefaults() {
    contextRunner.run(context -> {
      assertThat(context).hasNotFailed();
      assertThat(context.getBean(AiProperties.class).getEnrichBatchSize()).isEqualTo(5);
      MatchingProperties matching = context.getBean(MatchingProperties.class);
      assertThat(matching.getEmbedBatchSize()).isEqualTo(100);
      assertThat(matching.getEmbedLimit()).isEqualTo(500);
      assertThat(matching.getShortlistSize()).isEqualTo(50);
      assertThat(matching.getSimilarityThreshold()).isEqualTo(0.2);
      assertThat(matching.getTargets()).isEmpty();
    });
  }

  @Test
  void shouldBindMatchingTargets() {
    contextRunner
        .withPropertyValues("app.matching.targets[0].team-id=team-1", "app.matching.targets[0].user-id=user-1")
        .run(context -> {
          assertThat(context).hasNotFailed();
          MatchingProperties.Target target = context.getBean(MatchingProperties.class).getTargets().get(0);
          assertThat(target.getTeamId()).isEqualTo("team-1");
          assertThat(target.getUserId()).isEqualTo("user-1");
        });
  }

  @Test
  void shouldRejectZeroEnrichBatchSize() {
    contextRunner.withPropertyValues("app.ai.enrich-batch-size=0").run(context -> {
      assertThat(context).hasFailed();
      assertThat(context.getStartupFailure()).hasStackTraceContaining("enrichBatchSize");
    });
  }

  @Test
  void shouldRejectNegativeRankBatchSize() {
    contextRunner.withPropertyValues("app.ai.rank-batch-size=-1").run(context -> {
      assertThat(context).hasFailed();
      assertThat(context.getStartupFailure()).hasStackTraceContaining("rankBatchSize");
    });
  }

  @Test
  void shouldRejectZeroEmbedBatchSize() {
    contextRunner.withPropertyValues("app.matching.embed-batch-size=0").run(context -> {
      assertThat(context).hasFailed();
      assertThat(context.getStartupFailure()).hasStackTraceContaining("embedBatchSize");
    });
  }

  @Test
  void shouldRejectThresholdOutsideCosineRange() {
    contextRunner.withPropertyValues("app.matching.similarity-threshold=1.5")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void shouldRejectTargetWithoutUser() {
    contextRunner.withPropertyValues("app.matching.targets[0].team-id=team-1")
        .run(context -> assertThat(context).hasFailed());
  }
}
