package dev.jobmatcher.spec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.jobmatcher.exception.InvalidGenerationOutputException;
import dev.jobmatcher.profile.RemotePreference;
import dev.jobmatcher.profile.SeniorityLevel;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchSpecValidatorTest {

    private static final String VALID = """
            {
              "title_keywords": [{"keyword": "Backend Engineer", "weight": 10}],
              "skill_keywords": [{"keyword": "java", "weight": 9}],
              "negative_keywords": ["unpaid"],
              "locations": [{"country_code": "BR", "city": null, "region": null}],
              "seniority_levels": ["senior", "lead"],
              "remote_preference": "remote_only",
              "contract_types": ["freelance"],
              "hourly_min": 50,
              "hourly_max": 90,
              "fixed_budget_min": null
            }
            """;

    private ObjectMapper objectMapper;
    private SearchSpecValidator validator;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        validator = new SearchSpecValidator(objectMapper,
                Validation.buildDefaultValidatorFactory().getValidator());
    }

    private ObjectNode valid() throws Exception {
        return (ObjectNode) objectMapper.readTree(VALID);
    }

    @Test
    @DisplayName("Should bind well-formed output")
    void shouldBindValidOutput() throws Exception {
        SearchSpecDraft draft = validator.parse(valid());

        assertThat(draft.titleKeywords()).extracting(WeightedKeyword::keyword).containsExactly("Backend Engineer");
        assertThat(draft.seniorityLevels()).containsExactly(SeniorityLevel.SENIOR, SeniorityLevel.LEAD);
        assertThat(draft.remotePreference()).isEqualTo(RemotePreference.REMOTE_ONLY);
        assertThat(draft.hourlyMax()).isEqualTo(90.0);
        assertThat(draft.fixedBudgetMin()).isNull();
    }

    @Nested
    @DisplayName("Schema violations")
    class SchemaViolationTests {

        @Test
        @DisplayName("Should reject unknown properties")
        void shouldRejectUnknownProperty() throws Exception {
            JsonNode raw = valid().put("salary", 100);

            assertThatThrownBy(() -> validator.parse(raw))
                    .isInstanceOf(InvalidGenerationOutputException.class)
                    .satisfies(e -> assertThat(((InvalidGenerationOutputException) e).getViolations()).hasSize(1));
        }

        @Test
        @DisplayName("Should reject unknown enum values")
        void shouldRejectUnknownEnum() throws Exception {
            JsonNode raw = valid().put("remote_preference", "sometimes");

            assertThatThrownBy(() -> validator.parse(raw)).isInstanceOf(InvalidGenerationOutputException.class);
        }

        @Test
        @DisplayName("Should reject missing properties")
        void shouldRejectMissingProperty() throws Exception {
            ObjectNode raw = valid();
            raw.remove("hourly_min");

            assertThatThrownBy(() -> validator.parse(raw)).isInstanceOf(InvalidGenerationOutputException.class);
        }
    }

    @Nested
    @DisplayName("Bounds")
    class BoundsTests {

        @Test
        @DisplayName("Should reject an empty title list")
        void shouldRejectEmptyTitles() throws Exception {
            ObjectNode raw = valid();
            raw.putArray("title_keywords");

            assertThatThrownBy(() -> validator.parse(raw))
                    .isInstanceOf(InvalidGenerationOutputException.class)
                    .satisfies(e -> assertThat(((InvalidGenerationOutputException) e).getViolations())
                            .anyMatch(v -> v.startsWith("titleKeywords")));
        }

        @Test
        @DisplayName("Should reject keyword weights outside 1..10")
        void shouldRejectWeightOutOfRange() throws Exception {
            ObjectNode raw = valid();
            raw.putArray("skill_keywords").addObject().put("keyword", "java").put("weight", 11);

            assertThatThrownBy(() -> validator.parse(raw))
                    .isInstanceOf(InvalidGenerationOutputException.class)
                    .satisfies(e -> assertThat(((InvalidGenerationOutputException) e).getViolations())
                            .anyMatch(v -> v.contains("weight")));
        }

        @Test
        @DisplayName("Should reject negative rates")
        void shouldRejectNegativeRate() throws Exception {
            JsonNode raw = valid().put("hourly_min", -1);

            assertThatThrownBy(() -> validator.parse(raw)).isInstanceOf(InvalidGenerationOutputException.class);
        }

        @Test
        @DisplayName("Should reject malformed country codes")
        void shouldRejectCountryCode() throws Exception {
            ObjectNode raw = valid();
            raw.putArray("locations").addObject().put("country_code", "BRA").putNull("city").putNull("region");

            assertThatThrownBy(() -> validator.parse(raw)).isInstanceOf(InvalidGenerationOutputException.class);
        }

        @Test
        @DisplayName("Should reject a one-letter country code with a field path")
        void shouldRejectShortCountryCode() throws Exception {
            ObjectNode raw = valid();
            raw.putArray("locations").addObject().put("country_code", "B").putNull("city").putNull("region");

            assertThatThrownBy(() -> validator.parse(raw))
                    .isInstanceOfSatisfying(InvalidGenerationOutputException.class, e -> assertThat(e.getViolations())
                            .anyMatch(violation -> violation.startsWith("locations[0].countryCode")));
        }
    }
}
