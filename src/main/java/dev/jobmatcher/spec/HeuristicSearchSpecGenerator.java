package dev.jobmatcher.spec;

import dev.jobmatcher.profile.NormalizedExperience;
import dev.jobmatcher.profile.NormalizedPreferences;
import dev.jobmatcher.profile.NormalizedProfile;
import dev.jobmatcher.profile.NormalizedSkill;
import dev.jobmatcher.profile.SeniorityLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives a search spec draft directly from the profile when no model provider is configured.
 * The result goes through the same validator as generated output.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "none", matchIfMissing = true)
public class HeuristicSearchSpecGenerator implements SearchSpecGenerator {

    static final int MAX_TITLE_KEYWORDS = 8;
    static final int MAX_SKILL_KEYWORDS = 15;
    static final String FALLBACK_TITLE = "Software Developer";
    static final List<String> DEFAULT_NEGATIVE_KEYWORDS = List.of("unpaid", "volunteer", "equity only");

    private final SearchSpecValidator validator;

    @Override
    public Mono<SearchSpecDraft> generate(NormalizedProfile profile) {
        return Mono.fromCallable(() -> validator.validate(draftFor(profile)));
    }

    SearchSpecDraft draftFor(NormalizedProfile profile) {
        NormalizedPreferences preferences = profile.preferences();
        NormalizedPreferences.RateRange rate = preferences.hourlyRate();
        NormalizedPreferences.BudgetFloor budget = preferences.fixedBudget();

        SearchSpecDraft draft = new SearchSpecDraft(
                titleKeywords(profile),
                skillKeywords(profile),
                negativeKeywords(profile.inferredSeniority()),
                List.of(),
                seniorityLevels(profile.inferredSeniority()),
                preferences.remotePreference(),
                preferences.contractType().toContractTypes(),
                rate != null ? rate.min() : null,
                rate != null ? rate.max() : null,
                budget != null ? budget.min() : null);
        log.debug("Heuristic search spec for user {} v{}: {} titles, {} skills", profile.userId(),
                profile.profileVersion(), draft.titleKeywords().size(), draft.skillKeywords().size());
        return draft;
    }

    private List<WeightedKeyword> titleKeywords(NormalizedProfile profile) {
        Map<String, Integer> titles = new LinkedHashMap<>();
        for (NormalizedExperience experience : profile.experiences()) {
            if (experience.title() != null && !experience.title().isBlank()) {
                titles.putIfAbsent(experience.title().trim(), experience.current() ? 10 : 8);
            }
        }
        for (String keyword : profile.titleKeywords()) {
            titles.putIfAbsent(keyword.trim(), 7);
        }
        if (titles.isEmpty()) {
            titles.put(FALLBACK_TITLE, 5);
        }
        return titles.entrySet().stream()
                .filter(entry -> !entry.getKey().isEmpty())
                .limit(MAX_TITLE_KEYWORDS)
                .map(entry -> new WeightedKeyword(truncate(entry.getKey()), entry.getValue()))
                .toList();
    }

    private List<WeightedKeyword> skillKeywords(NormalizedProfile profile) {
        Map<String, Integer> skills = new LinkedHashMap<>();
        for (NormalizedSkill skill : profile.primarySkills()) {
            skills.putIfAbsent(skillName(skill), Math.min(10, 6 + skill.level()));
        }
        for (NormalizedSkill skill : profile.secondarySkills()) {
            skills.putIfAbsent(skillName(skill), Math.min(6, 3 + skill.level()));
        }
        for (String keyword : profile.skillKeywords()) {
            skills.putIfAbsent(keyword, 4);
        }
        if (skills.isEmpty()) {
            // A spec needs at least one skill keyword; fall back to the title wording.
            skills.put(titleKeywords(profile).get(0).keyword().toLowerCase(Locale.ROOT), 5);
        }
        return skills.entrySet().stream()
                .filter(entry -> entry.getKey() != null && !entry.getKey().isBlank())
                .limit(MAX_SKILL_KEYWORDS)
                .map(entry -> new WeightedKeyword(truncate(entry.getKey()), Math.max(1, entry.getValue())))
                .toList();
    }

    private List<String> negativeKeywords(SeniorityLevel seniority) {
        List<String> negatives = new ArrayList<>(DEFAULT_NEGATIVE_KEYWORDS);
        if (seniority != SeniorityLevel.ENTRY) {
            negatives.add("internship");
        }
        return negatives;
    }

    private List<SeniorityLevel> seniorityLevels(SeniorityLevel inferred) {
        List<SeniorityLevel> levels = new ArrayList<>();
        if (inferred == SeniorityLevel.ENTRY || inferred == SeniorityLevel.JUNIOR) {
            levels.add(inferred.below());
        }
        levels.add(inferred);
        if (inferred.ordinal() >= SeniorityLevel.SENIOR.ordinal()) {
            levels.add(inferred.above());
        }
        return levels.stream().distinct().toList();
    }

    private String skillName(NormalizedSkill skill) {
        return skill.displayName() != null ? skill.displayName() : skill.canonicalName();
    }

    private String truncate(String value) {
        return value.length() > 100 ? value.substring(0, 100) : value;
    }
}
