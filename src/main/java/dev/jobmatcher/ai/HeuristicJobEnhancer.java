package dev.jobmatcher.ai;

import dev.jobmatcher.job.BudgetType;
import dev.jobmatcher.job.JobPosting;
import dev.jobmatcher.job.JobPostingService;
import dev.jobmatcher.profile.ContractType;
import dev.jobmatcher.profile.NormalizedPreferences;
import dev.jobmatcher.profile.NormalizedProfile;
import dev.jobmatcher.profile.NormalizedSkill;
import dev.jobmatcher.profile.RemotePreference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic JobEnhancer used when no model provider is configured.
 * Enrichment is keyword based; ranking scores skill overlap, budget, client signals,
 * contract/remote fit and seniority alignment.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "none", matchIfMissing = true)
public class HeuristicJobEnhancer implements JobEnhancer {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    private static final Pattern YEARS_PATTERN = Pattern.compile(
            "(\\d{1,2})\\s*\\+?\\s*(?:-\\s*\\d{1,2}\\s*)?(?:years?|yrs?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?])\\s+");

    private static final List<String> SENIOR_TERMS = List.of("senior", "sr", "lead", "principal", "staff", "architect");
    private static final List<String> JUNIOR_TERMS = List.of("junior", "jr", "entry level", "intern", "graduate");
    private static final List<String> REQUIREMENT_TERMS = List.of("require", "must", "experience", "proficien",
            "knowledge of");
    private static final List<String> NICE_TO_HAVE_TERMS = List.of("nice to have", "bonus", "a plus", "preferred");
    private static final Map<ContractType, List<String>> CONTRACT_TERMS = Map.of(
            ContractType.FREELANCE, List.of("freelance", "freelancer", "gig"),
            ContractType.CONTRACT, List.of("contract", "contractor", "b2b"),
            ContractType.FULL_TIME, List.of("full-time", "full time", "permanent"),
            ContractType.PART_TIME, List.of("part-time", "part time"));

    private static final int SUMMARY_MAX_CHARS = 300;
    private static final double UNKNOWN_BUDGET_SCORE = 50;
    private static final double NO_RATE_EXPECTATION_SCORE = 60;

    public HeuristicJobEnhancer() {
        log.info("AI provider disabled - using heuristic enrichment and ranking");
    }

    @Override
    public Mono<List<BatchEntry<EnrichedJob>>> enrichBatch(List<JobPosting> jobs) {
        return Mono.fromSupplier(() -> jobs.stream()
                .map(job -> BatchEntry.ok(job.getId(), enrich(job)))
                .toList());
    }

    @Override
    public Mono<List<BatchEntry<RankedJob>>> rankBatch(List<JobPosting> jobs, RankingContext context) {
        return Mono.fromSupplier(() -> jobs.stream()
                .map(job -> BatchEntry.ok(job.getId(), rank(job, context)))
                .toList());
    }

    @Override
    public boolean isAiBacked() {
        return false;
    }

    EnrichedJob enrich(JobPosting job) {
        String text = JobPostingService.plainText(job.getDescription());
        String title = job.getTitle() != null ? job.getTitle() : "";
        JobSeniority seniority = detectSeniority(title, text);
        return new EnrichedJob(job.getId(), seniority, summarize(title, text), toMarkdown(title, text));
    }

    RankedJob rank(JobPosting job, RankingContext context) {
        NormalizedProfile profile = context.profile();
        String text = (job.getTitle() + " " + JobPostingService.plainText(job.getDescription())).toLowerCase(Locale.ROOT);

        // 1. Skill overlap, sharpened by tightness
        Set<String> profileSkills = profileSkills(profile);
        List<String> jobSkills = job.getSkills() != null ? job.getSkills() : List.of();
        double overlap;
        if (!jobSkills.isEmpty()) {
            long matched = jobSkills.stream()
                    .filter(skill -> profileSkills.contains(skill.toLowerCase(Locale.ROOT)))
                    .count();
            overlap = (double) matched / jobSkills.size();
        } else {
            long mentioned = profileSkills.stream().filter(skill -> containsWord(text, skill)).count();
            overlap = Math.min(1.0, mentioned / 5.0);
        }
        double skillMatch = 100 * Math.pow(overlap, Math.max(1, context.tightness()) / 3.0);

        // 2. Budget against rate expectations
        double budgetFit = budgetFit(job, profile.preferences());

        // 3. Client signals
        double clientQuality = clientQuality(job);

        // 4. Contract type and remote fit
        double scopeFit = scopeFit(text, profile.preferences());

        // 5. Seniority alignment
        JobSeniority required = detectSeniority(job.getTitle() != null ? job.getTitle() : "", text);
        double winProbability = winProbability(required, toJobSeniority(profile));

        ScoreBreakdown breakdown = new ScoreBreakdown(round(skillMatch), round(budgetFit), round(clientQuality),
                round(scopeFit), round(winProbability));
        String reasoning = String.format("Skill overlap %.0f%%, budget fit %.0f, client quality %.0f; role asks for %s level.",
                overlap * 100, breakdown.budgetFit(), breakdown.clientQuality(), required.getWireName());

        log.debug("Job '{}' heuristically scored {}", job.getTitle(), breakdown.overall());
        return new RankedJob(job.getId(), breakdown, reasoning);
    }

    JobSeniority detectSeniority(String title, String text) {
        Matcher matcher = YEARS_PATTERN.matcher(text);
        if (matcher.find()) {
            return JobSeniority.fromYears(Integer.parseInt(matcher.group(1)));
        }
        String lowerTitle = title.toLowerCase(Locale.ROOT);
        if (SENIOR_TERMS.stream().anyMatch(term -> containsWord(lowerTitle, term))) {
            return JobSeniority.SENIOR;
        }
        if (JUNIOR_TERMS.stream().anyMatch(term -> containsWord(lowerTitle, term))) {
            return JobSeniority.JUNIOR;
        }
        return JobSeniority.MID;
    }

    private String summarize(String title, String text) {
        String[] sentences = SENTENCE_SPLIT.split(text.trim());
        StringBuilder summary = new StringBuilder();
        for (int i = 0; i < Math.min(2, sentences.length); i++) {
            if (!sentences[i].isBlank()) {
                summary.append(summary.length() > 0 ? " " : "").append(sentences[i].trim());
            }
        }
        if (summary.length() == 0) {
            return title.isBlank() ? "No description provided." : title + ".";
        }
        return summary.length() > SUMMARY_MAX_CHARS ? summary.substring(0, SUMMARY_MAX_CHARS) + "..." : summary.toString();
    }

    private String toMarkdown(String title, String text) {
        List<String> responsibilities = new ArrayList<>();
        List<String> requirements = new ArrayList<>();
        List<String> niceToHave = new ArrayList<>();
        for (String sentence : SENTENCE_SPLIT.split(text.trim())) {
            String trimmed = sentence.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String lower = trimmed.toLowerCase(Locale.ROOT);
            if (NICE_TO_HAVE_TERMS.stream().anyMatch(lower::contains)) {
                niceToHave.add(trimmed);
            } else if (REQUIREMENT_TERMS.stream().anyMatch(lower::contains)) {
                requirements.add(trimmed);
            } else {
                responsibilities.add(trimmed);
            }
        }

        StringBuilder md = new StringBuilder();
        md.append("## Role\n\n").append(title.isBlank() ? "Untitled role" : title).append('\n');
        appendSection(md, "Responsibilities", responsibilities);
        appendSection(md, "Requirements", requirements);
        appendSection(md, "Nice to Have", niceToHave);
        return md.toString();
    }

    private void appendSection(StringBuilder md, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        md.append("\n## ").append(heading).append("\n\n");
        items.forEach(item -> md.append("- ").append(item).append('\n'));
    }

    private Set<String> profileSkills(NormalizedProfile profile) {
        Set<String> skills = new LinkedHashSet<>();
        profile.skillKeywords().forEach(keyword -> skills.add(keyword.toLowerCase(Locale.ROOT)));
        for (NormalizedSkill skill : profile.primarySkills()) {
            addSkill(skills, skill);
        }
        for (NormalizedSkill skill : profile.secondarySkills()) {
            addSkill(skills, skill);
        }
        return skills;
    }

    private void addSkill(Set<String> skills, NormalizedSkill skill) {
        if (skill.canonicalName() != null) {
            skills.add(skill.canonicalName().toLowerCase(Locale.ROOT));
        }
        if (skill.displayName() != null) {
            skills.add(skill.displayName().toLowerCase(Locale.ROOT));
        }
    }

    private double budgetFit(JobPosting job, NormalizedPreferences preferences) {
        if (job.getBudgetType() == BudgetType.HOURLY) {
            BigDecimal offered = job.getHourlyMax() != null ? job.getHourlyMax() : job.getHourlyMin();
            Double expected = preferences.hourlyRate() != null ? preferences.hourlyRate().min() : null;
            return ratioScore(offered, expected);
        }
        if (job.getBudgetType() == BudgetType.FIXED) {
            BigDecimal offered = job.getFixedBudgetMax() != null ? job.getFixedBudgetMax() : job.getFixedBudgetMin();
            Double expected = preferences.fixedBudget() != null ? preferences.fixedBudget().min() : null;
            return ratioScore(offered, expected);
        }
        return UNKNOWN_BUDGET_SCORE;
    }

    private double ratioScore(BigDecimal offered, Double expected) {
        if (offered == null) {
            return UNKNOWN_BUDGET_SCORE;
        }
        if (expected == null || expected <= 0) {
            return NO_RATE_EXPECTATION_SCORE;
        }
        double ratio = offered.doubleValue() / expected;
        return ratio >= 1 ? 100 : Math.max(0, ratio * 100);
    }

    private double clientQuality(JobPosting job) {
        double score = job.getClientRating() != null
                ? Math.min(5, Math.max(0, job.getClientRating().doubleValue())) / 5 * 60
                : 30;
        if (Boolean.TRUE.equals(job.getClientPaymentVerified())) {
            score += 20;
        }
        if (job.getClientHires() != null) {
            score += Math.min(job.getClientHires(), 10) * 2;
        }
        return Math.min(100, score);
    }

    private double scopeFit(String text, NormalizedPreferences preferences) {
        double score = 50;
        boolean contractMatch = preferences.contractType().toContractTypes().stream()
                .flatMap(type -> CONTRACT_TERMS.get(type).stream())
                .anyMatch(term -> containsWord(text, term));
        if (contractMatch) {
            score += 30;
        }
        RemotePreference remote = preferences.remotePreference();
        boolean mentionsRemote = containsWord(text, "remote");
        if (remote == RemotePreference.FLEXIBLE
                || (remote == RemotePreference.REMOTE_ONLY && mentionsRemote)
                || (remote != RemotePreference.REMOTE_ONLY && !mentionsRemote)) {
            score += 20;
        }
        return score;
    }

    private double winProbability(JobSeniority required, JobSeniority candidate) {
        int difference = candidate.ordinal() - required.ordinal();
        if (difference == 0) {
            return 80;
        }
        if (difference > 0) {
            return 65;
        }
        return difference == -1 ? 40 : 20;
    }

    private JobSeniority toJobSeniority(NormalizedProfile profile) {
        return switch (profile.inferredSeniority()) {
            case ENTRY, JUNIOR -> JobSeniority.JUNIOR;
            case MID -> JobSeniority.MID;
            case SENIOR, LEAD, PRINCIPAL -> JobSeniority.SENIOR;
        };
    }

    private double round(double value) {
        return Math.round(value * 100) / 100.0;
    }

    /**
     * Check if text contains a word with word boundaries.
     */
    private boolean containsWord(String text, String word) {
        if (text == null || word == null || word.isBlank()) {
            return false;
        }
        String regex = "\\b" + Pattern.quote(word.toLowerCase(Locale.ROOT)) + "\\b";
        Pattern pattern = PATTERN_CACHE.computeIfAbsent(regex, k -> Pattern.compile(k, Pattern.CASE_INSENSITIVE));
        return pattern.matcher(text).find();
    }
}
