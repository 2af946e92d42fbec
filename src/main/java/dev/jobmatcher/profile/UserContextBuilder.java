package dev.jobmatcher.profile;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Renders a normalized profile as the plain-text candidate context used by ranking and
 * embedding.
 */
@Component
public class UserContextBuilder {

    static final int MAX_EXPERIENCES = 5;

    public String build(NormalizedProfile profile) {
        List<String> lines = new ArrayList<>();

        if (profile.displayName() != null && !profile.displayName().isBlank()) {
            lines.add("Name: " + profile.displayName());
        }
        if (profile.headline() != null && !profile.headline().isBlank()) {
            lines.add("Headline: " + profile.headline());
        }

        String skills = Stream.concat(profile.primarySkills().stream(), profile.secondarySkills().stream())
                .map(this::formatSkill)
                .collect(Collectors.joining(", "));
        if (!skills.isEmpty()) {
            lines.add("Skills: " + skills);
        }

        String experience = profile.experiences().stream()
                .limit(MAX_EXPERIENCES)
                .map(exp -> exp.company() != null ? exp.title() + " at " + exp.company() : exp.title())
                .collect(Collectors.joining("; "));
        if (!experience.isEmpty()) {
            lines.add("Experience: " + experience);
        }

        lines.add("Seniority: " + profile.inferredSeniority().getWireName());

        NormalizedPreferences.RateRange rate = profile.preferences().hourlyRate();
        if (rate != null && (rate.min() != null || rate.max() != null)) {
            String currency = rate.currency() != null ? rate.currency() : "USD";
            lines.add(String.format("Rate: %s %s-%s/hr", currency, formatAmount(rate.min()), formatAmount(rate.max())));
        }

        return String.join("\n", lines);
    }

    private String formatSkill(NormalizedSkill skill) {
        String name = skill.displayName() != null ? skill.displayName() : skill.canonicalName();
        if (skill.years() == null) {
            return name;
        }
        return String.format("%s (%sy)", name, formatAmount(skill.years()));
    }

    private String formatAmount(Double value) {
        if (value == null) {
            return "?";
        }
        return value == Math.floor(value) ? String.valueOf(value.longValue()) : String.valueOf(value);
    }
}
