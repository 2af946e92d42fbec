package dev.jobmatcher.ai;

/**
 * Five ranking sub-scores, each in [0, 100].
 */
public record ScoreBreakdown(double skillMatch, double budgetFit, double clientQuality, double scopeFit,
        double winProbability) {

    public static final double SKILL_MATCH_WEIGHT = 0.30;
    public static final double BUDGET_FIT_WEIGHT = 0.25;
    public static final double CLIENT_QUALITY_WEIGHT = 0.15;
    public static final double SCOPE_FIT_WEIGHT = 0.15;
    public static final double WIN_PROBABILITY_WEIGHT = 0.15;

    public ScoreBreakdown {
        requireInRange("skill_match", skillMatch);
        requireInRange("budget_fit", budgetFit);
        requireInRange("client_quality", clientQuality);
        requireInRange("scope_fit", scopeFit);
        requireInRange("win_probability", winProbability);
    }

    /**
     * Weighted overall score. Always derived, never taken from generated output.
     */
    public double overall() {
        return skillMatch * SKILL_MATCH_WEIGHT
                + budgetFit * BUDGET_FIT_WEIGHT
                + clientQuality * CLIENT_QUALITY_WEIGHT
                + scopeFit * SCOPE_FIT_WEIGHT
                + winProbability * WIN_PROBABILITY_WEIGHT;
    }

    private static void requireInRange(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            throw new IllegalArgumentException(name + " must be between 0 and 100 but was " + value);
        }
    }
}
