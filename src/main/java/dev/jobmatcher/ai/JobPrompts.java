package dev.jobmatcher.ai;

import dev.jobmatcher.job.BudgetType;
import dev.jobmatcher.job.JobPosting;
import dev.jobmatcher.job.JobPostingService;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Fixed instructions and input formatting for enrichment and ranking calls.
 */
final class JobPrompts {

  static final int MAX_DESCRIPTION_CHARS = 4000;

  static final String ENRICH_INSTRUCTIONS = """
      You enrich job postings. For each job:

      1. ai_seniority: "junior", "mid" or "senior".
         - Years of experience required: 0-2 junior, 3-5 mid, 6 or more senior.
         - Consider skill complexity, leadership expectations and budget.
         - If unclear, use "mid".
      2. ai_summary: 2-3 concise sentences on what the role does day to day, the key
         technologies, and anything that stands out.
      3. description_md: the raw description rewritten as clean Markdown.
         - Use ## headings from this list only: Role, Responsibilities, Requirements,
           Nice to Have, About the Company.
         - Use bullet lists for items and keep every meaningful detail.
         - Omit a section entirely when it has no content.

      Always return the same job IDs you received, each exactly once.
      """;

  static final String RANK_INSTRUCTIONS = """
      You score how well each job matches a freelancer's profile.

      Sub-scores, each 0-100:
      - skill_match (30%): overlap of required skills with the freelancer's skills
      - budget_fit (25%): budget or rate against the freelancer's expectations
      - client_quality (15%): client rating, hire count, payment verification
      - scope_fit (15%): project scope and type against the preferred way of working
      - win_probability (15%): likelihood of winning given competition and experience

      score is skill_match*0.30 + budget_fit*0.25 + client_quality*0.15 + scope_fit*0.15 + win_probability*0.15.
      reasoning is 1-2 sentences on the main factors. Score poor matches low.
      Always return the same job IDs you received, each exactly once.
      """;

  private static final String JOB_SEPARATOR = "\n\n---\n\n";

  private JobPrompts() {
  }

  static String enrichInput(List<JobPosting> jobs) {
    String body = IntStream.range(0, jobs.size())
        .mapToObj(i -> {
          JobPosting job = jobs.get(i);
          return String.format("### Job %d (id: %s)%n**Title:** %s%n**Description:**%n%s",
              i + 1, job.getId(), job.getTitle(), truncateDescription(job.getDescription()));
        })
        .collect(Collectors.joining(JOB_SEPARATOR));
    return String.format("Enrich the following %d job(s):%n%n%s", jobs.size(), body);
  }

  static String rankInput(List<JobPosting> jobs, String userContext) {
    String body = IntStream.range(0, jobs.size())
        .mapToObj(i -> {
          JobPosting job = jobs.get(i);
          List<String> skills = job.getSkills() != null ? job.getSkills() : List.of();
          return String.format("### Job %d (id: %s)%n**Title:** %s%n**Skills:** %s%n**Budget:** %s%n**Client:** %s%n"
              + "**Description:**%n%s",
              i + 1, job.getId(), job.getTitle(), String.join(", ", skills), describeBudget(job),
              describeClient(job), truncateDescription(job.getDescription()));
        })
        .collect(Collectors.joining(JOB_SEPARATOR));
    return String.format("## Freelancer Profile%n%s%n%n## Jobs to Score%n%n%s", userContext, body);
  }

  static String describeBudget(JobPosting job) {
    String currency = job.getCurrency() != null ? job.getCurrency() : "USD";
    if (job.getBudgetType() == BudgetType.HOURLY) {
      return String.format("Hourly %s %s-%s", currency, amount(job.getHourlyMin()), amount(job.getHourlyMax()));
    }
    if (job.getBudgetType() == BudgetType.FIXED) {
      return String.format("Fixed %s %s-%s", currency, amount(job.getFixedBudgetMin()),
          amount(job.getFixedBudgetMax()));
    }
    return "Not specified";
  }

  static String describeClient(JobPosting job) {
    return String.format("rating %s, %s hires, payment %s",
        job.getClientRating() != null ? job.getClientRating().toPlainString() : "unknown",
        job.getClientHires() != null ? job.getClientHires() : "unknown",
        Boolean.TRUE.equals(job.getClientPaymentVerified()) ? "verified" : "unverified");
  }

  static String truncateDescription(String description) {
    String text = JobPostingService.plainText(description);
    return text.length() > MAX_DESCRIPTION_CHARS ? text.substring(0, MAX_DESCRIPTION_CHARS) + "..." : text;
  }

  private static String amount(BigDecimal value) {
    return value != null ? value.stripTrailingZeros().toPlainString() : "?";
  }
}
