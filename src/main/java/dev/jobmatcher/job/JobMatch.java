package dev.jobmatcher.job;

/**
 * A shortlisted posting and its cosine similarity to the profile embedding.
 */
public record JobMatch(String jobId, double similarity) {
}
