package dev.jobmatcher.job;

public enum BudgetType {
    HOURLY,
    FIXED,
    UNKNOWN
}
