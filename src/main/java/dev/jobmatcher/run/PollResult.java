package dev.jobmatcher.run;

/**
 * Outcome of waiting for a run. An abandoned result means the caller stopped waiting;
 * the run itself keeps going.
 */
public record PollResult(AgentRunView run, boolean abandoned) {

    public static PollResult finished(AgentRunView run) {
        return new PollResult(run, false);
    }

    public static PollResult abandoned(AgentRunView run) {
        return new PollResult(run, true);
    }
}
