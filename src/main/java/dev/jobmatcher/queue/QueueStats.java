package dev.jobmatcher.queue;

public record QueueStats(long pending, long processing, long completed, long failed) {

    public long total() {
        return pending + processing + completed + failed;
    }
}
