package dev.jobmatcher;

import dev.jobmatcher.run.AgentRunStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Maps a worker pass to a process exit status and ends the JVM with it.
 * <ul>
 *   <li>0: every claimed item and every enrichment run finished</li>
 *   <li>1: the pass itself failed</li>
 *   <li>2: the pass ran but queue items or enrichment runs failed</li>
 * </ul>
 */
@Slf4j
@Component
public class ExitManager {

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILED = 1;
  public static final int EXIT_PARTIAL = 2;

  private final boolean exitOnCompletion;

  public ExitManager(@Value("${worker.exit-on-completion:true}") boolean exitOnCompletion) {
    this.exitOnCompletion = exitOnCompletion;
  }

  public int statusFor(WorkerSummary summary) {
    if (summary == null) {
      return EXIT_OK;
    }
    int failedItems = summary.drain().failed();
    long failedRuns = summary.enrichmentRuns().stream()
        .filter(run -> run.status() == AgentRunStatus.FAILED)
        .count();
    if (failedItems > 0 || failedRuns > 0) {
      log.warn("Worker pass had {} failed queue item(s) and {} failed enrichment run(s)", failedItems, failedRuns);
      return EXIT_PARTIAL;
    }
    return EXIT_OK;
  }

  public void exit(int status) {
    if (!exitOnCompletion) {
      log.info("Exit on completion disabled; pass finished with status {}", status);
      return;
    }
    System.exit(status);
  }
}
