package dev.jobmatcher;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Runs one worker pass on startup and exits with the status {@link ExitManager} derives
 * from it, or 1 when the pass fails outright.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkerCommand implements CommandLineRunner {

    private final WorkerRunner workerRunner;
    private final ExitManager exitManager;

    @Override
    public void run(String... args) {
        int status;
        try {
            WorkerSummary summary = workerRunner.execute();
            status = exitManager.statusFor(summary);
            log.info("Job Matcher exiting with status {}", status);
        } catch (Exception e) {
            log.error("Job Matcher failed: {}", e.getMessage(), e);
            status = ExitManager.EXIT_FAILED;
        }
        exitManager.exit(status);
    }
}
