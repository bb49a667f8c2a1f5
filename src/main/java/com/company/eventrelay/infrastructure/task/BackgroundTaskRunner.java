package com.company.eventrelay.infrastructure.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs fire-and-forget work off the request thread.
 * A task that throws is retried a bounded number of times; the final failure is
 * logged and never propagated to the submitter.
 */
@Component
public class BackgroundTaskRunner {

    private static final Logger logger = LoggerFactory.getLogger(BackgroundTaskRunner.class);

    private final Executor taskExecutor;
    private final int maxRetries;

    public BackgroundTaskRunner(
            @Qualifier("taskExecutor") Executor taskExecutor,
            @Value("${tasks.max-retries:2}") int maxRetries) {
        this.taskExecutor = taskExecutor;
        this.maxRetries = Math.max(0, maxRetries);
    }

    /**
     * Submits a task for background execution.
     *
     * @param name Label used in log messages
     * @param task The work to run
     * @return Future completing with true if the task eventually succeeded, false if it
     *         exhausted its retries or could not be scheduled
     */
    public CompletableFuture<Boolean> submit(String name, Runnable task) {
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        try {
            taskExecutor.execute(() -> result.complete(runWithRetries(name, task)));
            logger.debug("Submitted background task {}", name);
        } catch (RejectedExecutionException e) {
            logger.error("Background task {} rejected: {}", name, e.getMessage());
            result.complete(false);
        }
        return result;
    }

    private boolean runWithRetries(String name, Runnable task) {
        int totalRuns = maxRetries + 1;
        for (int run = 1; run <= totalRuns; run++) {
            try {
                task.run();
                if (run > 1) {
                    logger.info("Background task {} succeeded on run {}", name, run);
                }
                return true;
            } catch (RuntimeException e) {
                logger.warn("Background task {} failed on run {}/{}: {}", name, run, totalRuns, e.getMessage());
                if (run == totalRuns) {
                    logger.error("Background task {} gave up after {} run(s)", name, totalRuns, e);
                }
            }
        }
        return false;
    }
}
