package com.sc360.reportrefresh.service;

import com.sc360.reportrefresh.config.ReportRefreshProperties;
import com.sc360.reportrefresh.model.AttemptStatus;
import com.sc360.reportrefresh.model.ExecutionAttempt;
import com.sc360.reportrefresh.model.FailureRecord;
import com.sc360.reportrefresh.model.RunContext;
import com.sc360.reportrefresh.model.UnitResult;
import com.sc360.reportrefresh.model.WorkUnit;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one unit up to the run's retry limit.
 *
 * Every attempt is a fresh submission followed by polling; nothing is resumed.
 * A rejected submission counts the same as a FAILED or ABORTED statement.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RetryController {

    private final StatementExecutionClient executionClient;
    private final CompletionPoller poller;
    private final ReportRefreshProperties properties;

    /**
     * @param onPoll run on every poll of a statement that has not ended yet
     */
    public UnitResult executeWithRetry(WorkUnit unit, RunContext run, Runnable onPoll) {
        int retryLimit = run.getRetryLimit();
        AtomicInteger attemptCounter = new AtomicInteger();
        AtomicReference<ExecutionAttempt> latest = new AtomicReference<>();

        Retry retry = Retry.of("unit-" + unit.getName(), RetryConfig.<ExecutionAttempt>custom()
                .maxAttempts(retryLimit)
                .waitDuration(properties.getExecution().getRetryDelay())
                .retryOnResult(attempt -> !attempt.isSuccess())
                .build());
        retry.getEventPublisher().onRetry(e -> log.info("Retrying SP {} ({}/{}) in {} after waiting {}s...",
                unit.getName(), e.getNumberOfRetryAttempts(), retryLimit, run.describe(), e.getWaitInterval().toSeconds()));

        ExecutionAttempt last;
        try {
            last = retry.executeSupplier(() -> {
                ExecutionAttempt attempt = attempt(unit, run, attemptCounter.incrementAndGet(), onPoll);
                latest.set(attempt);
                return attempt;
            });
        } catch (RuntimeException e) {
            // Resilience4j rethrows a null last exception (an NPE) when its retry wait is interrupted
            if (!Thread.currentThread().isInterrupted() || latest.get() == null) {
                throw e;
            }
            last = latest.get();
            log.warn("Interrupted while waiting to retry SP {} in {}, giving up after {} attempts",
                    unit.getName(), run.describe(), last.getAttemptNumber());
        }

        if (last.isSuccess()) {
            log.info("SP {} executed successfully in {} on attempt {}", unit.getName(), run.describe(), last.getAttemptNumber());
            return new UnitResult(unit, last, null);
        }

        log.error("SP {} failed after {} attempts in {}: {}",
                unit.getName(), last.getAttemptNumber(), run.describe(), last.getErrorDetail());
        return new UnitResult(unit, last, FailureRecord.forUnit(unit, run, last.getErrorDetail(), last.getAttemptNumber()));
    }

    private ExecutionAttempt attempt(WorkUnit unit, RunContext run, int attemptNumber, Runnable onPoll) {
        log.info("Executing SP: {} (Attempt {}/{}) in {}", unit.getName(), attemptNumber, run.getRetryLimit(), run.describe());
        ExecutionAttempt submitted;
        try {
            String queryId = executionClient.submit(unit);
            submitted = ExecutionAttempt.builder()
                    .unit(unit)
                    .attemptNumber(attemptNumber)
                    .queryId(queryId)
                    .submittedAt(Instant.now())
                    .status(AttemptStatus.SUBMITTED)
                    .build();
        } catch (Exception e) {
            log.warn("Error executing SP {}: {}", unit.getName(), e.getMessage());
            return ExecutionAttempt.clientError(unit, attemptNumber, String.valueOf(e.getMessage()));
        }

        ExecutionAttempt terminal = poller.awaitTerminal(submitted, onPoll);
        if (!terminal.isSuccess()) {
            log.warn("SP {} failed on attempt {} in {}: {}",
                    unit.getName(), attemptNumber, run.describe(), terminal.getErrorDetail());
        }
        return terminal;
    }
}
