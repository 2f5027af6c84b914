package com.sc360.reportrefresh.service;

import com.sc360.reportrefresh.config.ReportRefreshProperties;
import com.sc360.reportrefresh.model.AttemptStatus;
import com.sc360.reportrefresh.model.ExecutionAttempt;
import com.sc360.reportrefresh.model.StatementState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Polls a submitted statement until the engine reports FINISHED, FAILED or ABORTED.
 *
 * Sleeps the poll interval between describe calls. A describe call that throws is
 * counted; after max-describe-failures consecutive errors the attempt is reported as
 * FAILED with the describe error as its detail.
 *
 * The caller's onPoll hook runs before every sleep while the statement is still going.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CompletionPoller {

    private final StatementExecutionClient executionClient;
    private final ReportRefreshProperties properties;

    public ExecutionAttempt awaitTerminal(ExecutionAttempt attempt, Runnable onPoll) {
        Duration interval = properties.getExecution().getPollInterval();
        int maxDescribeFailures = Math.max(1, properties.getExecution().getMaxDescribeFailures());
        int describeFailures = 0;

        while (true) {
            try {
                StatementState state = executionClient.describe(attempt.getQueryId());
                describeFailures = 0;
                AttemptStatus status = state.status().toAttemptStatus();
                if (status.isTerminal()) {
                    log.info("Statement {} for {} ended {}", attempt.getQueryId(), attempt.getUnit().getName(), status);
                    return attempt
                            .withStatus(status)
                            .withErrorDetail(status.hasError() ? errorOrDefault(state) : null);
                }
                log.debug("Statement {} is {}, checking again in {}s",
                        attempt.getQueryId(), state.status(), interval.toSeconds());
            } catch (Exception e) {
                describeFailures++;
                log.warn("Error fetching status of statement {} ({}/{}): {}",
                        attempt.getQueryId(), describeFailures, maxDescribeFailures, e.getMessage());
                if (describeFailures >= maxDescribeFailures) {
                    sleep(interval);
                    return attempt.withStatus(AttemptStatus.FAILED).withErrorDetail(String.valueOf(e.getMessage()));
                }
            }

            onPoll.run();
            if (!sleep(interval)) {
                return attempt.withStatus(AttemptStatus.FAILED)
                        .withErrorDetail("Interrupted while waiting for statement " + attempt.getQueryId());
            }
        }
    }

    private static String errorOrDefault(StatementState state) {
        return state.error() != null ? state.error() : "Statement ended " + state.status() + " without error detail";
    }

    /** @return false if the thread was interrupted */
    private boolean sleep(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
