package com.sc360.reportrefresh.service;

import com.sc360.reportrefresh.exception.TransientAccessException;
import com.sc360.reportrefresh.model.RunContext;
import com.sc360.reportrefresh.output.AuditRepository;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Stops a second run for the same region, batch date and report source.
 *
 * The run row is created as "Yet to start" the first time it is seen, then moved to
 * Submitted with a conditional update. Only the caller whose update matched may run
 * the batch. Rows that are Submitted, InProgress or Finished cannot be claimed again;
 * Failed and Delay rows can.
 */
@Component
@Slf4j
public class RunGuard {

    private final AuditRepository repository;
    private final Retry retry;
    private final Clock clock;

    public RunGuard(AuditRepository repository, @Qualifier("auditStoreRetry") Retry retry, Clock clock) {
        this.repository = repository;
        this.retry = retry;
        this.clock = clock;
    }

    /**
     * @return true if the caller may start the run
     * @throws TransientAccessException if the audit store could not be reached
     */
    public boolean claim(RunContext run) {
        try {
            if (retry.executeSupplier(() -> repository.insertRunIfAbsent(run))) {
                log.info("{}: first trigger of the day, run row created", run.describe());
            }
            boolean claimed = retry.executeSupplier(() -> repository.claimRun(run, LocalDateTime.now(clock)));
            if (!claimed) {
                log.warn("Report Refresh Triggered for the day already: {}", run.describe());
            }
            return claimed;
        } catch (Exception e) {
            throw new TransientAccessException("Could not check run guard for " + run.describe() + ": " + e.getMessage(), e);
        }
    }
}
