package com.sc360.reportrefresh.output;

import com.sc360.reportrefresh.exception.AuditWriteExhaustedException;
import com.sc360.reportrefresh.model.RunContext;
import com.sc360.reportrefresh.model.RunOutcome;
import com.sc360.reportrefresh.model.RunStatus;
import com.sc360.reportrefresh.model.UnitResult;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Writes run state transitions to the audit store.
 *
 * Each write goes through the audit-store retry policy. When a write still fails the
 * error is logged and raised as {@link AuditWriteExhaustedException}; callers treat it
 * as a warning and keep the batch going.
 */
@Component
@Slf4j
public class AuditRecorder {

    private final AuditRepository repository;
    private final Retry retry;
    private final Clock clock;

    public AuditRecorder(AuditRepository repository, @Qualifier("auditStoreRetry") Retry retry, Clock clock) {
        this.repository = repository;
        this.retry = retry;
        this.clock = clock;
    }

    public void recordStart(RunContext run, LocalDateTime startedAt) {
        raiseFirst(
                write("master start", run, () -> repository.markMasterStarted(run, startedAt)),
                write("run start", run, () -> repository.markRunStarted(run, startedAt)));
    }

    public void recordUnitOutcome(RunContext run, UnitResult result) {
        LocalDateTime finishedAt = LocalDateTime.now(clock);
        raiseFirst(write("unit outcome " + result.unit().getName(), run,
                () -> repository.insertUnitOutcome(run, result, finishedAt)));
    }

    /** Annotates the master row only; the run row stays InProgress. */
    public void recordDelay(RunContext run, String reason) {
        log.warn("{} is delayed: {}", run.describe(), reason);
        raiseFirst(write("master delay", run, () -> repository.updateMasterStatus(run, RunStatus.DELAY)));
    }

    public void recordEnd(RunContext run, RunOutcome outcome) {
        raiseFirst(
                write("run end", run, () -> repository.markRunEnded(
                        run, outcome.getStatus(), outcome.getActualEndTime(), outcome.getErrorMessage())),
                write("master end", run, () -> repository.updateMasterStatus(run, outcome.getStatus())));
    }

    /** @return null when the write went through */
    private AuditWriteExhaustedException write(String operation, RunContext run, Runnable statement) {
        try {
            retry.executeRunnable(statement);
            log.debug("{}: {} recorded", run.describe(), operation);
            return null;
        } catch (Exception e) {
            log.warn("{}: audit write '{}' exhausted its retries, audit state may be stale: {}",
                    run.describe(), operation, e.getMessage());
            return new AuditWriteExhaustedException(operation, retry.getRetryConfig().getMaxAttempts(), e);
        }
    }

    private static void raiseFirst(AuditWriteExhaustedException... results) {
        for (AuditWriteExhaustedException result : results) {
            if (result != null) {
                throw result;
            }
        }
    }
}
