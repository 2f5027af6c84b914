package com.sc360.reportrefresh.service;

import com.sc360.reportrefresh.exception.AuditWriteExhaustedException;
import com.sc360.reportrefresh.exception.RefreshFailedException;
import com.sc360.reportrefresh.exception.RetryBudgetExhaustedException;
import com.sc360.reportrefresh.model.FailureRecord;
import com.sc360.reportrefresh.model.RunContext;
import com.sc360.reportrefresh.model.RunOutcome;
import com.sc360.reportrefresh.model.RunStatus;
import com.sc360.reportrefresh.model.UnitResult;
import com.sc360.reportrefresh.model.WorkUnit;
import com.sc360.reportrefresh.output.AuditRecorder;
import com.sc360.reportrefresh.output.RefreshNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes one run: NotStarted → InProgress → Completed | Failed.
 *
 * Units run one at a time in exec_order. The first unit that exhausts its retries
 * fails the run and nothing after it is submitted. Audit writes bracket the run so a
 * crashed run is left visibly InProgress. The Delay check runs on every statement poll
 * and after every unit.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchRunner {

    private final WorkListProvider workListProvider;
    private final RetryController retryController;
    private final AuditRecorder auditRecorder;
    private final RefreshNotifier notifier;
    private final Clock clock;

    /**
     * @return the Finished outcome
     * @throws RetryBudgetExhaustedException if a unit failed on every attempt
     * @throws RefreshFailedException        if the run could not proceed for another reason
     */
    public RunOutcome run(RunContext run) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        List<String> auditWarnings = new ArrayList<>();
        log.info("Starting Report Refresh {}", run.describe());

        audit(auditWarnings, () -> auditRecorder.recordStart(run, startedAt));

        int completed = 0;
        try {
            List<WorkUnit> units = workListProvider.fetchWorkList(run);
            if (units.isEmpty()) {
                log.info("No pending stored procedures found for {}", run.describe());
            }

            AtomicBoolean delayed = new AtomicBoolean();
            Runnable delayCheck = () -> checkDelay(run, startedAt, delayed, auditWarnings);
            for (WorkUnit unit : units) {
                log.info("Processing SP: {} (Source: {}, order {}) in {}",
                        unit.getName(), unit.getDataSource(), unit.getExecOrder(), run.describe());
                UnitResult result = retryController.executeWithRetry(unit, run, delayCheck);
                audit(auditWarnings, () -> auditRecorder.recordUnitOutcome(run, result));

                if (!result.succeeded()) {
                    RunOutcome outcome = finish(run, startedAt, RunStatus.FAILED,
                            ErrorMessages.fragment(result.failure().getError()),
                            completed, List.of(result.failure()), auditWarnings);
                    log.error("SP {} failed after {} attempts in {}. Stopping job.",
                            unit.getName(), result.attempts(), run.describe());
                    throw new RetryBudgetExhaustedException(result.failure(), outcome);
                }
                completed++;
                delayCheck.run();
            }
        } catch (RefreshFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error in {}: {}", run.describe(), e.getMessage(), e);
            RunOutcome outcome = finish(run, startedAt, RunStatus.FAILED, ErrorMessages.fragment(e.getMessage()),
                    completed, List.of(FailureRecord.unexpected(run, e.getMessage())), auditWarnings);
            throw new RefreshFailedException("Report Refresh " + run.describe() + " failed: " + e.getMessage(), outcome, e);
        }

        RunOutcome outcome = finish(run, startedAt, RunStatus.FINISHED, RunOutcome.NO_ERROR,
                completed, List.of(), auditWarnings);
        log.info("All {} stored procedures executed successfully in {}", completed, run.describe());
        return outcome;
    }

    private RunOutcome finish(RunContext run, LocalDateTime startedAt, RunStatus status, String errorMessage,
                              int completed, List<FailureRecord> failures, List<String> auditWarnings) {
        RunOutcome pending = RunOutcome.builder()
                .status(status)
                .actualStartTime(startedAt)
                .actualEndTime(LocalDateTime.now(clock))
                .errorMessage(errorMessage)
                .completedUnits(completed)
                .failedUnits(failures)
                .build();

        log.info("Updating the report refresh status of {} as {}", run.describe(), status.auditValue());
        audit(auditWarnings, () -> auditRecorder.recordEnd(run, pending));

        RunOutcome outcome = pending.toBuilder().auditWarnings(auditWarnings).build();
        try {
            notifier.notify(run, outcome);
        } catch (Exception e) {
            log.error("Notification for {} failed: {}", run.describe(), e.getMessage(), e);
        }
        return outcome;
    }

    /** Writes Delay the first time the run is seen past its expected runtime. */
    private void checkDelay(RunContext run, LocalDateTime startedAt, AtomicBoolean delayed, List<String> auditWarnings) {
        if (isOverdue(run, startedAt) && delayed.compareAndSet(false, true)) {
            audit(auditWarnings, () -> auditRecorder.recordDelay(run,
                    "still running after expected runtime of " + run.getExpectedRuntime().toMinutes() + " min"));
        }
    }

    private boolean isOverdue(RunContext run, LocalDateTime startedAt) {
        Duration expected = run.getExpectedRuntime();
        return expected != null
                && Duration.between(startedAt, LocalDateTime.now(clock)).compareTo(expected) > 0;
    }

    private void audit(List<String> warnings, Runnable write) {
        try {
            write.run();
        } catch (AuditWriteExhaustedException e) {
            warnings.add(e.getMessage());
        }
    }
}
