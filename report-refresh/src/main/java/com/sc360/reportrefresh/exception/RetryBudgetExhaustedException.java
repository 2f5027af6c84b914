package com.sc360.reportrefresh.exception;

import com.sc360.reportrefresh.model.FailureRecord;
import com.sc360.reportrefresh.model.RunOutcome;

/**
 * A unit failed on every attempt it was allowed, which halts the batch.
 */
public class RetryBudgetExhaustedException extends RefreshFailedException {

    private final transient FailureRecord failure;

    public RetryBudgetExhaustedException(FailureRecord failure, RunOutcome outcome) {
        super("SP " + failure.getProcedureName() + " failed after " + failure.getAttempts()
                + " attempts in " + failure.getRegion() + ". Job terminating.", outcome, null);
        this.failure = failure;
    }

    public FailureRecord getFailure() {
        return failure;
    }
}
