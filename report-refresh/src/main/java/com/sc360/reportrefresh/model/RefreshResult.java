package com.sc360.reportrefresh.model;

/**
 * What a trigger did: either ran the batch or skipped it because the run was already claimed.
 */
public record RefreshResult(RunContext context, boolean skipped, String reason, RunOutcome outcome) {

    public static RefreshResult skipped(RunContext context, String reason) {
        return new RefreshResult(context, true, reason, null);
    }

    public static RefreshResult completed(RunContext context, RunOutcome outcome) {
        return new RefreshResult(context, false, null, outcome);
    }
}
