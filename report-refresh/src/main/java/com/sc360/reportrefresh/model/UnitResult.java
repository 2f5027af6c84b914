package com.sc360.reportrefresh.model;

/**
 * Outcome of running one unit through its retry budget.
 *
 * @param lastAttempt the final attempt made for the unit
 * @param failure     null when the unit finished
 */
public record UnitResult(WorkUnit unit, ExecutionAttempt lastAttempt, FailureRecord failure) {

    public boolean succeeded() {
        return failure == null;
    }

    public int attempts() {
        return lastAttempt == null ? 0 : lastAttempt.getAttemptNumber();
    }
}
