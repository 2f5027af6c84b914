package com.sc360.reportrefresh.model;

import java.util.Locale;

/**
 * Statement statuses reported by the Redshift Data API.
 */
public enum EngineStatus {
    SUBMITTED,
    PICKED,
    STARTED,
    FINISHED,
    FAILED,
    ABORTED;

    public static EngineStatus fromValue(String value) {
        if (value == null) {
            return SUBMITTED;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public AttemptStatus toAttemptStatus() {
        return switch (this) {
            case SUBMITTED -> AttemptStatus.SUBMITTED;
            case PICKED, STARTED -> AttemptStatus.RUNNING;
            case FINISHED -> AttemptStatus.FINISHED;
            case FAILED -> AttemptStatus.FAILED;
            case ABORTED -> AttemptStatus.ABORTED;
        };
    }
}
