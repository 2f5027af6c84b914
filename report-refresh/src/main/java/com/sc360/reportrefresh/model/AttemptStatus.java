package com.sc360.reportrefresh.model;

/**
 * Status of one submission of a work unit.
 */
public enum AttemptStatus {
    SUBMITTED,
    RUNNING,
    FINISHED,
    FAILED,
    ABORTED,
    CLIENT_ERROR;

    public boolean isTerminal() {
        return this == FINISHED || this == FAILED || this == ABORTED || this == CLIENT_ERROR;
    }

    public boolean hasError() {
        return this == FAILED || this == ABORTED || this == CLIENT_ERROR;
    }
}
