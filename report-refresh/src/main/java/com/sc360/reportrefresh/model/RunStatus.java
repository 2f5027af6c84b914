package com.sc360.reportrefresh.model;

/**
 * Values of execution_status in the run log, with the coarser status written
 * to the master row for dashboards.
 */
public enum RunStatus {
    YET_TO_START("Yet to start", "Null"),
    SUBMITTED("Submitted", "InProgress"),
    IN_PROGRESS("InProgress", "InProgress"),
    DELAY("Delay", "Delay"),
    FINISHED("Finished", "Completed"),
    FAILED("Failed", "Failed");

    private final String auditValue;
    private final String masterValue;

    RunStatus(String auditValue, String masterValue) {
        this.auditValue = auditValue;
        this.masterValue = masterValue;
    }

    public String auditValue() {
        return auditValue;
    }

    public String masterValue() {
        return masterValue;
    }

    /** Statuses that block a second run for the same region, date and source. */
    public boolean blocksNewRun() {
        return this == SUBMITTED || this == IN_PROGRESS || this == FINISHED;
    }
}
