package com.sc360.reportrefresh.exception;

/**
 * An audit write failed on every attempt. Not fatal to the run, but the audit
 * rows for it may now be stale.
 */
public class AuditWriteExhaustedException extends RuntimeException {

    private final String operation;

    public AuditWriteExhaustedException(String operation, int attempts, Throwable cause) {
        super("Audit write '" + operation + "' failed after " + attempts + " attempts: "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
