package com.sc360.reportrefresh.exception;

/**
 * The audit store or work-list source could not be reached within its retry budget.
 */
public class TransientAccessException extends RuntimeException {

    public TransientAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
