package com.sc360.reportrefresh.exception;

/**
 * The execution engine did not accept a statement. Counts as one failed attempt.
 */
public class SubmissionException extends RuntimeException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
