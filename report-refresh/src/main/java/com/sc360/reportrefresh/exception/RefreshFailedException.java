package com.sc360.reportrefresh.exception;

import com.sc360.reportrefresh.model.RunOutcome;
import org.springframework.boot.ExitCodeGenerator;

/**
 * A run ended in Failed. Raised after the audit rows and notifications are written,
 * so the process can exit non-zero.
 */
public class RefreshFailedException extends RuntimeException implements ExitCodeGenerator {

    private final transient RunOutcome outcome;

    public RefreshFailedException(String message, RunOutcome outcome, Throwable cause) {
        super(message, cause);
        this.outcome = outcome;
    }

    public RunOutcome getOutcome() {
        return outcome;
    }

    @Override
    public int getExitCode() {
        return 1;
    }
}
