package com.sc360.reportrefresh.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Terminal state of a run as written to the audit store and sent to notifications.
 */
@Value
@Builder(toBuilder = true)
public class RunOutcome {

    /** Sentinel written to error_message when the run has no error. */
    public static final String NO_ERROR = "Null";

    RunStatus status;
    LocalDateTime actualStartTime;
    LocalDateTime actualEndTime;
    String errorMessage;
    int completedUnits;

    @Singular
    List<FailureRecord> failedUnits;

    /** Audit writes that could not be completed; the audit rows may be stale. */
    @Singular
    List<String> auditWarnings;

    public boolean isSuccess() {
        return status == RunStatus.FINISHED;
    }
}
