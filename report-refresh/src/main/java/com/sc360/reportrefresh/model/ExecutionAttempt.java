package com.sc360.reportrefresh.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * One submission of a work unit. Never persisted on its own; the final attempt
 * of each unit ends up in the unit log.
 */
@Value
@Builder
@With
public class ExecutionAttempt {

    WorkUnit unit;
    int attemptNumber;
    String queryId;          // null when the submission itself failed
    Instant submittedAt;
    AttemptStatus status;
    String errorDetail;      // set iff status is FAILED, ABORTED or CLIENT_ERROR

    public boolean isSuccess() {
        return status == AttemptStatus.FINISHED;
    }

    public static ExecutionAttempt clientError(WorkUnit unit, int attemptNumber, String detail) {
        return ExecutionAttempt.builder()
                .unit(unit)
                .attemptNumber(attemptNumber)
                .submittedAt(Instant.now())
                .status(AttemptStatus.CLIENT_ERROR)
                .errorDetail(detail)
                .build();
    }
}
