package com.sc360.reportrefresh.output;

import com.sc360.reportrefresh.RunFixtures;
import com.sc360.reportrefresh.config.RetryPolicyConfig;
import com.sc360.reportrefresh.exception.AuditWriteExhaustedException;
import com.sc360.reportrefresh.model.AttemptStatus;
import com.sc360.reportrefresh.model.ExecutionAttempt;
import com.sc360.reportrefresh.model.RunContext;
import com.sc360.reportrefresh.model.RunOutcome;
import com.sc360.reportrefresh.model.RunStatus;
import com.sc360.reportrefresh.model.UnitResult;
import com.sc360.reportrefresh.model.WorkUnit;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.TimeZone;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditRecorderTest {

    @Mock
    private AuditRepository repository;

    private AuditRecorder recorder;
    private final RunContext run = RunFixtures.run();
    private final LocalDateTime start = LocalDateTime.of(2026, 10, 17, 6, 0);
    private final LocalDateTime end = LocalDateTime.of(2026, 10, 17, 7, 15);

    @BeforeEach
    void setUp() {
        recorder = new AuditRecorder(repository,
                Retry.of("auditStore", RetryPolicyConfig.linearBackoff(3, Duration.ofMillis(1))),
                new RunFixtures.MutableClock(Instant.parse("2026-10-17T06:00:00Z")));
    }

    private RunOutcome failedOutcome() {
        return RunOutcome.builder()
                .status(RunStatus.FAILED)
                .actualStartTime(start)
                .actualEndTime(end)
                .errorMessage("division by zero")
                .build();
    }

    @Test
    @DisplayName("Should write the master row and the run row on start")
    void testRecordStart() {
        recorder.recordStart(run, start);

        verify(repository).markMasterStarted(run, start);
        verify(repository).markRunStarted(run, start);
    }

    @Test
    @DisplayName("Should succeed when the end write fails twice then goes through")
    void testRecordEnd_recoversOnThirdAttempt() {
        doThrow(new DataAccessResourceFailureException("connection reset"))
                .doThrow(new DataAccessResourceFailureException("connection reset"))
                .doNothing()
                .when(repository).markRunEnded(run, RunStatus.FAILED, end, "division by zero");

        assertDoesNotThrow(() -> recorder.recordEnd(run, failedOutcome()));

        verify(repository, times(3)).markRunEnded(run, RunStatus.FAILED, end, "division by zero");
        verify(repository).updateMasterStatus(run, RunStatus.FAILED);
    }

    @Test
    @DisplayName("Should raise AuditWriteExhaustedException after three failures and still write the master row")
    void testRecordEnd_exhausted() {
        doThrow(new DataAccessResourceFailureException("connection reset"))
                .when(repository).markRunEnded(any(), any(), any(), any());

        AuditWriteExhaustedException e = assertThrows(AuditWriteExhaustedException.class,
                () -> recorder.recordEnd(run, failedOutcome()));

        assertEquals("run end", e.getOperation());
        assertTrue(e.getMessage().contains("3 attempts"));
        verify(repository, times(3)).markRunEnded(any(), any(), any(), any());
        verify(repository).updateMasterStatus(run, RunStatus.FAILED);
    }

    @Test
    @DisplayName("Should stamp unit outcomes with the run clock whatever the host time zone")
    void testRecordUnitOutcome_usesRunClock() {
        TimeZone hostZone = TimeZone.getDefault();
        TimeZone.setDefault(TimeZone.getTimeZone("Asia/Kolkata"));
        try {
            WorkUnit unit = RunFixtures.unit("sc360.sp_a()", 1);
            ExecutionAttempt last = ExecutionAttempt.builder()
                    .unit(unit).attemptNumber(1).status(AttemptStatus.FINISHED).build();
            UnitResult result = new UnitResult(unit, last, null);

            recorder.recordUnitOutcome(run, result);

            verify(repository).insertUnitOutcome(run, result, start);
        } finally {
            TimeZone.setDefault(hostZone);
        }
    }

    @Test
    @DisplayName("Should only touch the master row when recording a delay")
    void testRecordDelay() {
        recorder.recordDelay(run, "still running after expected runtime of 30 min");

        verify(repository).updateMasterStatus(run, RunStatus.DELAY);
        verifyNoMoreInteractions(repository);
    }
}
