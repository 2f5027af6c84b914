package com.sc360.reportrefresh.output;

import com.sc360.reportrefresh.RunFixtures;
import com.sc360.reportrefresh.model.AttemptStatus;
import com.sc360.reportrefresh.model.ExecutionAttempt;
import com.sc360.reportrefresh.model.FailureRecord;
import com.sc360.reportrefresh.model.RunContext;
import com.sc360.reportrefresh.model.RunStatus;
import com.sc360.reportrefresh.model.UnitResult;
import com.sc360.reportrefresh.model.WorkUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditRepositoryTest {

    @Mock
    private NamedParameterJdbcTemplate jdbc;

    private AuditRepository repository;
    private final RunContext run = RunFixtures.run();
    private final LocalDateTime at = LocalDateTime.of(2026, 10, 17, 6, 0);

    @BeforeEach
    void setUp() {
        repository = new AuditRepository(jdbc);
    }

    private SqlParameterSource capturedParams(String sqlFragment) {
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbc).update(contains(sqlFragment), params.capture());
        return params.getValue();
    }

    @Test
    @DisplayName("Should claim only when the conditional update matched a row")
    void testClaimRun() {
        when(jdbc.update(anyString(), any(SqlParameterSource.class))).thenReturn(1, 0);

        assertTrue(repository.claimRun(run, at));
        assertFalse(repository.claimRun(run, at));

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbc, times(2)).update(sql.capture(), params.capture());
        assertTrue(sql.getValue().contains("execution_status NOT IN (:blocking)"));
        SqlParameterSource bound = params.getValue();
        assertEquals("Submitted", bound.getValue("status"));
        assertEquals(AuditRepository.BLOCKING_STATUSES, bound.getValue("blocking"));
        assertEquals("EMEA", bound.getValue("region"));
        assertEquals(Date.valueOf(RunFixtures.BATCH_DATE), bound.getValue("batchDate"));
        assertEquals("SPDST", bound.getValue("reportSource"));
        assertEquals(Timestamp.valueOf(at), bound.getValue("at"));
    }

    @Test
    @DisplayName("Should not treat Failed or Delay rows as blocking")
    void testBlockingStatuses() {
        assertEquals(List.of("Submitted", "InProgress", "Finished"), AuditRepository.BLOCKING_STATUSES);
        assertFalse(AuditRepository.BLOCKING_STATUSES.contains(RunStatus.FAILED.auditValue()));
        assertFalse(AuditRepository.BLOCKING_STATUSES.contains(RunStatus.DELAY.auditValue()));
    }

    @Test
    @DisplayName("Should insert the run row as Yet to start")
    void testInsertRunIfAbsent() {
        when(jdbc.update(anyString(), any(SqlParameterSource.class))).thenReturn(1);

        assertTrue(repository.insertRunIfAbsent(run));
        assertEquals("Yet to start", capturedParams("WHERE NOT EXISTS").getValue("status"));
    }

    @Test
    @DisplayName("Should write status, end time and error fragment when a run ends")
    void testMarkRunEnded() {
        repository.markRunEnded(run, RunStatus.FAILED, at, "division by zero");

        SqlParameterSource params = capturedParams("actual_end_time");
        assertEquals("Failed", params.getValue("status"));
        assertEquals("division by zero", params.getValue("error"));
    }

    @Test
    @DisplayName("Should write the coarse master value for the run status")
    void testUpdateMasterStatus() {
        repository.updateMasterStatus(run, RunStatus.FINISHED);

        SqlParameterSource params = capturedParams("audit.master_data_for_irr");
        assertEquals("Completed", params.getValue("status"));
        assertEquals("SPDST", params.getValue("identifier"));
    }

    @Test
    @DisplayName("Should log a failed unit with its attempts and error")
    void testInsertUnitOutcome() {
        WorkUnit unit = RunFixtures.unit("sc360.sp_b()", 2);
        ExecutionAttempt last = ExecutionAttempt.builder()
                .unit(unit).attemptNumber(3).status(AttemptStatus.FAILED).errorDetail("ERROR: boom").build();
        UnitResult result = new UnitResult(unit, last, FailureRecord.forUnit(unit, run, "ERROR: boom", 3));

        repository.insertUnitOutcome(run, result, at);

        SqlParameterSource params = capturedParams("sc360_reportrefresh_unit_log");
        assertEquals("sc360.sp_b()", params.getValue("procedure"));
        assertEquals(3, params.getValue("attempts"));
        assertEquals("Failed", params.getValue("status"));
        assertEquals("ERROR: boom", params.getValue("error"));
        assertEquals(2.0, params.getValue("execOrder"));
    }

    @Test
    @DisplayName("Should create the unit log table")
    void testEnsureSchema() {
        JdbcOperations operations = mock(JdbcOperations.class);
        when(jdbc.getJdbcOperations()).thenReturn(operations);

        repository.ensureSchema();

        verify(operations).execute(contains("CREATE TABLE IF NOT EXISTS audit.sc360_reportrefresh_unit_log"));
    }
}
