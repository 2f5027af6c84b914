package com.sc360.reportrefresh.service;

import com.sc360.reportrefresh.RunFixtures;
import com.sc360.reportrefresh.config.ReportRefreshProperties;
import com.sc360.reportrefresh.model.AttemptStatus;
import com.sc360.reportrefresh.model.EngineStatus;
import com.sc360.reportrefresh.model.ExecutionAttempt;
import com.sc360.reportrefresh.model.StatementState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CompletionPollerTest {

    @Mock
    private StatementExecutionClient executionClient;

    private ReportRefreshProperties properties;
    private CompletionPoller poller;
    private ExecutionAttempt submitted;

    @BeforeEach
    void setUp() {
        properties = RunFixtures.fastProperties();
        poller = new CompletionPoller(executionClient, properties);
        submitted = ExecutionAttempt.builder()
                .unit(RunFixtures.unit("sc360.sp_a()", 1))
                .attemptNumber(1)
                .queryId("q-1")
                .submittedAt(Instant.now())
                .status(AttemptStatus.SUBMITTED)
                .build();
    }

    @Test
    @DisplayName("Should keep polling through non-terminal statuses until FINISHED")
    void testAwaitTerminal_finished() {
        when(executionClient.describe("q-1")).thenReturn(
                new StatementState(EngineStatus.SUBMITTED, null),
                new StatementState(EngineStatus.PICKED, null),
                new StatementState(EngineStatus.STARTED, null),
                new StatementState(EngineStatus.FINISHED, null));

        ExecutionAttempt result = poller.awaitTerminal(submitted, () -> { });

        assertEquals(AttemptStatus.FINISHED, result.getStatus());
        assertTrue(result.isSuccess());
        assertNull(result.getErrorDetail());
        verify(executionClient, times(4)).describe("q-1");
    }

    @Test
    @DisplayName("Should carry the engine error on FAILED")
    void testAwaitTerminal_failed() {
        when(executionClient.describe("q-1")).thenReturn(
                new StatementState(EngineStatus.STARTED, null),
                new StatementState(EngineStatus.FAILED, "ERROR: division by zero"));

        ExecutionAttempt result = poller.awaitTerminal(submitted, () -> { });

        assertEquals(AttemptStatus.FAILED, result.getStatus());
        assertEquals("ERROR: division by zero", result.getErrorDetail());
    }

    @Test
    @DisplayName("Should treat ABORTED as terminal with an error detail")
    void testAwaitTerminal_aborted() {
        when(executionClient.describe("q-1")).thenReturn(new StatementState(EngineStatus.ABORTED, null));

        ExecutionAttempt result = poller.awaitTerminal(submitted, () -> { });

        assertEquals(AttemptStatus.ABORTED, result.getStatus());
        assertNotNull(result.getErrorDetail());
        assertFalse(result.isSuccess());
    }

    @Test
    @DisplayName("Should report FAILED on the first describe error by default")
    void testAwaitTerminal_describeErrorDowngrades() {
        when(executionClient.describe("q-1")).thenThrow(new RuntimeException("Rate exceeded"));

        ExecutionAttempt result = poller.awaitTerminal(submitted, () -> { });

        assertEquals(AttemptStatus.FAILED, result.getStatus());
        assertEquals("Rate exceeded", result.getErrorDetail());
        verify(executionClient, times(1)).describe("q-1");
    }

    @Test
    @DisplayName("Should tolerate describe errors up to max-describe-failures")
    void testAwaitTerminal_describeErrorTolerated() {
        properties.getExecution().setMaxDescribeFailures(3);
        when(executionClient.describe("q-1"))
                .thenThrow(new RuntimeException("Rate exceeded"))
                .thenThrow(new RuntimeException("Rate exceeded"))
                .thenReturn(new StatementState(EngineStatus.FINISHED, null));

        ExecutionAttempt result = poller.awaitTerminal(submitted, () -> { });

        assertEquals(AttemptStatus.FINISHED, result.getStatus());
        verify(executionClient, times(3)).describe("q-1");
    }

    @Test
    @DisplayName("Should call the poll hook once per poll of a running statement")
    void testAwaitTerminal_pollHook() {
        when(executionClient.describe("q-1")).thenReturn(
                new StatementState(EngineStatus.PICKED, null),
                new StatementState(EngineStatus.STARTED, null),
                new StatementState(EngineStatus.FINISHED, null));
        AtomicInteger polls = new AtomicInteger();

        poller.awaitTerminal(submitted, polls::incrementAndGet);

        assertEquals(2, polls.get());
    }
}
