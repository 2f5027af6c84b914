package com.sc360.reportrefresh.output;

import com.sc360.reportrefresh.model.RefreshRun;
import com.sc360.reportrefresh.model.RunContext;
import com.sc360.reportrefresh.model.RunStatus;
import com.sc360.reportrefresh.model.UnitResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to the refresh audit tables.
 *
 * <ul>
 *   <li>audit.sc360_reportrefreshtrigger_log: one row per region, batch date and report source</li>
 *   <li>audit.master_data_for_irr: coarse status per region and identifier, read by dashboards</li>
 *   <li>audit.sc360_reportrefresh_unit_log: one row per unit outcome</li>
 * </ul>
 *
 * Every statement binds its values; nothing is spliced into the SQL text.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class AuditRepository {

    static final List<String> BLOCKING_STATUSES = Arrays.stream(RunStatus.values())
            .filter(RunStatus::blocksNewRun)
            .map(RunStatus::auditValue)
            .toList();

    private static final String RUN_KEY =
            " WHERE regionname = :region AND batchrundate = :batchDate AND report_source = :reportSource";

    private static final RowMapper<RefreshRun> RUN_MAPPER = (rs, n) -> RefreshRun.builder()
            .regionName(rs.getString("regionname"))
            .batchRunDate(rs.getDate("batchrundate").toLocalDate())
            .reportSource(rs.getString("report_source"))
            .executionStatus(rs.getString("execution_status"))
            .actualStartTime(toLocalDateTime(rs.getTimestamp("actual_start_time")))
            .actualEndTime(toLocalDateTime(rs.getTimestamp("actual_end_time")))
            .errorMessage(rs.getString("error_message"))
            .build();

    private final NamedParameterJdbcTemplate jdbc;

    public void ensureSchema() {
        log.info("Ensuring unit log table exists...");

        jdbc.getJdbcOperations().execute("""
            CREATE TABLE IF NOT EXISTS audit.sc360_reportrefresh_unit_log
            (
                regionname          VARCHAR(32)   NOT NULL,
                batchrundate        DATE          NOT NULL,
                report_source       VARCHAR(32)   NOT NULL,
                stored_procedure    VARCHAR(512)  NOT NULL,
                file_datasource     VARCHAR(128),
                exec_order          NUMERIC(10,2),
                attempts            INTEGER       NOT NULL,
                execution_status    VARCHAR(32)   NOT NULL,
                error_message       TEXT,
                finished_at         TIMESTAMP     NOT NULL
            )
        """);

        log.info("Unit log table ready.");
    }

    // ── Run log ──────────────────────────────────────────────────────────────

    public Optional<RefreshRun> findRun(String region, LocalDate batchDate, String reportSource) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("region", region)
                .addValue("batchDate", Date.valueOf(batchDate))
                .addValue("reportSource", reportSource);
        List<RefreshRun> rows = jdbc.query("""
            SELECT regionname, batchrundate, report_source, execution_status,
                   actual_start_time, actual_end_time, error_message
              FROM audit.sc360_reportrefreshtrigger_log
            """ + RUN_KEY, params, RUN_MAPPER);
        return rows.stream().findFirst();
    }

    /**
     * Creates the run row as "Yet to start" unless one already exists.
     *
     * @return true if a row was inserted
     */
    public boolean insertRunIfAbsent(RunContext run) {
        int inserted = jdbc.update("""
            INSERT INTO audit.sc360_reportrefreshtrigger_log
                (regionname, batchrundate, report_source, execution_status, error_message)
            SELECT :region, :batchDate, :reportSource, :status, 'NULL'
             WHERE NOT EXISTS (
                   SELECT 1 FROM audit.sc360_reportrefreshtrigger_log
            """ + RUN_KEY + ")",
                runKey(run).addValue("status", RunStatus.YET_TO_START.auditValue()));
        return inserted > 0;
    }

    /**
     * Moves the run row to Submitted unless it is already submitted, running or finished.
     *
     * @return true if this caller now owns the run
     */
    public boolean claimRun(RunContext run, LocalDateTime submittedAt) {
        int updated = jdbc.update("""
            UPDATE audit.sc360_reportrefreshtrigger_log
               SET execution_status = :status, actual_start_time = :at, error_message = 'NULL'
            """ + RUN_KEY + """

               AND (execution_status IS NULL OR execution_status NOT IN (:blocking))
            """,
                runKey(run)
                        .addValue("status", RunStatus.SUBMITTED.auditValue())
                        .addValue("at", Timestamp.valueOf(submittedAt))
                        .addValue("blocking", BLOCKING_STATUSES));
        return updated > 0;
    }

    public void markRunStarted(RunContext run, LocalDateTime startedAt) {
        jdbc.update("""
            UPDATE audit.sc360_reportrefreshtrigger_log
               SET execution_status = :status, actual_start_time = :at
            """ + RUN_KEY,
                runKey(run)
                        .addValue("status", RunStatus.IN_PROGRESS.auditValue())
                        .addValue("at", Timestamp.valueOf(startedAt)));
    }

    public void markRunEnded(RunContext run, RunStatus status, LocalDateTime endedAt, String errorMessage) {
        jdbc.update("""
            UPDATE audit.sc360_reportrefreshtrigger_log
               SET execution_status = :status, actual_end_time = :at, error_message = :error
            """ + RUN_KEY,
                runKey(run)
                        .addValue("status", status.auditValue())
                        .addValue("at", Timestamp.valueOf(endedAt))
                        .addValue("error", errorMessage));
    }

    // ── Master row ───────────────────────────────────────────────────────────

    public void markMasterStarted(RunContext run, LocalDateTime startedAt) {
        jdbc.update("""
            UPDATE audit.master_data_for_irr
               SET actual_start_time = :at, status = :status
             WHERE regionname = :region AND identifier = :identifier
            """,
                masterKey(run)
                        .addValue("at", Timestamp.valueOf(startedAt))
                        .addValue("status", RunStatus.IN_PROGRESS.masterValue()));
    }

    public void updateMasterStatus(RunContext run, RunStatus status) {
        jdbc.update("""
            UPDATE audit.master_data_for_irr
               SET status = :status
             WHERE regionname = :region AND identifier = :identifier
            """,
                masterKey(run).addValue("status", status.masterValue()));
    }

    // ── Unit log ─────────────────────────────────────────────────────────────

    public void insertUnitOutcome(RunContext run, UnitResult result, LocalDateTime finishedAt) {
        jdbc.update("""
            INSERT INTO audit.sc360_reportrefresh_unit_log
                (regionname, batchrundate, report_source, stored_procedure, file_datasource,
                 exec_order, attempts, execution_status, error_message, finished_at)
            VALUES (:region, :batchDate, :reportSource, :procedure, :dataSource,
                    :execOrder, :attempts, :status, :error, :finishedAt)
            """,
                runKey(run)
                        .addValue("procedure", result.unit().getName())
                        .addValue("dataSource", result.unit().getDataSource())
                        .addValue("execOrder", result.unit().getExecOrder())
                        .addValue("attempts", result.attempts())
                        .addValue("status", result.succeeded()
                                ? RunStatus.FINISHED.auditValue() : RunStatus.FAILED.auditValue())
                        .addValue("error", result.succeeded() ? null : result.failure().getError())
                        .addValue("finishedAt", Timestamp.valueOf(finishedAt)));
    }

    private static MapSqlParameterSource runKey(RunContext run) {
        return new MapSqlParameterSource()
                .addValue("region", run.getRegion())
                .addValue("batchDate", Date.valueOf(run.getBatchDate()))
                .addValue("reportSource", run.getReportSource());
    }

    private static MapSqlParameterSource masterKey(RunContext run) {
        return new MapSqlParameterSource()
                .addValue("region", run.getRegion())
                .addValue("identifier", run.getReportSource());
    }

    private static LocalDateTime toLocalDateTime(Timestamp ts) {
        return ts == null ? null : ts.toLocalDateTime();
    }
}
