package com.sc360.reportrefresh.service;

import com.sc360.reportrefresh.exception.TransientAccessException;
import com.sc360.reportrefresh.model.DataSourceFilter;
import com.sc360.reportrefresh.model.RunContext;
import com.sc360.reportrefresh.model.WorkUnit;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Reads the ordered stored-procedure list for a run from audit.sc360_reportrefresh.
 *
 * Rows are filtered by region, file_datasource pattern and, for pipelines that have one,
 * the codebase variant. Rows without an exec_order are logged and left out. An empty
 * list is a valid answer.
 */
@Service
@Slf4j
public class WorkListProvider {

    /** Maps rows with a NULL exec_order to null; they have no place in the order and are skipped. */
    private static final RowMapper<WorkUnit> UNIT_MAPPER = (rs, n) -> {
        String name = rs.getString("stored_procedure_name");
        String dataSource = rs.getString("file_datasource");
        double execOrder = rs.getDouble("exec_order");
        if (rs.wasNull()) {
            log.warn("Skipping SP {} (Source: {}): exec_order is NULL", name, dataSource);
            return null;
        }
        return WorkUnit.builder().name(name).dataSource(dataSource).execOrder(execOrder).build();
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final Retry retry;

    public WorkListProvider(NamedParameterJdbcTemplate jdbc, @Qualifier("workListRetry") Retry retry) {
        this.jdbc = jdbc;
        this.retry = retry;
    }

    public List<WorkUnit> fetchWorkList(RunContext run) {
        try {
            List<WorkUnit> units = new ArrayList<>(retry.executeSupplier(() -> query(run)));
            // List.sort is stable, so equal exec_order values keep the row order
            units.sort(Comparator.comparingDouble(WorkUnit::getExecOrder));
            log.info("{}: {} stored procedures to execute", run.describe(), units.size());
            return units;
        } catch (Exception e) {
            throw new TransientAccessException(
                    "Work list lookup failed for " + run.describe() + ": " + e.getMessage(), e);
        }
    }

    private List<WorkUnit> query(RunContext run) {
        DataSourceFilter filter = run.getDataSourceFilter();
        String match = filter.mode() == DataSourceFilter.Mode.INCLUDE ? "LIKE" : "NOT LIKE";

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("region", run.getRegion())
                .addValue("dataSource", filter.likePattern());
        StringBuilder sql = new StringBuilder("""
            SELECT stored_procedure_name, file_datasource, exec_order
              FROM audit.sc360_reportrefresh
             WHERE region = :region
            """)
                .append("   AND file_datasource ").append(match).append(" :dataSource\n");
        if (run.getCodebase() != null && !run.getCodebase().isBlank()) {
            sql.append("   AND codebase = :codebase\n");
            params.addValue("codebase", run.getCodebase());
        }
        sql.append(" ORDER BY exec_order");

        return jdbc.query(sql.toString(), params, UNIT_MAPPER).stream()
                .filter(Objects::nonNull)
                .toList();
    }
}
