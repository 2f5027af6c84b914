package com.sc360.reportrefresh.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * A unit that exhausted its retry budget, or an error that stopped the run
 * before any unit could be blamed.
 */
@Value
@Builder
public class FailureRecord {

    public static final String UNEXPECTED_ERROR = "Unexpected error";

    @JsonProperty("Stored Procedure Name")
    String procedureName;

    @JsonProperty("Error")
    String error;

    @JsonProperty("Data Source")
    String dataSource;

    @JsonProperty("Region")
    String region;

    @JsonProperty("Attempts")
    int attempts;

    public static FailureRecord forUnit(WorkUnit unit, RunContext run, String error, int attempts) {
        return FailureRecord.builder()
                .procedureName(unit.getName())
                .error(error)
                .dataSource(dataSourceLabel(unit.getDataSource(), run.getReportSource()))
                .region(run.getRegion())
                .attempts(attempts)
                .build();
    }

    public static FailureRecord unexpected(RunContext run, String error) {
        return FailureRecord.builder()
                .procedureName(UNEXPECTED_ERROR)
                .error(error)
                .dataSource(run.getReportSource())
                .region(run.getRegion())
                .attempts(0)
                .build();
    }

    /** Units tagged with the pipeline's own source keep the tag, everything else is reported as "SOURCE/Others". */
    static String dataSourceLabel(String dataSource, String reportSource) {
        if (dataSource != null && dataSource.toUpperCase(Locale.ROOT).contains(reportSource.toUpperCase(Locale.ROOT))) {
            return dataSource;
        }
        return reportSource + "/Others";
    }
}
