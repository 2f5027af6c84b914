package com.sc360.reportrefresh.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Identifies one orchestrated batch and carries the pipeline settings it runs with.
 * The audit key is (region, batchDate, reportSource).
 */
@Value
@Builder
public class RunContext {

    String pipeline;
    String region;
    LocalDate batchDate;
    String reportSource;     // SPDST | BMT
    String codebase;         // null when the pipeline has no variant filter
    DataSourceFilter dataSourceFilter;
    int retryLimit;
    Duration expectedRuntime; // null disables the Delay annotation
    String reportUrl;

    public String describe() {
        return pipeline + " [" + region + "/" + reportSource + " " + batchDate + "]";
    }
}
