package com.sc360.reportrefresh.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Row of audit.sc360_reportrefreshtrigger_log, one per region, batch date and report source.
 * Read by monitors and dashboards; never deleted here.
 */
@Data
@Builder
public class RefreshRun {

    private String regionName;
    private LocalDate batchRunDate;
    private String reportSource;
    private String executionStatus;
    private LocalDateTime actualStartTime;
    private LocalDateTime actualEndTime;
    private String errorMessage;
}
