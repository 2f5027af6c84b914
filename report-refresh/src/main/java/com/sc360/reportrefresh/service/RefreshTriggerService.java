package com.sc360.reportrefresh.service;

import com.sc360.reportrefresh.config.ReportRefreshProperties;
import com.sc360.reportrefresh.model.RefreshResult;
import com.sc360.reportrefresh.model.RefreshRun;
import com.sc360.reportrefresh.model.RunContext;
import com.sc360.reportrefresh.model.RunOutcome;
import com.sc360.reportrefresh.output.AuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Entry point for scheduled and manual refreshes: resolves the pipeline,
 * applies the duplicate-run guard and hands the run to the {@link BatchRunner}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RefreshTriggerService {

    private final ReportRefreshProperties properties;
    private final RunGuard runGuard;
    private final BatchRunner batchRunner;
    private final AuditRepository auditRepository;
    private final Clock clock;

    public RefreshResult triggerToday(String pipelineName) {
        return trigger(pipelineName, LocalDate.now(clock));
    }

    /**
     * @throws IllegalArgumentException if no pipeline has that name
     * @throws com.sc360.reportrefresh.exception.RefreshFailedException if the run failed
     */
    public RefreshResult trigger(String pipelineName, LocalDate batchDate) {
        RunContext run = resolve(pipelineName, batchDate);

        if (!runGuard.claim(run)) {
            return RefreshResult.skipped(run, "Report Refresh Triggered for the day already: " + batchDate);
        }

        RunOutcome outcome = batchRunner.run(run);
        return RefreshResult.completed(run, outcome);
    }

    public Optional<RefreshRun> status(String pipelineName, LocalDate batchDate) {
        RunContext run = resolve(pipelineName, batchDate);
        return auditRepository.findRun(run.getRegion(), run.getBatchDate(), run.getReportSource());
    }

    private RunContext resolve(String pipelineName, LocalDate batchDate) {
        ReportRefreshProperties.Pipeline pipeline = properties.findPipeline(pipelineName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown pipeline: " + pipelineName));
        return properties.toRunContext(pipeline, batchDate);
    }
}
