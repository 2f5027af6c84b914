package com.sc360.reportrefresh.scheduler;

import com.sc360.reportrefresh.config.ReportRefreshProperties;
import com.sc360.reportrefresh.model.RefreshResult;
import com.sc360.reportrefresh.output.AuditRepository;
import com.sc360.reportrefresh.service.RefreshTriggerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.CronTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.util.List;

/**
 * Manages scheduled and on-startup refreshes.
 *
 * Each pipeline with a cron expression gets its own UTC cron task. Pipelines without
 * one are only run manually or on startup.
 *
 * In one-shot mode a failed startup run is rethrown so the process exits non-zero.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RefreshScheduler implements SchedulingConfigurer, ApplicationRunner {

    private final RefreshTriggerService triggerService;
    private final AuditRepository auditRepository;
    private final ReportRefreshProperties properties;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        for (ReportRefreshProperties.Pipeline pipeline : properties.getPipelines()) {
            if (pipeline.getCron() == null || pipeline.getCron().isBlank()) {
                continue;
            }
            registrar.addCronTask(new CronTask(() -> scheduledRefresh(pipeline.getName()),
                    new CronTrigger(pipeline.getCron(), ZoneOffset.UTC)));
            log.info("Scheduled pipeline {} with cron '{}' (UTC)", pipeline.getName(), pipeline.getCron());
        }
    }

    /**
     * On application startup:
     *  1. Ensure the unit log table exists
     *  2. Optionally run the startup pipelines
     */
    @Override
    public void run(ApplicationArguments args) {
        if (properties.getAudit().isInitializeSchema()) {
            try {
                auditRepository.ensureSchema();
            } catch (Exception e) {
                log.warn("Could not initialise unit log table: {}", e.getMessage());
            }
        }

        if (!properties.getScheduling().isRunOnStartup()) {
            log.info("Report refresh ready with {} pipelines", properties.getPipelines().size());
            return;
        }

        for (String pipeline : startupPipelines()) {
            log.info("RUN_ON_STARTUP=true, running pipeline {}", pipeline);
            try {
                report(triggerService.triggerToday(pipeline));
            } catch (RuntimeException e) {
                if (properties.getScheduling().isOneShot()) {
                    throw e;
                }
                log.error("Startup refresh of {} failed: {}", pipeline, e.getMessage(), e);
            }
        }
    }

    void scheduledRefresh(String pipeline) {
        log.info("Scheduled refresh triggered for {}", pipeline);
        try {
            report(triggerService.triggerToday(pipeline));
        } catch (Exception e) {
            log.error("Scheduled refresh of {} failed: {}", pipeline, e.getMessage(), e);
        }
    }

    private List<String> startupPipelines() {
        List<String> configured = properties.getScheduling().getStartupPipelines();
        if (!configured.isEmpty()) {
            return configured;
        }
        return properties.getPipelines().stream().map(ReportRefreshProperties.Pipeline::getName).toList();
    }

    private void report(RefreshResult result) {
        if (result.skipped()) {
            log.info("Skipped {}: {}", result.context().describe(), result.reason());
        } else if (result.outcome().isSuccess()) {
            log.info("{} finished, {} stored procedures run", result.context().describe(), result.outcome().getCompletedUnits());
        } else {
            log.warn("{} ended {}", result.context().describe(), result.outcome().getStatus().auditValue());
        }
    }
}
