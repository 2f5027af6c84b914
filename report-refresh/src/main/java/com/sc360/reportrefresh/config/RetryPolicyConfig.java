package com.sc360.reportrefresh.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Retry policies for the audit store and the work-list lookup.
 * Both use a linear backoff (backoff * attempt), which the YAML retry config cannot express.
 */
@Configuration
@Slf4j
public class RetryPolicyConfig {

    public static final String AUDIT_STORE = "auditStore";
    public static final String WORK_LIST = "workList";

    @Bean
    public Retry auditStoreRetry(RetryRegistry registry, ReportRefreshProperties properties) {
        ReportRefreshProperties.Audit audit = properties.getAudit();
        return logged(registry.retry(AUDIT_STORE, linearBackoff(audit.getMaxAttempts(), audit.getBackoff())));
    }

    @Bean
    public Retry workListRetry(RetryRegistry registry, ReportRefreshProperties properties) {
        ReportRefreshProperties.Audit audit = properties.getAudit();
        return logged(registry.retry(WORK_LIST, linearBackoff(audit.getMaxAttempts(), audit.getBackoff())));
    }

    public static RetryConfig linearBackoff(int maxAttempts, Duration backoff) {
        long stepMs = backoff.toMillis();
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.of(Duration.ofMillis(stepMs), interval -> interval + stepMs))
                .build();
    }

    public static Retry logged(Retry retry) {
        retry.getEventPublisher()
                .onRetry(e -> log.warn("[{}] Attempt {} failed, retrying in {} ms: {}",
                        e.getName(), e.getNumberOfRetryAttempts(), e.getWaitInterval().toMillis(),
                        e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : "n/a"))
                .onError(e -> log.error("[{}] Giving up after {} attempts: {}",
                        e.getName(), e.getNumberOfRetryAttempts(),
                        e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : "n/a"));
        return retry;
    }
}
