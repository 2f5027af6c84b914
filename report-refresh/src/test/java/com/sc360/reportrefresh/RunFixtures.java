package com.sc360.reportrefresh;

import com.sc360.reportrefresh.config.ReportRefreshProperties;
import com.sc360.reportrefresh.model.DataSourceFilter;
import com.sc360.reportrefresh.model.RunContext;
import com.sc360.reportrefresh.model.WorkUnit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Shared test data for refresh runs.
 */
public final class RunFixtures {

    public static final LocalDate BATCH_DATE = LocalDate.of(2026, 10, 17);

    private RunFixtures() {
    }

    public static RunContext.RunContextBuilder spdstEmea() {
        return RunContext.builder()
                .pipeline("spdst-emea")
                .region("EMEA")
                .batchDate(BATCH_DATE)
                .reportSource("SPDST")
                .dataSourceFilter(new DataSourceFilter("BMT", DataSourceFilter.Mode.EXCLUDE))
                .retryLimit(3)
                .reportUrl("https://reports.example.com/sc360/emea");
    }

    public static RunContext run() {
        return spdstEmea().build();
    }

    public static WorkUnit unit(String name, double order) {
        return WorkUnit.builder().name(name).dataSource("SPDST").execOrder(order).build();
    }

    /** Properties with millisecond waits so retry and poll loops finish quickly. */
    public static ReportRefreshProperties fastProperties() {
        ReportRefreshProperties properties = new ReportRefreshProperties();
        properties.getExecution().setPollInterval(Duration.ofMillis(1));
        properties.getExecution().setRetryDelay(Duration.ofMillis(1));
        properties.getAudit().setBackoff(Duration.ofMillis(1));
        properties.getNotification().setOpsTopicArn("arn:aws:sns:us-east-1:000000000000:sc360-ops");
        properties.getNotification().setUsersTopicArn("arn:aws:sns:us-east-1:000000000000:sc360-users");
        return properties;
    }

    /** Clock whose time only moves when a test says so. */
    public static final class MutableClock extends Clock {

        private Instant now;

        public MutableClock(Instant start) {
            this.now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
