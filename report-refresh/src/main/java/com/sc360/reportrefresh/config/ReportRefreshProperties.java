package com.sc360.reportrefresh.config;

import com.sc360.reportrefresh.model.DataSourceFilter;
import com.sc360.reportrefresh.model.RunContext;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@ConfigurationProperties(prefix = "report-refresh")
@Data
public class ReportRefreshProperties {

    private String env = "dev";
    private String jobName = "sc360-reportrefresh";
    private String logGroup = "/sc360/report-refresh";
    private String awsRegion = "us-east-1";

    private Execution execution = new Execution();
    private Audit audit = new Audit();
    private Notification notification = new Notification();
    private Scheduling scheduling = new Scheduling();
    private List<Pipeline> pipelines = new ArrayList<>();

    @Data
    public static class Execution {
        private String clusterIdentifier;
        private String database;
        private String secretArn;
        private String dbUser;
        private Duration pollInterval = Duration.ofSeconds(120);
        private Duration retryDelay = Duration.ofSeconds(120);
        /** Consecutive describe errors tolerated before the attempt is reported as failed. */
        private int maxDescribeFailures = 1;
    }

    @Data
    public static class Audit {
        private int maxAttempts = 3;
        /** Wait before retry n is backoff * n. */
        private Duration backoff = Duration.ofSeconds(3);
        private boolean initializeSchema = true;
    }

    @Data
    public static class Notification {
        private String opsTopicArn;
        private String usersTopicArn;
        private String reportUrl;
    }

    @Data
    public static class Scheduling {
        private boolean runOnStartup = false;
        /** Pipelines triggered on startup; empty means all of them. */
        private List<String> startupPipelines = new ArrayList<>();
        /** Exit once the startup runs are done, with a non-zero code if one failed. */
        private boolean oneShot = false;
    }

    @Data
    public static class Pipeline {
        private String name;
        private String region;
        private String reportSource = "SPDST";
        private String dataSourcePattern = "BMT";
        private DataSourceFilter.Mode filterMode = DataSourceFilter.Mode.EXCLUDE;
        private String codebase;
        private int retryLimit = 3;
        private String cron;
        private Duration expectedRuntime;
        private String reportUrl;
    }

    public Optional<Pipeline> findPipeline(String name) {
        return pipelines.stream()
                .filter(p -> p.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    public RunContext toRunContext(Pipeline pipeline, LocalDate batchDate) {
        if (pipeline.getRetryLimit() < 1) {
            throw new IllegalStateException("retry-limit must be at least 1 for pipeline " + pipeline.getName());
        }
        return RunContext.builder()
                .pipeline(pipeline.getName())
                .region(pipeline.getRegion())
                .batchDate(batchDate)
                .reportSource(pipeline.getReportSource())
                .codebase(pipeline.getCodebase())
                .dataSourceFilter(new DataSourceFilter(pipeline.getDataSourcePattern(), pipeline.getFilterMode()))
                .retryLimit(pipeline.getRetryLimit())
                .expectedRuntime(pipeline.getExpectedRuntime())
                .reportUrl(pipeline.getReportUrl() != null ? pipeline.getReportUrl() : notification.getReportUrl())
                .build();
    }
}
