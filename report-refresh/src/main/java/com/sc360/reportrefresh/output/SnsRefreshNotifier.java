package com.sc360.reportrefresh.output;

import com.amazonaws.services.sns.AmazonSNS;
import com.amazonaws.services.sns.model.PublishRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sc360.reportrefresh.config.ReportRefreshProperties;
import com.sc360.reportrefresh.model.RunContext;
import com.sc360.reportrefresh.model.RunOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes run results to SNS.
 *
 * Operators always get a status message on the ops topic. End users get a
 * completion notice with the report link on the users topic, and only when no unit failed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SnsRefreshNotifier implements RefreshNotifier {

    private final AmazonSNS snsClient;
    private final ObjectMapper objectMapper;
    private final ReportRefreshProperties properties;

    @Override
    public void notify(RunContext run, RunOutcome outcome) {
        boolean failed = !outcome.getFailedUnits().isEmpty();

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("Env", properties.getEnv());
        status.put("Error Message", outcome.getFailedUnits());
        status.put("status", failed ? "Failed" : "Succeeded");
        status.put("Region", run.getRegion());
        status.put("Job_Name", properties.getJobName());
        status.put("Pipeline", run.getPipeline());
        status.put("Batch_Date", run.getBatchDate().toString());
        status.put("Log_Group", properties.getLogGroup());
        if (!outcome.getAuditWarnings().isEmpty()) {
            status.put("Audit_Warnings", outcome.getAuditWarnings());
        }

        publish(properties.getNotification().getOpsTopicArn(),
                String.format("%s %s/Others Report Refresh %s",
                        run.getRegion(), run.getReportSource(), failed ? "Failed" : "Successful"),
                status);

        if (!failed) {
            Map<String, Object> userMessage = new LinkedHashMap<>();
            userMessage.put("Env", properties.getEnv());
            userMessage.put("Message", String.format("%s %s/others Report Refresh is Completed Successfully.",
                    run.getRegion(), run.getReportSource()));
            userMessage.put("Report_Url", run.getReportUrl());

            publish(properties.getNotification().getUsersTopicArn(),
                    String.format("%s %s/others Report Refresh Successful", run.getRegion(), run.getReportSource()),
                    userMessage);
        }
    }

    private void publish(String topicArn, String subject, Map<String, Object> message) {
        if (topicArn == null || topicArn.isBlank()) {
            log.warn("No SNS topic configured, skipping notification: {}", subject);
            return;
        }
        try {
            snsClient.publish(new PublishRequest()
                    .withTargetArn(topicArn)
                    .withSubject(subject)
                    .withMessage(objectMapper.writeValueAsString(message)));
            log.info("Published SNS notification: {}", subject);
        } catch (JsonProcessingException e) {
            log.error("Could not serialise notification '{}': {}", subject, e.getMessage(), e);
        } catch (Exception e) {
            log.error("Failed to publish SNS notification '{}': {}", subject, e.getMessage(), e);
        }
    }
}
