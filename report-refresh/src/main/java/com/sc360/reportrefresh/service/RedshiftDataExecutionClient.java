package com.sc360.reportrefresh.service;

import com.amazonaws.services.redshiftdataapi.AWSRedshiftDataAPI;
import com.amazonaws.services.redshiftdataapi.model.DescribeStatementRequest;
import com.amazonaws.services.redshiftdataapi.model.DescribeStatementResult;
import com.amazonaws.services.redshiftdataapi.model.ExecuteStatementRequest;
import com.sc360.reportrefresh.config.ReportRefreshProperties;
import com.sc360.reportrefresh.exception.SubmissionException;
import com.sc360.reportrefresh.model.EngineStatus;
import com.sc360.reportrefresh.model.StatementState;
import com.sc360.reportrefresh.model.WorkUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Runs stored procedures through the Redshift Data API.
 *
 * Procedure names cannot be bound as parameters, so they are checked against a strict
 * identifier pattern before being placed in the CALL statement.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RedshiftDataExecutionClient implements StatementExecutionClient {

    // schema.procedure, optionally followed by an argument list without statement separators
    private static final Pattern PROCEDURE_REF =
            Pattern.compile("^[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*)?\\s*(\\([^;]*\\))?$");

    private final AWSRedshiftDataAPI redshiftDataClient;
    private final ReportRefreshProperties properties;

    @Override
    public String submit(WorkUnit unit) {
        String sql = toCallStatement(unit.getName());
        ReportRefreshProperties.Execution execution = properties.getExecution();

        ExecuteStatementRequest request = new ExecuteStatementRequest()
                .withClusterIdentifier(execution.getClusterIdentifier())
                .withDatabase(execution.getDatabase())
                .withSql(sql)
                .withWithEvent(true);
        if (execution.getSecretArn() != null && !execution.getSecretArn().isBlank()) {
            request.setSecretArn(execution.getSecretArn());
        } else {
            request.setDbUser(execution.getDbUser());
        }

        try {
            String queryId = redshiftDataClient.executeStatement(request).getId();
            log.info("Submitted {} as statement {}", sql, queryId);
            return queryId;
        } catch (Exception e) {
            throw new SubmissionException("Could not submit " + sql + ": " + e.getMessage(), e);
        }
    }

    @Override
    public StatementState describe(String queryId) {
        DescribeStatementResult result = redshiftDataClient.describeStatement(
                new DescribeStatementRequest().withId(queryId));
        return new StatementState(EngineStatus.fromValue(result.getStatus()), result.getError());
    }

    static String toCallStatement(String procedureName) {
        String name = procedureName == null ? "" : procedureName.trim();
        if (name.endsWith(";")) {
            name = name.substring(0, name.length() - 1).trim();
        }
        if (!PROCEDURE_REF.matcher(name).matches()) {
            throw new SubmissionException("Invalid stored procedure reference: " + procedureName);
        }
        return "CALL " + name + ";";
    }
}
