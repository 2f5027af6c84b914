package com.sc360.reportrefresh.service;

import com.sc360.reportrefresh.exception.SubmissionException;
import com.sc360.reportrefresh.model.StatementState;
import com.sc360.reportrefresh.model.WorkUnit;

/**
 * Asynchronous SQL execution engine that runs the refresh procedures.
 */
public interface StatementExecutionClient {

    /**
     * Submits the unit's CALL statement and returns without waiting for it.
     *
     * @return the engine's statement id
     * @throws SubmissionException if the engine did not accept the statement
     */
    String submit(WorkUnit unit);

    StatementState describe(String queryId);
}
