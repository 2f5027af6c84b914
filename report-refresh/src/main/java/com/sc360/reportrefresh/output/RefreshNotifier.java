package com.sc360.reportrefresh.output;

import com.sc360.reportrefresh.model.RunContext;
import com.sc360.reportrefresh.model.RunOutcome;

/**
 * Sink for end-of-run notifications. Best effort: implementations log delivery
 * problems and never throw.
 */
public interface RefreshNotifier {

    void notify(RunContext run, RunOutcome outcome);
}
