package com.sc360.reportrefresh.model;

import lombok.Builder;
import lombok.Value;

/**
 * One stored procedure from the refresh work list.
 * Read from audit.sc360_reportrefresh and never changed for the rest of the run.
 */
@Value
@Builder
public class WorkUnit {

    /** Procedure reference as stored in the work list, e.g. "sc360.sp_refresh_orders()" */
    String name;

    /** file_datasource tag, e.g. BMT or SPDST */
    String dataSource;

    /** Ascending execution order. Equal values keep the order the provider returned them in. */
    double execOrder;
}
