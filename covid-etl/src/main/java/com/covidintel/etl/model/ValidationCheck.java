package com.covidintel.etl.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one named rule against one table (or table pair).
 * Status is derived: observedCount <= threshold passes, unless the rule itself errored.
 */
@Value
@Builder
public class ValidationCheck {

    String checkName;
    CheckCategory category;
    String tableName;

    /** Rows (or units) violating the rule */
    long observedCount;

    /** Maximum tolerated violations */
    long threshold;

    /** Human-readable context, e.g. "3 rows, expected at least 6" */
    String detail;

    /** The counter threw; always a failure whatever the threshold */
    boolean errored;

    public CheckStatus getStatus() {
        return !errored && observedCount <= threshold ? CheckStatus.PASS : CheckStatus.FAIL;
    }

    public boolean isPassed() {
        return getStatus() == CheckStatus.PASS;
    }
}
