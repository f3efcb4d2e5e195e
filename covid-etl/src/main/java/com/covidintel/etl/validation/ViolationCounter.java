package com.covidintel.etl.validation;

import com.covidintel.etl.model.DataTable;

/**
 * Counts rule violations in one table of a batch.
 */
@FunctionalInterface
public interface ViolationCounter {

    CheckOutcome count(ValidationBatch batch, DataTable table);
}
