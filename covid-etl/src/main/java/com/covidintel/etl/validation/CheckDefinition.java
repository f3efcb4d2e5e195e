package com.covidintel.etl.validation;

import com.covidintel.etl.model.CheckCategory;
import com.covidintel.etl.model.DataTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One registry entry: a named rule, the tables it applies to with the threshold
 * for each, and the counter that evaluates it.
 */
public record CheckDefinition(String name,
                              CheckCategory category,
                              Map<DataTable, Long> thresholds,
                              ViolationCounter counter) {

    public CheckDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Check name is required");
        }
        if (thresholds == null || thresholds.isEmpty()) {
            throw new IllegalArgumentException("Check " + name + " applies to no table");
        }
        thresholds = Collections.unmodifiableMap(new LinkedHashMap<>(thresholds));
    }
}
