package com.covidintel.etl.model;

public enum CheckCategory {
    STRUCTURAL,
    BUSINESS_RULE,
    TEMPORAL,
    CROSS_TABLE,
    COVERAGE,
    COMPLETENESS
}
