package com.covidintel.etl.model;

import java.util.Arrays;
import java.util.Optional;

/** Cumulative metrics published in the historical timelines. */
public enum HistoricalMetric {

    CASES("cases"),
    DEATHS("deaths"),
    RECOVERED("recovered");

    private final String code;

    HistoricalMetric(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<HistoricalMetric> fromCode(String code) {
        if (code == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(m -> m.code.equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
