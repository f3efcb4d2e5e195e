package com.covidintel.etl.model;

import java.util.function.Function;

/**
 * Numeric snapshot fields that completeness and null-ratio checks look at.
 */
public enum SnapshotField {

    CASES("cases", Snapshot::getCases, false),
    DEATHS("deaths", Snapshot::getDeaths, false),
    RECOVERED("recovered", Snapshot::getRecovered, false),
    ACTIVE("active", Snapshot::getActive, false),
    CRITICAL("critical", Snapshot::getCritical, false),
    TESTS("tests", Snapshot::getTests, false),
    // population of 0 is as useless as none for per-capita figures
    POPULATION("population", Snapshot::getPopulation, true);

    private final String column;
    private final Function<Snapshot, Long> accessor;
    private final boolean zeroMeansMissing;

    SnapshotField(String column, Function<Snapshot, Long> accessor, boolean zeroMeansMissing) {
        this.column = column;
        this.accessor = accessor;
        this.zeroMeansMissing = zeroMeansMissing;
    }

    public String column() {
        return column;
    }

    public Long read(Snapshot snapshot) {
        return accessor.apply(snapshot);
    }

    public boolean isMissing(Snapshot snapshot) {
        Long value = read(snapshot);
        return value == null || (zeroMeansMissing && value == 0L);
    }
}
