package com.covidintel.etl.model;

/**
 * Geographic scope of a snapshot. Every variant shares the same enrichment
 * and validation path; only the target table differs.
 */
public enum RegionType {

    GLOBAL("global"),
    COUNTRY("country"),
    CONTINENT("continent"),
    STATE("state");

    private final String code;

    RegionType(String code) {
        this.code = code;
    }

    /** Lower-case value stored in the region_type column. */
    public String code() {
        return code;
    }

    public DataTable table() {
        return switch (this) {
            case GLOBAL -> DataTable.GLOBAL;
            case COUNTRY -> DataTable.COUNTRIES;
            case CONTINENT -> DataTable.CONTINENTS;
            case STATE -> DataTable.STATES;
        };
    }
}
