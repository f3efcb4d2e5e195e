package com.covidintel.etl.model;

import java.util.Arrays;
import java.util.List;

/**
 * Warehouse tables the pipeline loads and validates.
 * CROSS_TABLE is not a physical table; it labels checks that join two tables.
 */
public enum DataTable {

    GLOBAL("covid_global", RegionType.GLOBAL),
    COUNTRIES("covid_countries", RegionType.COUNTRY),
    CONTINENTS("covid_continents", RegionType.CONTINENT),
    STATES("covid_states", RegionType.STATE),
    HISTORICAL("covid_historical", null),
    VACCINES("covid_vaccines", null),
    CROSS_TABLE("cross_table_consistency", null);

    private final String tableName;
    private final RegionType regionType;

    DataTable(String tableName, RegionType regionType) {
        this.tableName = tableName;
        this.regionType = regionType;
    }

    public String tableName() {
        return tableName;
    }

    /** Source dataset label stored in the data_type column, e.g. "countries". */
    public String dataType() {
        return tableName.startsWith("covid_") ? tableName.substring("covid_".length()) : tableName;
    }

    public boolean isRegionTable() {
        return regionType != null;
    }

    public static List<DataTable> regionTables() {
        return Arrays.stream(values()).filter(DataTable::isRegionTable).toList();
    }
}
