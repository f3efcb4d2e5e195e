package com.covidintel.etl.service;

import com.covidintel.etl.model.DataTable;
import com.covidintel.etl.model.HistoricalPoint;
import com.covidintel.etl.model.RegionType;
import com.covidintel.etl.model.Snapshot;
import com.covidintel.etl.model.VaccineCoverage;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Extracted, not yet enriched input for one pipeline run.
 *
 * @param snapshots          rows per region endpoint; a missing key means the table was absent
 * @param historical         flattened timeline points, any order
 * @param vaccines           flattened vaccine coverage rows, any order
 * @param extractionMalformed elements rejected before mapping, per table
 */
public record RawBatch(Map<RegionType, List<Snapshot>> snapshots,
                       List<HistoricalPoint> historical,
                       List<VaccineCoverage> vaccines,
                       Map<DataTable, Integer> extractionMalformed) {

    public RawBatch {
        snapshots = snapshots == null ? Map.of() : Map.copyOf(snapshots);
        historical = historical == null ? List.of() : List.copyOf(historical);
        vaccines = vaccines == null ? List.of() : List.copyOf(vaccines);
        extractionMalformed = extractionMalformed == null ? Map.of() : Map.copyOf(extractionMalformed);
    }

    public RawBatch(Map<RegionType, List<Snapshot>> snapshots, List<HistoricalPoint> historical) {
        this(snapshots, historical, List.of(), new EnumMap<>(DataTable.class));
    }

    public int recordCount() {
        return snapshots.values().stream().mapToInt(List::size).sum() + historical.size() + vaccines.size();
    }

    public int totalExtractionMalformed() {
        return extractionMalformed.values().stream().mapToInt(Integer::intValue).sum();
    }
}
