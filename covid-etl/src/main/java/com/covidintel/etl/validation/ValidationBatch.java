package com.covidintel.etl.validation;

import com.covidintel.etl.model.DataTable;
import com.covidintel.etl.model.EnrichedHistoricalPoint;
import com.covidintel.etl.model.EnrichedSnapshot;
import com.covidintel.etl.model.SeriesAnalysis;
import com.covidintel.etl.model.VaccineCoverage;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Everything the checks look at for one run. Built only after both snapshot and
 * historical enrichment have finished. A table missing from the map reads as zero rows.
 *
 * @param asOf reference instant for freshness and recency rules
 */
public record ValidationBatch(Map<DataTable, List<EnrichedSnapshot>> snapshots,
                              List<SeriesAnalysis> series,
                              List<VaccineCoverage> vaccines,
                              Instant asOf) {

    public ValidationBatch {
        snapshots = snapshots == null ? Map.of() : Map.copyOf(snapshots);
        series = series == null ? List.of() : List.copyOf(series);
        vaccines = vaccines == null ? List.of() : List.copyOf(vaccines);
    }

    public ValidationBatch(Map<DataTable, List<EnrichedSnapshot>> snapshots, List<SeriesAnalysis> series, Instant asOf) {
        this(snapshots, series, List.of(), asOf);
    }

    public List<EnrichedSnapshot> rows(DataTable table) {
        return snapshots.getOrDefault(table, List.of());
    }

    public Stream<EnrichedHistoricalPoint> historicalPoints() {
        return series.stream().flatMap(s -> s.points().stream());
    }

    public long historicalRowCount() {
        return series.stream().mapToLong(s -> s.points().size()).sum();
    }

    public long rowCount(DataTable table) {
        return switch (table) {
            case HISTORICAL -> historicalRowCount();
            case VACCINES -> vaccines.size();
            default -> rows(table).size();
        };
    }

    /** Observation dates of a dated table; empty for snapshot tables. */
    public Stream<LocalDate> dates(DataTable table) {
        return switch (table) {
            case HISTORICAL -> historicalPoints().map(p -> p.getPoint().getDate());
            case VACCINES -> vaccines.stream().map(VaccineCoverage::getDate);
            default -> Stream.empty();
        };
    }
}
