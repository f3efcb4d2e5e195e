package com.covidintel.etl.validation;

import com.covidintel.etl.config.CovidEtlProperties;
import com.covidintel.etl.model.CheckCategory;
import com.covidintel.etl.model.DataTable;
import com.covidintel.etl.model.EnrichedHistoricalPoint;
import com.covidintel.etl.model.EnrichedSnapshot;
import com.covidintel.etl.model.TableQualityReport;
import com.covidintel.etl.model.VaccineCoverage;
import com.covidintel.etl.model.ValidationCheck;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds the per-table report shape the loader and monitoring consume.
 *
 * Failed structural and completeness checks count as errors, every other failed
 * check as a warning. Score: 100, minus 20 per error and 5 per warning, minus
 * 50 x the excess null ratio of each field above the allowed maximum, minus
 * 30 x the duplicate ratio once it exceeds 5%; clamped to [0, 100].
 */
public class TableQualityProfiler {

    private static final double ERROR_PENALTY = 20.0;
    private static final double WARNING_PENALTY = 5.0;
    private static final double NULL_PENALTY_FACTOR = 50.0;
    private static final double DUPLICATE_PENALTY_FACTOR = 30.0;
    private static final double DUPLICATE_TOLERANCE = 0.05;

    private final CovidEtlProperties.Quality config;

    public TableQualityProfiler(CovidEtlProperties.Quality config) {
        this.config = config;
    }

    /**
     * @param received       rows delivered per table before enrichment
     * @param historicalDupes historical points dropped as repeated dates
     */
    public List<TableQualityReport> profile(ValidationBatch batch, List<ValidationCheck> checks,
                                            Map<DataTable, Integer> received, int historicalDupes) {
        Instant now = batch.asOf();
        List<TableQualityReport> reports = new ArrayList<>();

        for (DataTable table : DataTable.regionTables()) {
            List<EnrichedSnapshot> rows = batch.rows(table);
            double duplicateRatio = rows.isEmpty() ? 0.0 : (double) StandardChecks.countDuplicates(rows) / rows.size();
            reports.add(build(table, now, rows.size(), received.getOrDefault(table, rows.size()),
                    StandardChecks.nullRatios(rows), duplicateRatio, checks));
        }

        long historicalRows = batch.historicalRowCount();
        int historicalReceived = received.getOrDefault(DataTable.HISTORICAL, (int) historicalRows);
        double historicalDupRatio = historicalReceived == 0 ? 0.0 : (double) historicalDupes / historicalReceived;
        // repeated dates are dropped on purpose, so they do not count as missing rows
        reports.add(build(DataTable.HISTORICAL, now, historicalRows, historicalReceived - historicalDupes,
                historicalNullRatios(batch.historicalPoints().toList()), historicalDupRatio, checks));

        List<VaccineCoverage> vaccines = batch.vaccines();
        double vaccineDupRatio = vaccines.isEmpty() ? 0.0
                : (double) StandardChecks.countVaccineDuplicates(vaccines) / vaccines.size();
        Map<String, Double> vaccineNulls = new LinkedHashMap<>();
        if (!vaccines.isEmpty()) {
            vaccineNulls.put("country", (double) vaccines.stream().filter(v -> v.getCountry() == null).count()
                    / vaccines.size());
        }
        reports.add(build(DataTable.VACCINES, now, vaccines.size(),
                received.getOrDefault(DataTable.VACCINES, vaccines.size()), vaccineNulls, vaccineDupRatio, checks));

        return reports;
    }

    /** Derived column -> share of points where it is null; the first point of a series has no change. */
    static Map<String, Double> historicalNullRatios(List<EnrichedHistoricalPoint> points) {
        Map<String, Double> ratios = new LinkedHashMap<>();
        if (points.isEmpty()) return ratios;
        ratios.put("daily_change", nullRatio(points, EnrichedHistoricalPoint::getDailyChange));
        ratios.put("daily_change_pct", nullRatio(points, EnrichedHistoricalPoint::getDailyChangePct));
        ratios.put("value_7day_avg", nullRatio(points, EnrichedHistoricalPoint::getValue7DayAvg));
        ratios.put("daily_change_7day_avg", nullRatio(points, EnrichedHistoricalPoint::getDailyChange7DayAvg));
        return ratios;
    }

    private static double nullRatio(List<EnrichedHistoricalPoint> points, Function<EnrichedHistoricalPoint, ?> column) {
        return (double) points.stream().filter(p -> column.apply(p) == null).count() / points.size();
    }

    private TableQualityReport build(DataTable table, Instant now, long recordCount, long expectedCount,
                                     Map<String, Double> nullRatios, double duplicateRatio,
                                     List<ValidationCheck> checks) {
        TableQualityReport.TableQualityReportBuilder report = TableQualityReport.builder()
                .tableName(table.tableName())
                .validationTimestamp(now)
                .recordCount(recordCount)
                .expectedCount(expectedCount)
                .countMatch(recordCount == expectedCount)
                .nullPercentages(Collections.unmodifiableMap(new LinkedHashMap<>(nullRatios)))
                .duplicatePercentage(duplicateRatio);

        int errors = 0;
        int warnings = 0;
        for (ValidationCheck check : checks) {
            if (check.isPassed() || !table.tableName().equals(check.getTableName())) continue;
            String message = check.getCheckName() + ": " + check.getDetail();
            if (isError(check.getCategory())) {
                report.error(message);
                errors++;
            } else {
                report.warning(message);
                warnings++;
            }
        }
        if (recordCount != expectedCount) {
            report.warning((expectedCount - recordCount) + " records isolated as malformed");
            warnings++;
        }

        double score = 100.0 - errors * ERROR_PENALTY - warnings * WARNING_PENALTY;
        for (double ratio : nullRatios.values()) {
            if (ratio > config.getMaxNullPercentage()) {
                score -= (ratio - config.getMaxNullPercentage()) * NULL_PENALTY_FACTOR;
            }
        }
        if (duplicateRatio > DUPLICATE_TOLERANCE) {
            score -= duplicateRatio * DUPLICATE_PENALTY_FACTOR;
        }

        return report
                .valid(errors == 0)
                .qualityScore(Math.max(0.0, Math.min(100.0, score)))
                .build();
    }

    private static boolean isError(CheckCategory category) {
        return category == CheckCategory.STRUCTURAL || category == CheckCategory.COMPLETENESS;
    }
}
