package com.covidintel.etl.output;

import com.opencsv.CSVWriter;
import com.covidintel.etl.config.CovidEtlProperties;
import com.covidintel.etl.model.DataTable;
import com.covidintel.etl.model.EnrichedHistoricalPoint;
import com.covidintel.etl.model.EnrichedSnapshot;
import com.covidintel.etl.model.HistoricalPoint;
import com.covidintel.etl.model.QualityReport;
import com.covidintel.etl.model.Snapshot;
import com.covidintel.etl.model.VaccineCoverage;
import com.covidintel.etl.model.ValidationCheck;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.Function;

/**
 * Writes enriched tables and check results to CSV files.
 *
 * Output path pattern: {outputDir}/covid_{table}_{yyyyMMdd_HHmmss}.csv
 * e.g. /data/output/covid_countries_20240301_060000.csv
 *
 * These CSVs can be loaded into ClickHouse via:
 *   INSERT INTO covid_intel.covid_countries FROM INFILE '/data/output/covid_countries_*.csv' FORMAT CSVWithNames
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    static final String[] SNAPSHOT_HEADERS = {
            "region_type", "region_name", "country", "continent",
            "cases", "deaths", "recovered", "active", "critical",
            "today_cases", "today_deaths", "today_recovered",
            "population", "tests",
            "cases_per_million", "deaths_per_million", "tests_per_million",
            "mortality_rate", "recovery_rate", "active_rate", "data_freshness_hours",
            "updated", "extraction_date", "processed_at", "data_source", "data_type"
    };

    static final String[] HISTORICAL_HEADERS = {
            "country", "metric", "date", "value",
            "daily_change", "daily_change_pct", "value_7day_avg", "daily_change_7day_avg",
            "year", "month", "day_of_week", "week_of_year"
    };

    static final String[] VACCINE_HEADERS = {
            "country", "date", "total_doses", "extraction_date", "data_source", "data_type", "data_category"
    };

    static final String[] CHECK_HEADERS = {
            "run_id", "check_name", "category", "table_name",
            "observed_count", "threshold", "status", "detail"
    };

    private final CovidEtlProperties properties;

    public Path writeSnapshots(DataTable table, List<EnrichedSnapshot> rows, LocalDateTime runTime) {
        return write(fileStem(table.tableName()), runTime, SNAPSHOT_HEADERS, rows, this::toSnapshotRow);
    }

    public Path writeHistorical(List<EnrichedHistoricalPoint> points, LocalDateTime runTime) {
        return write(fileStem(DataTable.HISTORICAL.tableName()), runTime, HISTORICAL_HEADERS, points, this::toHistoricalRow);
    }

    public Path writeVaccines(List<VaccineCoverage> rows, LocalDateTime runTime) {
        return write(fileStem(DataTable.VACCINES.tableName()), runTime, VACCINE_HEADERS, rows, this::toVaccineRow);
    }

    public Path writeChecks(QualityReport report, LocalDateTime runTime) {
        return write("covid_quality_checks", runTime, CHECK_HEADERS, report.getChecks(),
                c -> toCheckRow(report.getRunId(), c));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /** covid_countries -> covid_countries, cross-table names keep their own prefix */
    private String fileStem(String tableName) {
        return tableName.startsWith("covid_") ? tableName : "covid_" + tableName;
    }

    private <T> Path write(String stem, LocalDateTime runTime, String[] headers, List<T> rows, Function<T, String[]> toRow) {
        if (rows.isEmpty()) return null;

        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        Path outputPath = outputDir.resolve(String.format("%s_%s.csv", stem, FILE_STAMP.format(runTime)));

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(headers);
            }

            for (T row : rows) {
                writer.writeNext(toRow.apply(row));
            }

            log.info("Written {} rows to CSV: {}", rows.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed: " + outputPath, e);
        }
    }

    private String[] toSnapshotRow(EnrichedSnapshot e) {
        Snapshot s = e.getSnapshot();
        return new String[]{
                str(s.getRegionType().code()),
                str(s.getRegionName()),
                str(s.getCountry()),
                str(s.getContinent()),
                str(s.getCases()),
                str(s.getDeaths()),
                str(s.getRecovered()),
                str(s.getActive()),
                str(s.getCritical()),
                str(s.getTodayCases()),
                str(s.getTodayDeaths()),
                str(s.getTodayRecovered()),
                str(s.getPopulation()),
                str(s.getTests()),
                str(e.getCasesPerMillion()),
                str(e.getDeathsPerMillion()),
                str(s.getTestsPerOneMillion()),
                str(e.getMortalityRate()),
                str(e.getRecoveryRate()),
                str(e.getActiveRate()),
                str(e.getDataFreshnessHours()),
                str(s.getUpdated()),
                str(s.getExtractionDate()),
                str(e.getProcessedAt()),
                str(s.getDataSource()),
                str(s.getRegionType().table().dataType())
        };
    }

    private String[] toHistoricalRow(EnrichedHistoricalPoint e) {
        HistoricalPoint p = e.getPoint();
        return new String[]{
                str(p.getCountry()),
                str(p.getMetric().code()),
                str(p.getDate()),
                str(p.getValue()),
                str(e.getDailyChange()),
                str(e.getDailyChangePct()),
                str(e.getValue7DayAvg()),
                str(e.getDailyChange7DayAvg()),
                str(e.getYear()),
                str(e.getMonth()),
                str(e.getDayOfWeek()),
                str(e.getWeekOfYear())
        };
    }

    private String[] toVaccineRow(VaccineCoverage v) {
        return new String[]{
                str(v.getCountry()),
                str(v.getDate()),
                str(v.getTotalDoses()),
                str(v.getExtractionDate()),
                str(v.getDataSource()),
                str(DataTable.VACCINES.dataType()),
                ClickHouseWriter.VACCINE_CATEGORY
        };
    }

    private String[] toCheckRow(String runId, ValidationCheck c) {
        return new String[]{
                str(runId),
                str(c.getCheckName()),
                str(c.getCategory()),
                str(c.getTableName()),
                str(c.getObservedCount()),
                str(c.getThreshold()),
                str(c.getStatus()),
                str(c.getDetail())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
