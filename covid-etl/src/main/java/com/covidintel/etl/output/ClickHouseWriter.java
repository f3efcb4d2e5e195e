package com.covidintel.etl.output;

import com.covidintel.etl.model.DataTable;
import com.covidintel.etl.model.EnrichedHistoricalPoint;
import com.covidintel.etl.model.EnrichedSnapshot;
import com.covidintel.etl.model.HistoricalPoint;
import com.covidintel.etl.model.PipelineRun;
import com.covidintel.etl.model.QualityReport;
import com.covidintel.etl.model.Snapshot;
import com.covidintel.etl.model.VaccineCoverage;
import com.covidintel.etl.model.ValidationCheck;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
@Slf4j
@RequiredArgsConstructor
public class ClickHouseWriter {

    static final String DATABASE = "covid_intel";
    private static final int BATCH_SIZE = 1000;
    static final String VACCINE_CATEGORY = "vaccination";
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String SNAPSHOT_COLUMNS = """
            (region_type, region_name, country, continent, cases, deaths, recovered, active, critical,
             today_cases, today_deaths, today_recovered, population, tests,
             cases_per_million, deaths_per_million, tests_per_million,
             mortality_rate, recovery_rate, active_rate, data_freshness_hours,
             updated, extraction_date, processed_at, data_source, data_type)
            """;

    private static final String HISTORICAL_COLUMNS = """
            (country, metric, date, value, daily_change, daily_change_pct, value_7day_avg,
             daily_change_7day_avg, year, month, day_of_week, week_of_year)
            """;

    private static final String VACCINE_COLUMNS = """
            (country, date, total_doses, extraction_date, data_source, data_type, data_category)
            """;

    private static final String CHECK_COLUMNS = """
            (run_id, check_name, category, table_name, observed_count, threshold, status, detail, generated_at)
            """;

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring ClickHouse schema exists...");

        jdbcTemplate.execute("CREATE DATABASE IF NOT EXISTS " + DATABASE);

        for (DataTable table : DataTable.regionTables()) {
            jdbcTemplate.execute(String.format("""
                CREATE TABLE IF NOT EXISTS %s.%s
                (
                    region_type           LowCardinality(String),
                    region_name           String,
                    country               Nullable(String),
                    continent             LowCardinality(Nullable(String)),
                    cases                 Nullable(Int64),
                    deaths                Nullable(Int64),
                    recovered             Nullable(Int64),
                    active                Nullable(Int64),
                    critical              Nullable(Int64),
                    today_cases           Nullable(Int64),
                    today_deaths          Nullable(Int64),
                    today_recovered       Nullable(Int64),
                    population            Nullable(Int64),
                    tests                 Nullable(Int64),
                    cases_per_million     Nullable(Float64),
                    deaths_per_million    Nullable(Float64),
                    tests_per_million     Nullable(Float64),
                    mortality_rate        Nullable(Float64),
                    recovery_rate         Nullable(Float64),
                    active_rate           Nullable(Float64),
                    data_freshness_hours  Nullable(Float64),
                    updated               Nullable(DateTime),
                    extraction_date       DateTime,
                    processed_at          DateTime,
                    data_source           LowCardinality(String),
                    data_type             LowCardinality(String)
                )
                ENGINE = ReplacingMergeTree(processed_at)
                PARTITION BY toYYYYMM(extraction_date)
                ORDER BY (region_name, extraction_date)
            """, DATABASE, table.tableName()));
        }

        jdbcTemplate.execute(String.format("""
            CREATE TABLE IF NOT EXISTS %s.%s
            (
                country                 String,
                metric                  LowCardinality(String),
                date                    Date,
                value                   Int64,
                daily_change            Nullable(Int64),
                daily_change_pct        Nullable(Float64),
                value_7day_avg          Nullable(Float64),
                daily_change_7day_avg   Nullable(Float64),
                year                    UInt16,
                month                   UInt8,
                day_of_week             UInt8,
                week_of_year            UInt8
            )
            ENGINE = ReplacingMergeTree()
            PARTITION BY toYYYYMM(date)
            ORDER BY (country, metric, date)
        """, DATABASE, DataTable.HISTORICAL.tableName()));

        jdbcTemplate.execute(String.format("""
            CREATE TABLE IF NOT EXISTS %s.%s
            (
                country           Nullable(String),
                date              Date,
                total_doses       Int64,
                extraction_date   DateTime,
                data_source       LowCardinality(String),
                data_type         LowCardinality(String),
                data_category     LowCardinality(String)
            )
            ENGINE = ReplacingMergeTree(extraction_date)
            PARTITION BY toYYYYMM(date)
            ORDER BY (ifNull(country, ''), date)
        """, DATABASE, DataTable.VACCINES.tableName()));

        jdbcTemplate.execute(String.format("""
            CREATE TABLE IF NOT EXISTS %s.quality_checks
            (
                run_id           String,
                check_name       LowCardinality(String),
                category         LowCardinality(String),
                table_name       LowCardinality(String),
                observed_count   Int64,
                threshold        Int64,
                status           LowCardinality(String),
                detail           String,
                generated_at     DateTime
            )
            ENGINE = MergeTree()
            ORDER BY (generated_at, table_name, check_name)
        """, DATABASE));

        jdbcTemplate.execute(String.format("""
            CREATE TABLE IF NOT EXISTS %s.pipeline_runs
            (
                run_id              String,
                started_at          DateTime,
                completed_at        Nullable(DateTime),
                status              LowCardinality(String),
                records_extracted   Int32,
                records_written     Int32,
                malformed_records   Int32,
                quality_grade       LowCardinality(Nullable(String)),
                error_message       Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY started_at
        """, DATABASE));

        log.info("ClickHouse schema ready.");
    }

    public void writeSnapshots(DataTable table, List<EnrichedSnapshot> rows) {
        insert(table.tableName(), SNAPSHOT_COLUMNS, rows, this::toSnapshotRow);
    }

    public void writeHistorical(List<EnrichedHistoricalPoint> points) {
        insert(DataTable.HISTORICAL.tableName(), HISTORICAL_COLUMNS, points, this::toHistoricalRow);
    }

    public void writeVaccines(List<VaccineCoverage> rows) {
        insert(DataTable.VACCINES.tableName(), VACCINE_COLUMNS, rows, this::toVaccineRow);
    }

    public void writeChecks(QualityReport report) {
        insert("quality_checks", CHECK_COLUMNS, report.getChecks(),
                c -> toCheckRow(report.getRunId(), report.getGeneratedAt(), c));
    }

    public void writePipelineRun(PipelineRun run) {
        try {
            String sql = String.format("""
                INSERT INTO %s.pipeline_runs
                (run_id, started_at, completed_at, status, records_extracted, records_written,
                 malformed_records, quality_grade, error_message)
                VALUES (%s,%s,%s,%s,%d,%d,%d,%s,%s)
                """,
                    DATABASE,
                    sqlStr(run.getRunId()),
                    sqlDateTime(run.getStartedAt()),
                    sqlDateTime(run.getCompletedAt()),
                    sqlStr(run.getStatus()),
                    run.getRecordsExtracted(),
                    run.getRecordsWritten(),
                    run.getMalformedRecords(),
                    sqlStr(run.getQualityGrade()),
                    sqlStr(run.getErrorMessage())
            );
            jdbcTemplate.execute(sql);
        } catch (Exception e) {
            log.warn("Failed to write pipeline run: {}", e.getMessage());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> void insert(String table, String columns, List<T> rows, Function<T, String> toValueRow) {
        if (rows.isEmpty()) return;

        int total = rows.size();
        log.info("Writing {} rows to {}.{} in batches of {}", total, DATABASE, table, BATCH_SIZE);

        for (int i = 0; i < total; i += BATCH_SIZE) {
            List<T> batch = rows.subList(i, Math.min(i + BATCH_SIZE, total));
            try {
                writeBatchAsValues(table, columns, batch, toValueRow);
                log.debug("Wrote batch {}/{}", Math.min(i + BATCH_SIZE, total), total);
            } catch (Exception e) {
                log.error("Batch write to {} failed at offset {}: {}", table, i, e.getMessage(), e);
                throw e;
            }
        }
    }

    /**
     * One INSERT ... VALUES statement per batch; the ClickHouse driver handles this
     * more reliably than PreparedStatement batches.
     */
    private <T> void writeBatchAsValues(String table, String columns, List<T> batch, Function<T, String> toValueRow) {
        String sql = "INSERT INTO " + DATABASE + "." + table + "\n" + columns + "VALUES\n"
                + batch.stream().map(toValueRow).collect(Collectors.joining(",\n"));
        jdbcTemplate.execute(sql);
    }

    String toSnapshotRow(EnrichedSnapshot e) {
        Snapshot s = e.getSnapshot();
        return "(" + String.join(",",
                sqlStr(s.getRegionType().code()),
                sqlStr(s.getRegionName()),
                sqlStr(s.getCountry()),
                sqlStr(s.getContinent()),
                sqlNum(s.getCases()),
                sqlNum(s.getDeaths()),
                sqlNum(s.getRecovered()),
                sqlNum(s.getActive()),
                sqlNum(s.getCritical()),
                sqlNum(s.getTodayCases()),
                sqlNum(s.getTodayDeaths()),
                sqlNum(s.getTodayRecovered()),
                sqlNum(s.getPopulation()),
                sqlNum(s.getTests()),
                sqlNum(e.getCasesPerMillion()),
                sqlNum(e.getDeathsPerMillion()),
                sqlNum(s.getTestsPerOneMillion()),
                sqlNum(e.getMortalityRate()),
                sqlNum(e.getRecoveryRate()),
                sqlNum(e.getActiveRate()),
                sqlNum(e.getDataFreshnessHours()),
                sqlInstant(s.getUpdated()),
                sqlInstant(s.getExtractionDate()),
                sqlInstant(e.getProcessedAt()),
                sqlStr(s.getDataSource()),
                sqlStr(s.getRegionType().table().dataType())
        ) + ")";
    }

    private String toHistoricalRow(EnrichedHistoricalPoint e) {
        HistoricalPoint p = e.getPoint();
        return "(" + String.join(",",
                sqlStr(p.getCountry()),
                sqlStr(p.getMetric().code()),
                sqlStr(p.getDate()),
                String.valueOf(p.getValue()),
                sqlNum(e.getDailyChange()),
                sqlNum(e.getDailyChangePct()),
                sqlNum(e.getValue7DayAvg()),
                sqlNum(e.getDailyChange7DayAvg()),
                String.valueOf(e.getYear()),
                String.valueOf(e.getMonth()),
                String.valueOf(e.getDayOfWeek()),
                String.valueOf(e.getWeekOfYear())
        ) + ")";
    }

    String toVaccineRow(VaccineCoverage v) {
        return "(" + String.join(",",
                sqlStr(v.getCountry()),
                sqlStr(v.getDate()),
                String.valueOf(v.getTotalDoses()),
                sqlInstant(v.getExtractionDate()),
                sqlStr(v.getDataSource()),
                sqlStr(DataTable.VACCINES.dataType()),
                sqlStr(VACCINE_CATEGORY)
        ) + ")";
    }

    private String toCheckRow(String runId, Instant generatedAt, ValidationCheck c) {
        return "(" + String.join(",",
                sqlStr(runId),
                sqlStr(c.getCheckName()),
                sqlStr(c.getCategory().name()),
                sqlStr(c.getTableName()),
                String.valueOf(c.getObservedCount()),
                String.valueOf(c.getThreshold()),
                sqlStr(c.getStatus().name()),
                sqlStr(c.getDetail() == null ? "" : c.getDetail()),
                sqlInstant(generatedAt)
        ) + ")";
    }

    static String sqlStr(Object val) {
        if (val == null) return "NULL";
        return "'" + val.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private static String sqlNum(Number val) {
        if (val == null) return "NULL";
        if (val instanceof Double d && (d.isNaN() || d.isInfinite())) return "NULL";
        return val.toString();
    }

    private static String sqlInstant(Instant val) {
        return val == null ? "NULL" : sqlStr(DATE_TIME.format(val.atOffset(ZoneOffset.UTC)));
    }

    private static String sqlDateTime(LocalDateTime val) {
        return val == null ? "NULL" : sqlStr(DATE_TIME.format(val));
    }
}
