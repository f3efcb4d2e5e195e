package com.covidintel.etl.validation;

import com.covidintel.etl.config.CovidEtlProperties;
import com.covidintel.etl.model.CheckCategory;
import com.covidintel.etl.model.DataTable;
import com.covidintel.etl.model.EnrichedHistoricalPoint;
import com.covidintel.etl.model.EnrichedSnapshot;
import com.covidintel.etl.model.HistoricalMetric;
import com.covidintel.etl.model.HistoricalPoint;
import com.covidintel.etl.model.SeriesAnalysis;
import com.covidintel.etl.model.Snapshot;
import com.covidintel.etl.model.SnapshotField;
import com.covidintel.etl.model.VaccineCoverage;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Builds the default check registry from quality configuration.
 *
 * Default thresholds live here; any of them can be replaced through
 * {@code thresholdOverrides} keyed by check name, or by {@code name.table_name}
 * for a single table. Checks named in {@code disabledChecks} are left out.
 */
public class StandardChecks {

    public static final String DUPLICATE_KEYS = "duplicate_keys";
    public static final String NULL_REQUIRED_FIELDS = "null_required_fields";
    public static final String NEGATIVE_COUNTS = "negative_counts";
    public static final String CASES_CONSISTENCY = "cases_consistency";
    public static final String MORTALITY_OUTLIER = "mortality_outlier";
    public static final String ACTIVE_CALC_MISMATCH = "active_calc_mismatch";
    public static final String DATA_FRESHNESS = "data_freshness";
    public static final String EXTRACTION_RECENCY = "extraction_recency";
    public static final String MINIMUM_VOLUME = "minimum_volume";
    public static final String HISTORICAL_GAP = "historical_gap";
    public static final String HISTORICAL_COMPLETENESS = "historical_completeness";
    public static final String NEGATIVE_CHANGE_ANOMALY = "negative_change_anomaly";
    public static final String CROSS_TABLE_DRIFT = "cross_table_drift";
    public static final String GEOGRAPHIC_COVERAGE = "geographic_coverage";
    public static final String METRIC_COMPLETENESS = "metric_completeness";
    public static final String HISTORICAL_DATE_RANGE = "historical_date_range";
    public static final String VACCINE_DOSES_DECREASE = "vaccine_doses_decrease";

    private final CovidEtlProperties.Quality config;

    public StandardChecks(CovidEtlProperties.Quality config) {
        this.config = config;
    }

    public CheckRegistry build() {
        List<DataTable> regions = DataTable.regionTables();
        CheckRegistry registry = new CheckRegistry();

        registry.register(define(DUPLICATE_KEYS, CheckCategory.STRUCTURAL, regions, 0, this::duplicateKeys));
        registry.register(define(NULL_REQUIRED_FIELDS, CheckCategory.STRUCTURAL, regions, 0,
                rowRule(s -> s.getRegionName() == null || s.getRegionName().isBlank())));
        registry.register(define(NEGATIVE_COUNTS, CheckCategory.STRUCTURAL, regions, 0,
                rowRule(s -> isNegative(s.getCases()) || isNegative(s.getDeaths()) || isNegative(s.getRecovered()))));
        registry.register(define(CASES_CONSISTENCY, CheckCategory.BUSINESS_RULE, regions, 0,
                rowRule(this::casesInconsistent)));
        registry.register(define(MORTALITY_OUTLIER, CheckCategory.BUSINESS_RULE, regions, 100,
                enrichedRule(this::mortalityOutlier)));
        registry.register(define(ACTIVE_CALC_MISMATCH, CheckCategory.BUSINESS_RULE, regions, 0,
                rowRule(this::activeMismatch)));
        registry.register(define(DATA_FRESHNESS, CheckCategory.TEMPORAL, regions, 0, this::staleRows));
        registry.register(define(EXTRACTION_RECENCY, CheckCategory.COVERAGE, regions, 0, this::extractionRecency));
        List<DataTable> volumeTables = new ArrayList<>(regions);
        volumeTables.add(DataTable.VACCINES);
        registerIfAny(registry, MINIMUM_VOLUME, CheckCategory.COMPLETENESS,
                volumeTables.stream().filter(config.getMinimumVolume()::containsKey).toList(), 0, this::minimumVolume);

        List<DataTable> historical = List.of(DataTable.HISTORICAL);
        registry.register(define(HISTORICAL_GAP, CheckCategory.TEMPORAL, historical, 100, this::historicalGaps));
        registry.register(define(HISTORICAL_COMPLETENESS, CheckCategory.TEMPORAL, historical, 5, this::incompleteSeries));
        registry.register(define(NEGATIVE_CHANGE_ANOMALY, CheckCategory.TEMPORAL, historical, 50, this::negativeChanges));
        registry.register(define(HISTORICAL_DATE_RANGE, CheckCategory.TEMPORAL,
                List.of(DataTable.HISTORICAL, DataTable.VACCINES), 0, this::datesOutOfRange));

        List<DataTable> vaccines = List.of(DataTable.VACCINES);
        registry.register(define(DUPLICATE_KEYS, CheckCategory.STRUCTURAL, vaccines, 0, this::duplicateVaccineKeys));
        registry.register(define(NULL_REQUIRED_FIELDS, CheckCategory.STRUCTURAL, vaccines, 0,
                (batch, table) -> CheckOutcome.rows(batch.vaccines().stream().filter(v -> v.getCountry() == null).count())));
        registry.register(define(VACCINE_DOSES_DECREASE, CheckCategory.BUSINESS_RULE, vaccines, 10,
                this::decreasingDoses));

        registry.register(define(CROSS_TABLE_DRIFT, CheckCategory.CROSS_TABLE, List.of(DataTable.CROSS_TABLE), 20,
                this::crossTableDrift));

        Map<DataTable, Long> coverage = new EnumMap<>(DataTable.class);
        coverage.put(DataTable.CONTINENTS, threshold(GEOGRAPHIC_COVERAGE, DataTable.CONTINENTS, 0));
        coverage.put(DataTable.COUNTRIES, threshold(GEOGRAPHIC_COVERAGE, DataTable.COUNTRIES, 2));
        coverage.put(DataTable.STATES, threshold(GEOGRAPHIC_COVERAGE, DataTable.STATES, 3));
        registry.register(new CheckDefinition(GEOGRAPHIC_COVERAGE, CheckCategory.COVERAGE, coverage,
                this::geographicCoverage));

        registerIfAny(registry, METRIC_COMPLETENESS, CheckCategory.COMPLETENESS,
                regions.stream().filter(config.getRequiredFields()::containsKey).toList(), 0, this::fieldCompleteness);
        registry.register(define(METRIC_COMPLETENESS, CheckCategory.COMPLETENESS, historical, 50,
                this::historicalMetricCompleteness));

        return registry.removeAll(config.getDisabledChecks());
    }

    // ── Registry helpers ─────────────────────────────────────────────────────

    private CheckDefinition define(String name, CheckCategory category, List<DataTable> tables,
                                   long defaultThreshold, ViolationCounter counter) {
        Map<DataTable, Long> thresholds = new EnumMap<>(DataTable.class);
        tables.forEach(t -> thresholds.put(t, threshold(name, t, defaultThreshold)));
        return new CheckDefinition(name, category, thresholds, counter);
    }

    private void registerIfAny(CheckRegistry registry, String name, CheckCategory category, List<DataTable> tables,
                               long defaultThreshold, ViolationCounter counter) {
        if (!tables.isEmpty()) {
            registry.register(define(name, category, tables, defaultThreshold, counter));
        }
    }

    long threshold(String name, DataTable table, long defaultThreshold) {
        Map<String, Long> overrides = config.getThresholdOverrides();
        Long perTable = overrides.get(name + "." + table.tableName());
        if (perTable != null) return perTable;
        return overrides.getOrDefault(name, defaultThreshold);
    }

    private static ViolationCounter rowRule(Predicate<Snapshot> violates) {
        return enrichedRule(e -> violates.test(e.getSnapshot()));
    }

    private static ViolationCounter enrichedRule(Predicate<EnrichedSnapshot> violates) {
        return (batch, table) -> CheckOutcome.rows(batch.rows(table).stream().filter(violates).count());
    }

    private static boolean isNegative(Long value) {
        return value != null && value < 0;
    }

    // ── Structural / business rules ──────────────────────────────────────────

    private CheckOutcome duplicateKeys(ValidationBatch batch, DataTable table) {
        long extra = countDuplicates(batch.rows(table));
        return new CheckOutcome(extra, extra + " rows share a (region, extraction_date) key with another row");
    }

    /** Rows beyond the first for each (region name, extraction date) key. */
    public static long countDuplicates(List<EnrichedSnapshot> rows) {
        Map<List<Object>, Long> byKey = rows.stream()
                .map(EnrichedSnapshot::getSnapshot)
                .collect(Collectors.groupingBy(
                        s -> Arrays.<Object>asList(s.getRegionName(), s.getExtractionDate()),
                        Collectors.counting()));
        return byKey.values().stream().mapToLong(c -> c - 1).sum();
    }

    private boolean casesInconsistent(Snapshot s) {
        if (s.getCases() == null || s.getDeaths() == null || s.getRecovered() == null) return false;
        return s.getCases() > 0 && s.getCases() < s.getDeaths() + s.getRecovered();
    }

    private boolean mortalityOutlier(EnrichedSnapshot e) {
        Long cases = e.getSnapshot().getCases();
        return e.getMortalityRate() != null
                && e.getMortalityRate() > config.getMortalityOutlierRate()
                && cases != null && cases >= config.getMortalityOutlierMinCases();
    }

    private boolean activeMismatch(Snapshot s) {
        if (s.getCases() == null || s.getDeaths() == null || s.getRecovered() == null || s.getActive() == null) {
            return false;
        }
        if (s.getCases() <= config.getActiveMismatchMinCases()) return false;
        long expectedActive = s.getCases() - s.getDeaths() - s.getRecovered();
        return Math.abs(s.getActive() - expectedActive) > s.getCases() * config.getActiveMismatchTolerance();
    }

    // ── Freshness / volume ───────────────────────────────────────────────────

    private CheckOutcome staleRows(ValidationBatch batch, DataTable table) {
        Instant cutoff = batch.asOf().minus(Duration.ofHours(config.getFreshnessWindowHours()));
        long stale = batch.rows(table).stream()
                .map(e -> e.getSnapshot().getUpdated())
                .filter(Objects::nonNull)
                .filter(updated -> updated.isBefore(cutoff))
                .count();
        return new CheckOutcome(stale, stale + " rows updated more than " + config.getFreshnessWindowHours() + "h ago");
    }

    private CheckOutcome extractionRecency(ValidationBatch batch, DataTable table) {
        Optional<Instant> latest = batch.rows(table).stream()
                .map(e -> e.getSnapshot().getExtractionDate())
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder());
        if (latest.isEmpty()) {
            return new CheckOutcome(0, "no extraction timestamps");
        }
        Instant cutoff = batch.asOf().minus(Duration.ofHours(config.getExtractionRecencyHours()));
        boolean stale = latest.get().isBefore(cutoff);
        return new CheckOutcome(stale ? 1 : 0, "latest extraction " + latest.get());
    }

    private CheckOutcome minimumVolume(ValidationBatch batch, DataTable table) {
        long floor = config.getMinimumVolume().getOrDefault(table, 0L);
        long rows = batch.rowCount(table);
        long shortfall = Math.max(0, floor - rows);
        return new CheckOutcome(shortfall, rows + " rows, expected at least " + floor);
    }

    // ── Historical ───────────────────────────────────────────────────────────

    private CheckOutcome historicalGaps(ValidationBatch batch, DataTable table) {
        long gaps = batch.series().stream().mapToLong(SeriesAnalysis::gapCount).sum();
        long gappedSeries = batch.series().stream().filter(s -> s.gapCount() > 0).count();
        return new CheckOutcome(gaps, gaps + " gaps across " + gappedSeries + " series");
    }

    private CheckOutcome incompleteSeries(ValidationBatch batch, DataTable table) {
        List<String> incomplete = batch.series().stream()
                .filter(s -> s.key().metric() == HistoricalMetric.CASES)
                .filter(SeriesAnalysis::incomplete)
                .map(s -> s.key().country())
                .toList();
        return new CheckOutcome(incomplete.size(), "incomplete cases series: " + incomplete);
    }

    private CheckOutcome negativeChanges(ValidationBatch batch, DataTable table) {
        long anomalies = batch.series().stream().mapToLong(s -> s.anomalyDates().size()).sum();
        return new CheckOutcome(anomalies, anomalies + " daily changes below the configured floor");
    }

    private CheckOutcome historicalMetricCompleteness(ValidationBatch batch, DataTable table) {
        Map<String, Set<LocalDate>> allDays = new HashMap<>();
        Map<String, Map<HistoricalMetric, Integer>> metricDays = new HashMap<>();

        for (SeriesAnalysis s : batch.series()) {
            String country = s.key().country();
            Set<LocalDate> days = allDays.computeIfAbsent(country, c -> new HashSet<>());
            s.points().forEach(p -> days.add(p.getPoint().getDate()));
            metricDays.computeIfAbsent(country, c -> new EnumMap<>(HistoricalMetric.class))
                    .merge(s.key().metric(), s.points().size(), Integer::sum);
        }

        double floor = config.getMinMetricCompleteness();
        long incomplete = allDays.entrySet().stream()
                .filter(entry -> {
                    int total = entry.getValue().size();
                    Map<HistoricalMetric, Integer> counts = metricDays.get(entry.getKey());
                    return counts.getOrDefault(HistoricalMetric.CASES, 0) < total * floor
                            || counts.getOrDefault(HistoricalMetric.DEATHS, 0) < total * floor;
                })
                .count();
        return new CheckOutcome(incomplete, incomplete + " countries with cases or deaths below "
                + Math.round(floor * 100) + "% of their days");
    }

    private CheckOutcome datesOutOfRange(ValidationBatch batch, DataTable table) {
        LocalDate earliest = config.getEarliestDataDate();
        LocalDate latest = LocalDate.ofInstant(batch.asOf(), ZoneOffset.UTC).plusDays(config.getMaxFutureDays());
        long early = batch.dates(table).filter(d -> d.isBefore(earliest)).count();
        long future = batch.dates(table).filter(d -> d.isAfter(latest)).count();
        return new CheckOutcome(early + future,
                early + " rows dated before " + earliest + ", " + future + " rows dated after " + latest);
    }

    // ── Vaccines ─────────────────────────────────────────────────────────────

    private CheckOutcome duplicateVaccineKeys(ValidationBatch batch, DataTable table) {
        long extra = countVaccineDuplicates(batch.vaccines());
        return new CheckOutcome(extra, extra + " rows share a (country, date) key with another row");
    }

    /** Rows beyond the first for each (country, date) key. */
    public static long countVaccineDuplicates(List<VaccineCoverage> rows) {
        Map<List<Object>, Long> byKey = rows.stream()
                .collect(Collectors.groupingBy(v -> Arrays.<Object>asList(v.getCountry(), v.getDate()),
                        Collectors.counting()));
        return byKey.values().stream().mapToLong(c -> c - 1).sum();
    }

    /** Days on which a country's cumulative dose count is lower than on its previous reported day. */
    private CheckOutcome decreasingDoses(ValidationBatch batch, DataTable table) {
        Map<String, List<VaccineCoverage>> byCountry = batch.vaccines().stream()
                .filter(v -> v.getCountry() != null)
                .collect(Collectors.groupingBy(VaccineCoverage::getCountry));

        long decreases = 0;
        Set<String> countries = new TreeSet<>();
        for (Map.Entry<String, List<VaccineCoverage>> entry : byCountry.entrySet()) {
            List<VaccineCoverage> ordered = entry.getValue().stream()
                    .sorted(Comparator.comparing(VaccineCoverage::getDate))
                    .toList();
            for (int i = 1; i < ordered.size(); i++) {
                if (ordered.get(i).getTotalDoses() < ordered.get(i - 1).getTotalDoses()) {
                    decreases++;
                    countries.add(entry.getKey());
                }
            }
        }
        return new CheckOutcome(decreases, decreases + " cumulative dose decreases in " + countries);
    }

    // ── Cross-table ──────────────────────────────────────────────────────────

    private CheckOutcome crossTableDrift(ValidationBatch batch, DataTable table) {
        LocalDate today = LocalDate.ofInstant(batch.asOf(), ZoneOffset.UTC);
        LocalDate windowStart = today.minusDays(config.getCrossTableWindowDays());

        Map<String, Map<HistoricalMetric, Long>> latest = new HashMap<>();
        for (SeriesAnalysis s : batch.series()) {
            s.points().stream()
                    .map(EnrichedHistoricalPoint::getPoint)
                    .filter(p -> !p.getDate().isBefore(windowStart) && !p.getDate().isAfter(today))
                    .max(Comparator.comparing(HistoricalPoint::getDate))
                    .ifPresent(p -> latest.computeIfAbsent(s.key().country(), c -> new EnumMap<>(HistoricalMetric.class))
                            .put(s.key().metric(), p.getValue()));
        }

        List<String> drifted = batch.rows(DataTable.COUNTRIES).stream()
                .map(EnrichedSnapshot::getSnapshot)
                .filter(s -> s.getCases() != null && s.getCases() > config.getCrossTableMinCases())
                .filter(s -> latest.containsKey(s.getRegionName()))
                .filter(s -> {
                    Map<HistoricalMetric, Long> hist = latest.get(s.getRegionName());
                    return drifts(s.getCases(), hist.get(HistoricalMetric.CASES))
                            || drifts(s.getDeaths(), hist.get(HistoricalMetric.DEATHS));
                })
                .map(Snapshot::getRegionName)
                .toList();
        return new CheckOutcome(drifted.size(), "countries drifting from historical: " + drifted);
    }

    /** Relative difference measured against the historical value. */
    boolean drifts(Long current, Long historical) {
        if (current == null || historical == null) return false;
        if (historical == 0L) return current != 0L;
        double relative = Math.abs(current - historical) / (double) historical;
        return relative > config.getCrossTableDriftRatio();
    }

    // ── Coverage / completeness ──────────────────────────────────────────────

    private CheckOutcome geographicCoverage(ValidationBatch batch, DataTable table) {
        List<String> expected = switch (table) {
            case CONTINENTS -> config.getExpectedContinents();
            case COUNTRIES -> config.getMajorCountries();
            case STATES -> config.getMajorStates();
            default -> List.of();
        };
        Set<String> present = batch.rows(table).stream()
                .map(EnrichedSnapshot::getRegionName)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        List<String> missing = expected.stream().filter(name -> !present.contains(name)).toList();
        return new CheckOutcome(missing.size(), "missing: " + missing);
    }

    private CheckOutcome fieldCompleteness(ValidationBatch batch, DataTable table) {
        List<EnrichedSnapshot> rows = batch.rows(table);
        if (rows.isEmpty()) {
            return new CheckOutcome(0, "no rows");
        }
        List<String> sparse = config.getRequiredFields().getOrDefault(table, List.of()).stream()
                .filter(field -> presentRatio(rows, field) < config.getMinMetricCompleteness())
                .map(SnapshotField::column)
                .toList();
        return new CheckOutcome(sparse.size(), "fields below completeness floor: " + sparse);
    }

    private static double presentRatio(List<EnrichedSnapshot> rows, SnapshotField field) {
        long present = rows.stream().map(EnrichedSnapshot::getSnapshot).filter(s -> !field.isMissing(s)).count();
        return (double) present / rows.size();
    }

    /** Field column -> share of rows where the field is missing. */
    public static Map<String, Double> nullRatios(List<EnrichedSnapshot> rows) {
        Map<String, Double> ratios = new LinkedHashMap<>();
        if (rows.isEmpty()) return ratios;
        for (SnapshotField field : SnapshotField.values()) {
            ratios.put(field.column(), 1.0 - presentRatio(rows, field));
        }
        return ratios;
    }
}
