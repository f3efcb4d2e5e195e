package com.covidintel.etl.config;

import com.covidintel.etl.model.DataTable;
import com.covidintel.etl.model.HistoricalMetric;
import com.covidintel.etl.model.QualityGrade;
import com.covidintel.etl.model.SnapshotField;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "covid-etl")
@Data
public class CovidEtlProperties {

    private Api api = new Api();
    private Quality quality = new Quality();
    private Temporal temporal = new Temporal();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();
    private Processing processing = new Processing();

    @Data
    public static class Api {
        private String baseUrl = "https://disease.sh/v3/covid-19";
        private int historicalDays = 30;
        private int timeoutSeconds = 30;
    }

    /**
     * Rule parameters and thresholds for the consistency validator.
     * Check thresholds not listed here use the registry defaults and can be
     * overridden by name ("mortality_outlier") or name.table
     * ("minimum_volume.covid_countries") in thresholdOverrides.
     */
    @Data
    public static class Quality {
        private double mortalityOutlierRate = 0.20;
        private long mortalityOutlierMinCases = 1000;

        private double activeMismatchTolerance = 0.01;
        private long activeMismatchMinCases = 100;

        private long freshnessWindowHours = 48;
        private long extractionRecencyHours = 24;

        private double crossTableDriftRatio = 0.10;
        private long crossTableMinCases = 1000;
        private int crossTableWindowDays = 7;

        private double minMetricCompleteness = 0.80;
        private double maxNullPercentage = 0.10;

        /** Dated rows before this day or more than maxFutureDays past the run are out of range */
        private LocalDate earliestDataDate = LocalDate.of(2019, 12, 1);
        private int maxFutureDays = 1;

        private Map<DataTable, Long> minimumVolume = new EnumMap<>(Map.of(
                DataTable.COUNTRIES, 190L,
                DataTable.CONTINENTS, 6L,
                DataTable.STATES, 50L,
                DataTable.GLOBAL, 1L,
                DataTable.VACCINES, 1000L));

        private Map<DataTable, List<SnapshotField>> requiredFields = new EnumMap<>(Map.of(
                DataTable.GLOBAL, List.of(SnapshotField.CASES, SnapshotField.DEATHS, SnapshotField.RECOVERED, SnapshotField.ACTIVE),
                DataTable.COUNTRIES, List.of(SnapshotField.CASES, SnapshotField.DEATHS, SnapshotField.POPULATION),
                DataTable.CONTINENTS, List.of(SnapshotField.CASES, SnapshotField.DEATHS, SnapshotField.POPULATION),
                DataTable.STATES, List.of(SnapshotField.CASES, SnapshotField.DEATHS)));

        private List<String> expectedContinents = new ArrayList<>(List.of(
                "Asia", "Europe", "North America", "South America", "Africa", "Australia-Oceania"));

        private List<String> majorCountries = new ArrayList<>(List.of(
                "United States", "China", "India", "Brazil", "Russia", "France", "Germany",
                "United Kingdom", "Italy", "Spain", "Iran", "Korea, South", "Japan"));

        private List<String> majorStates = new ArrayList<>(List.of(
                "California", "Texas", "Florida", "New York", "Pennsylvania", "Illinois",
                "Ohio", "Georgia", "North Carolina", "Michigan", "New Jersey", "Virginia"));

        private Set<String> disabledChecks = new HashSet<>();

        private Map<String, Long> thresholdOverrides = new HashMap<>();
    }

    @Data
    public static class Temporal {
        private int maxGaps = 7;
        private double minCompletenessRatio = 0.90;
        private int rollingWindow = 7;
        private Map<HistoricalMetric, Long> anomalyFloors = new EnumMap<>(Map.of(HistoricalMetric.CASES, -10_000L));
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.CLICKHOUSE;
        private Csv csv = new Csv();

        /** Data tables are not loaded when the run grades worse than this; null loads everything */
        private QualityGrade rejectBelowGrade;

        @Data
        public static class Csv {
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            CLICKHOUSE, CSV, BOTH
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 6 * * ?";
        private boolean runOnStartup = false;
    }

    @Data
    public static class Processing {
        private int parallelism = 4;
    }
}
