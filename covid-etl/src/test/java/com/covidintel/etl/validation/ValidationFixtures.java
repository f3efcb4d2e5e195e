package com.covidintel.etl.validation;

import com.covidintel.etl.config.CovidEtlProperties;
import com.covidintel.etl.model.EnrichedSnapshot;
import com.covidintel.etl.model.HistoricalMetric;
import com.covidintel.etl.model.HistoricalPoint;
import com.covidintel.etl.model.RegionType;
import com.covidintel.etl.model.SeriesAnalysis;
import com.covidintel.etl.model.Snapshot;
import com.covidintel.etl.transform.MetricCalculator;
import com.covidintel.etl.transform.TemporalAnalyzer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/** Shared builders for validation tests. */
final class ValidationFixtures {

    static final Instant AS_OF = Instant.parse("2024-03-01T12:00:00Z");

    private static final MetricCalculator CALCULATOR = new MetricCalculator(Clock.fixed(AS_OF, ZoneOffset.UTC));
    private static final TemporalAnalyzer ANALYZER = new TemporalAnalyzer(new CovidEtlProperties.Temporal());

    private ValidationFixtures() {}

    static Snapshot.SnapshotBuilder snapshot(RegionType type, String name) {
        return Snapshot.builder()
                .regionType(type).regionName(name)
                .cases(5_000L).deaths(50L).recovered(4_000L).active(950L)
                .population(10_000_000L)
                .updated(AS_OF.minus(Duration.ofHours(2)))
                .extractionDate(AS_OF.minus(Duration.ofMinutes(5)))
                .dataSource("disease.sh");
    }

    static EnrichedSnapshot enrich(Snapshot snapshot) {
        return CALCULATOR.enrich(snapshot);
    }

    static List<EnrichedSnapshot> rows(RegionType type, String... names) {
        List<EnrichedSnapshot> rows = new ArrayList<>();
        for (String name : names) {
            rows.add(enrich(snapshot(type, name).build()));
        }
        return rows;
    }

    /** Consecutive daily series ending on {@code last}. */
    static SeriesAnalysis series(String country, HistoricalMetric metric, LocalDate last, long... values) {
        List<HistoricalPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(HistoricalPoint.builder()
                    .country(country).metric(metric)
                    .date(last.minusDays(values.length - 1 - i))
                    .value(values[i])
                    .build());
        }
        return ANALYZER.analyze(points);
    }

    static SeriesAnalysis seriesOn(String country, HistoricalMetric metric, List<LocalDate> dates, long value) {
        List<HistoricalPoint> points = new ArrayList<>();
        for (LocalDate date : dates) {
            points.add(HistoricalPoint.builder().country(country).metric(metric).date(date).value(value).build());
        }
        return ANALYZER.analyze(points);
    }
}
