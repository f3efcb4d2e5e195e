package com.covidintel.etl.transform;

import com.covidintel.etl.config.CovidEtlProperties;
import com.covidintel.etl.exception.SeriesOutOfOrderException;
import com.covidintel.etl.model.EnrichedHistoricalPoint;
import com.covidintel.etl.model.HistoricalPoint;
import com.covidintel.etl.model.SeriesAnalysis;
import com.covidintel.etl.model.SeriesKey;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;

/**
 * Day-over-day change, trailing averages and continuity analysis for one
 * (country, metric) series. Metric-agnostic apart from the configured anomaly floor.
 *
 * <p>The input must already be sorted ascending by date with unique dates; the
 * analyzer never sorts. Changes span gaps as-is (no interpolation) and the rolling
 * window covers the last N <em>present</em> points, not the last N calendar days.</p>
 */
public class TemporalAnalyzer {

    private final CovidEtlProperties.Temporal config;

    public TemporalAnalyzer(CovidEtlProperties.Temporal config) {
        this.config = config;
    }

    /**
     * Analyze a non-empty series, taking its identity from the first point.
     */
    public SeriesAnalysis analyze(List<HistoricalPoint> series) {
        if (series.isEmpty()) {
            throw new IllegalArgumentException("Cannot infer series identity from an empty series");
        }
        return analyze(series.get(0).seriesKey(), series);
    }

    /**
     * @throws SeriesOutOfOrderException if a point belongs to another series or its
     *                                   date does not strictly follow its predecessor
     */
    public SeriesAnalysis analyze(SeriesKey key, List<HistoricalPoint> series) {
        if (series.isEmpty()) return SeriesAnalysis.empty(key);

        int window = Math.max(1, config.getRollingWindow());
        Long floor = config.getAnomalyFloors().get(key.metric());

        int n = series.size();
        long[] values = new long[n];
        Long[] changes = new Long[n];

        List<EnrichedHistoricalPoint> enriched = new ArrayList<>(n);
        List<LocalDate> anomalies = new ArrayList<>();
        int gaps = 0;

        for (int i = 0; i < n; i++) {
            HistoricalPoint point = series.get(i);
            if (!key.equals(point.seriesKey())) {
                throw new SeriesOutOfOrderException(key, "point at index " + i + " belongs to " + point.seriesKey());
            }

            values[i] = point.getValue();
            Long change = null;
            Double changePct = null;

            if (i > 0) {
                HistoricalPoint previous = series.get(i - 1);
                long days = ChronoUnit.DAYS.between(previous.getDate(), point.getDate());
                if (days <= 0) {
                    throw new SeriesOutOfOrderException(key, String.format(
                            "%s at index %d does not follow %s", point.getDate(), i, previous.getDate()));
                }
                if (days > 1) gaps++;

                change = values[i] - values[i - 1];
                changePct = values[i - 1] == 0 ? null : change.doubleValue() / values[i - 1];

                if (floor != null && change < floor) {
                    anomalies.add(point.getDate());
                }
            }
            changes[i] = change;

            int from = Math.max(0, i - window + 1);
            enriched.add(EnrichedHistoricalPoint.builder()
                    .point(point)
                    .dailyChange(change)
                    .dailyChangePct(changePct)
                    .value7DayAvg(meanOfValues(values, from, i))
                    .dailyChange7DayAvg(meanOfChanges(changes, from, i))
                    .year(point.getDate().getYear())
                    .month(point.getDate().getMonthValue())
                    .dayOfWeek(point.getDate().getDayOfWeek().getValue())
                    .weekOfYear(point.getDate().get(IsoFields.WEEK_OF_WEEK_BASED_YEAR))
                    .build());
        }

        long expectedDays = ChronoUnit.DAYS.between(series.get(0).getDate(), series.get(n - 1).getDate()) + 1;
        double completeness = (double) n / expectedDays;
        boolean incomplete = gaps > config.getMaxGaps() || completeness < config.getMinCompletenessRatio();

        return new SeriesAnalysis(key, List.copyOf(enriched), gaps, n, expectedDays,
                completeness, incomplete, List.copyOf(anomalies));
    }

    private static double meanOfValues(long[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i <= to; i++) sum += values[i];
        return sum / (to - from + 1);
    }

    private static Double meanOfChanges(Long[] changes, int from, int to) {
        double sum = 0;
        int count = 0;
        for (int i = from; i <= to; i++) {
            if (changes[i] != null) {
                sum += changes[i];
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }
}
