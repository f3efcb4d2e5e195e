package com.covidintel.etl.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Enriched points of one series plus its continuity report.
 *
 * @param gapCount          consecutive pairs more than one day apart
 * @param daysWithData      points present
 * @param expectedDays      calendar days from first to last point, inclusive
 * @param incomplete        gap count above the configured limit, or completeness below the floor
 * @param anomalyDates      dates whose daily change fell below the metric's floor
 */
public record SeriesAnalysis(
        SeriesKey key,
        List<EnrichedHistoricalPoint> points,
        int gapCount,
        int daysWithData,
        long expectedDays,
        double completenessRatio,
        boolean incomplete,
        List<LocalDate> anomalyDates) {

    public static SeriesAnalysis empty(SeriesKey key) {
        return new SeriesAnalysis(key, List.of(), 0, 0, 0, 1.0, false, List.of());
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
