package com.covidintel.etl.transform;

import com.covidintel.etl.model.EnrichedSnapshot;
import com.covidintel.etl.model.Snapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Derives rates and per-capita figures for a single snapshot.
 *
 * Total function: a zero or missing denominator yields null, never zero and never
 * an exception. The rate family and the per-million family are computed
 * independently of each other; the source's own per-million figures are carried
 * through untouched on the snapshot.
 */
public class MetricCalculator {

    private static final double PER_MILLION = 1_000_000d;
    private static final double MILLIS_PER_HOUR = 3_600_000d;

    private final Clock clock;

    public MetricCalculator(Clock clock) {
        this.clock = clock;
    }

    public EnrichedSnapshot enrich(Snapshot snapshot) {
        Instant now = clock.instant();

        return EnrichedSnapshot.builder()
                .snapshot(snapshot)
                .mortalityRate(ratio(snapshot.getDeaths(), snapshot.getCases()))
                .recoveryRate(ratio(snapshot.getRecovered(), snapshot.getCases()))
                .activeRate(ratio(snapshot.getActive(), snapshot.getCases()))
                .casesPerMillionComputed(perMillion(snapshot.getCases(), snapshot.getPopulation()))
                .deathsPerMillionComputed(perMillion(snapshot.getDeaths(), snapshot.getPopulation()))
                .dataFreshnessHours(hoursBetween(snapshot.getUpdated(), now))
                .processedAt(now)
                .build();
    }

    static Double ratio(Long numerator, Long denominator) {
        if (numerator == null || denominator == null || denominator == 0L) return null;
        return numerator.doubleValue() / denominator.doubleValue();
    }

    static Double perMillion(Long count, Long population) {
        Double fraction = ratio(count, population);
        return fraction == null ? null : fraction * PER_MILLION;
    }

    private static Double hoursBetween(Instant from, Instant to) {
        if (from == null) return null;
        return Duration.between(from, to).toMillis() / MILLIS_PER_HOUR;
    }
}
