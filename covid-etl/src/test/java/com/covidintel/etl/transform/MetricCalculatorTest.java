package com.covidintel.etl.transform;

import com.covidintel.etl.model.EnrichedSnapshot;
import com.covidintel.etl.model.RegionType;
import com.covidintel.etl.model.Snapshot;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class MetricCalculatorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final MetricCalculator calculator = new MetricCalculator(Clock.fixed(NOW, ZoneOffset.UTC));

    private Snapshot.SnapshotBuilder country() {
        return Snapshot.builder()
                .regionType(RegionType.COUNTRY).regionName("Testland")
                .cases(1000L).deaths(20L).recovered(900L).active(80L)
                .population(1_000_000L)
                .updated(NOW.minus(Duration.ofHours(6)))
                .extractionDate(NOW).dataSource("disease.sh");
    }

    @Test
    void enrich_computesRatesPerMillionAndFreshness() {
        EnrichedSnapshot e = calculator.enrich(country().build());

        assertThat(e.getMortalityRate()).isEqualTo(0.02);
        assertThat(e.getRecoveryRate()).isEqualTo(0.9);
        assertThat(e.getActiveRate()).isEqualTo(0.08);
        assertThat(e.getCasesPerMillionComputed()).isEqualTo(1000.0);
        assertThat(e.getDeathsPerMillionComputed()).isEqualTo(20.0);
        assertThat(e.getDataFreshnessHours()).isEqualTo(6.0);
        assertThat(e.getProcessedAt()).isEqualTo(NOW);
    }

    @Test
    void enrich_zeroCases_ratesNullPerMillionStillComputed() {
        EnrichedSnapshot e = calculator.enrich(country().cases(0L).deaths(0L).recovered(0L).active(0L).build());

        assertThat(e.getMortalityRate()).isNull();
        assertThat(e.getRecoveryRate()).isNull();
        assertThat(e.getActiveRate()).isNull();
        assertThat(e.getCasesPerMillionComputed()).isEqualTo(0.0);
    }

    @Test
    void enrich_zeroPopulation_perMillionNullRatesIndependent() {
        EnrichedSnapshot e = calculator.enrich(country()
                .cases(10_000L).deaths(2_500L).recovered(5_000L)
                .population(0L).casesPerOneMillion(42.0)
                .build());

        assertThat(e.getMortalityRate()).isEqualTo(0.25);
        assertThat(e.getCasesPerMillionComputed()).isNull();
        assertThat(e.getDeathsPerMillionComputed()).isNull();
        // falls back to the source pass-through
        assertThat(e.getCasesPerMillion()).isEqualTo(42.0);
        assertThat(e.getDeathsPerMillion()).isNull();
    }

    @Test
    void enrich_missingNumerator_onlyThatRateNull() {
        EnrichedSnapshot e = calculator.enrich(country().recovered(null).build());

        assertThat(e.getRecoveryRate()).isNull();
        assertThat(e.getMortalityRate()).isEqualTo(0.02);
    }

    @Test
    void enrich_missingUpdated_freshnessNull() {
        assertThat(calculator.enrich(country().updated(null).build()).getDataFreshnessHours()).isNull();
    }

    @Test
    void enrich_sameClock_isDeterministic() {
        Snapshot snapshot = country().build();
        assertThat(calculator.enrich(snapshot)).isEqualTo(calculator.enrich(snapshot));
    }
}
