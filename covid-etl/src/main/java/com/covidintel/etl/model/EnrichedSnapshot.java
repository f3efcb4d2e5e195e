package com.covidintel.etl.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A snapshot plus its derived analytics. Derived values are always recomputed
 * from the owning snapshot and are never stored on their own.
 *
 * Rates are fractions in [0, 1]; null means undefined (zero or missing denominator).
 */
@Value
@Builder
public class EnrichedSnapshot {

    Snapshot snapshot;

    Double mortalityRate;
    Double recoveryRate;
    Double activeRate;

    /** cases / population * 1e6, null when population is missing or zero */
    Double casesPerMillionComputed;

    /** deaths / population * 1e6, null when population is missing or zero */
    Double deathsPerMillionComputed;

    Double dataFreshnessHours;

    Instant processedAt;

    public RegionType getRegionType() {
        return snapshot.getRegionType();
    }

    public String getRegionName() {
        return snapshot.getRegionName();
    }

    /** Authoritative value: locally computed, falling back to the source figure. */
    public Double getCasesPerMillion() {
        return casesPerMillionComputed != null ? casesPerMillionComputed : snapshot.getCasesPerOneMillion();
    }

    /** Authoritative value: locally computed, falling back to the source figure. */
    public Double getDeathsPerMillion() {
        return deathsPerMillionComputed != null ? deathsPerMillionComputed : snapshot.getDeathsPerOneMillion();
    }
}
