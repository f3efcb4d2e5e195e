package com.covidintel.etl.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One observation of a region at one extraction instant, as delivered by the extractor.
 *
 * Notes:
 *  - counts are nullable; the source omits fields it does not track (e.g. recovered for some states)
 *  - cases >= deaths + recovered is expected but only checked, never enforced here
 *  - a newer extraction supersedes a snapshot, it never overwrites it
 */
@Value
@Builder(toBuilder = true)
public class Snapshot {

    // ── Region identity ─────────────────────────────────────────────────────
    RegionType regionType;

    /** Country, continent or state name; "World" for the global row */
    String regionName;

    /** Owning country, set for state rows */
    String country;

    /** Owning continent, set for country rows */
    String continent;

    // ── Raw cumulative counts ───────────────────────────────────────────────
    Long cases;
    Long deaths;
    Long recovered;
    Long active;
    Long critical;

    Long todayCases;
    Long todayDeaths;
    Long todayRecovered;

    Long population;
    Long tests;

    // ── Source-provided per-million figures (pass-through) ──────────────────
    Double casesPerOneMillion;
    Double deathsPerOneMillion;
    Double testsPerOneMillion;

    // ── Timestamps / lineage ────────────────────────────────────────────────
    /** Source's own last-updated timestamp */
    Instant updated;

    /** When this pipeline fetched the record */
    Instant extractionDate;

    String dataSource;
}
