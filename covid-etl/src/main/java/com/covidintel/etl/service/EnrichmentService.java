package com.covidintel.etl.service;

import com.covidintel.etl.config.CovidEtlProperties;
import com.covidintel.etl.exception.MalformedRecordException;
import com.covidintel.etl.model.DataTable;
import com.covidintel.etl.model.EnrichedSnapshot;
import com.covidintel.etl.model.HistoricalPoint;
import com.covidintel.etl.model.RegionType;
import com.covidintel.etl.model.SeriesAnalysis;
import com.covidintel.etl.model.SeriesKey;
import com.covidintel.etl.model.Snapshot;
import com.covidintel.etl.model.VaccineCoverage;
import com.covidintel.etl.transform.CountryNameNormalizer;
import com.covidintel.etl.transform.HistoricalSeriesAssembler;
import com.covidintel.etl.transform.MetricCalculator;
import com.covidintel.etl.transform.TemporalAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Runs snapshot enrichment and historical analysis on the bounded enrichment pool.
 *
 * Both entry points return without blocking: work is split into contiguous partitions,
 * each partition is one task, and results are concatenated in input order once every
 * partition completes. The caller joins the two futures before validation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EnrichmentService {

    private final MetricCalculator metricCalculator;
    private final TemporalAnalyzer temporalAnalyzer;
    private final CountryNameNormalizer normalizer;
    private final HistoricalSeriesAssembler assembler;
    private final ExecutorService enrichmentExecutor;
    private final CovidEtlProperties properties;

    public record SnapshotEnrichment(Map<DataTable, List<EnrichedSnapshot>> byTable,
                                     Map<DataTable, Integer> received,
                                     Map<DataTable, Integer> malformed) {

        public int totalMalformed() {
            return malformed.values().stream().mapToInt(Integer::intValue).sum();
        }

        public int totalRows() {
            return byTable.values().stream().mapToInt(List::size).sum();
        }
    }

    public record HistoricalEnrichment(List<SeriesAnalysis> series,
                                       int received,
                                       int malformed,
                                       int duplicatesDropped) {}

    public record VaccineEnrichment(List<VaccineCoverage> rows, int received, int malformed) {}

    private record Partial(List<EnrichedSnapshot> rows, int malformed) {}

    public CompletableFuture<SnapshotEnrichment> enrichSnapshots(Map<RegionType, List<Snapshot>> raw) {
        Map<DataTable, CompletableFuture<List<Partial>>> perTable = new EnumMap<>(DataTable.class);
        Map<DataTable, Integer> received = new EnumMap<>(DataTable.class);

        raw.forEach((regionType, rows) -> {
            DataTable table = regionType.table();
            received.put(table, rows.size());
            perTable.put(table, mapPartitions(rows, part -> enrichPartition(regionType, part)));
        });

        return CompletableFuture.allOf(perTable.values().toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    Map<DataTable, List<EnrichedSnapshot>> byTable = new EnumMap<>(DataTable.class);
                    Map<DataTable, Integer> malformed = new EnumMap<>(DataTable.class);
                    perTable.forEach((table, future) -> {
                        List<EnrichedSnapshot> rows = new ArrayList<>();
                        int bad = 0;
                        for (Partial partial : future.join()) {
                            rows.addAll(partial.rows());
                            bad += partial.malformed();
                        }
                        byTable.put(table, rows);
                        malformed.put(table, bad);
                        log.info("Enriched {}: {} rows, {} malformed", table.tableName(), rows.size(), bad);
                    });
                    return new SnapshotEnrichment(byTable, received, malformed);
                });
    }

    public CompletableFuture<HistoricalEnrichment> enrichHistorical(List<HistoricalPoint> raw) {
        List<HistoricalPoint> normalized = new ArrayList<>(raw.size());
        for (HistoricalPoint p : raw) {
            normalized.add(p == null ? null : p.toBuilder().country(normalizer.normalize(p.getCountry())).build());
        }

        HistoricalSeriesAssembler.AssembledSeries assembled = assembler.assemble(normalized);
        List<Map.Entry<SeriesKey, List<HistoricalPoint>>> entries = new ArrayList<>(assembled.series().entrySet());

        return mapPartitions(entries, this::analyzePartition)
                .thenApply(parts -> {
                    List<SeriesAnalysis> series = new ArrayList<>(entries.size());
                    parts.forEach(series::addAll);
                    log.info("Analyzed {} historical series from {} points", series.size(), raw.size());
                    return new HistoricalEnrichment(series, raw.size(),
                            assembled.malformed(), assembled.duplicatesDropped());
                });
    }

    /**
     * Normalise vaccine country names on the caller's thread; the table carries no derived metrics.
     */
    public VaccineEnrichment normalizeVaccines(List<VaccineCoverage> raw) {
        List<VaccineCoverage> rows = new ArrayList<>(raw.size());
        int malformed = 0;
        for (VaccineCoverage row : raw) {
            if (row == null || row.getDate() == null) {
                malformed++;
                continue;
            }
            rows.add(row.toBuilder().country(normalizer.normalize(row.getCountry())).build());
        }
        log.info("Normalised {} vaccine coverage rows, {} malformed", rows.size(), malformed);
        return new VaccineEnrichment(rows, raw.size(), malformed);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Partial enrichPartition(RegionType expected, List<Snapshot> rows) {
        List<EnrichedSnapshot> out = new ArrayList<>(rows.size());
        int malformed = 0;
        for (Snapshot snapshot : rows) {
            try {
                requireWellFormed(expected, snapshot);
                Snapshot normalized = snapshot.toBuilder()
                        .regionName(expected == RegionType.COUNTRY
                                ? normalizer.normalize(snapshot.getRegionName())
                                : snapshot.getRegionName())
                        .country(normalizer.normalize(snapshot.getCountry()))
                        .build();
                out.add(metricCalculator.enrich(normalized));
            } catch (MalformedRecordException e) {
                malformed++;
                log.debug("Skipping malformed {} snapshot: {}", expected.code(), e.getMessage());
            } catch (RuntimeException e) {
                malformed++;
                log.warn("Failed to enrich {} snapshot: {}", expected.code(), e.getMessage());
            }
        }
        return new Partial(out, malformed);
    }

    private List<SeriesAnalysis> analyzePartition(List<Map.Entry<SeriesKey, List<HistoricalPoint>>> entries) {
        List<SeriesAnalysis> out = new ArrayList<>(entries.size());
        for (Map.Entry<SeriesKey, List<HistoricalPoint>> entry : entries) {
            out.add(temporalAnalyzer.analyze(entry.getKey(), entry.getValue()));
        }
        return out;
    }

    private static void requireWellFormed(RegionType expected, Snapshot snapshot) {
        if (snapshot == null) {
            throw new MalformedRecordException("null snapshot");
        }
        if (snapshot.getRegionType() != expected) {
            throw new MalformedRecordException("region type " + snapshot.getRegionType()
                    + " delivered for " + expected);
        }
        if (snapshot.getExtractionDate() == null) {
            throw new MalformedRecordException("missing extraction date for " + snapshot.getRegionName());
        }
    }

    /**
     * Split into at most {@code parallelism} contiguous partitions and run each on the pool.
     * The resulting list preserves partition order.
     */
    private <I, O> CompletableFuture<List<O>> mapPartitions(List<I> items, Function<List<I>, O> worker) {
        int parallelism = Math.max(1, properties.getProcessing().getParallelism());
        int size = Math.max(1, (items.size() + parallelism - 1) / parallelism);

        List<CompletableFuture<O>> futures = new ArrayList<>();
        for (int from = 0; from < items.size(); from += size) {
            List<I> partition = items.subList(from, Math.min(items.size(), from + size));
            futures.add(CompletableFuture.supplyAsync(() -> worker.apply(partition), enrichmentExecutor));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    List<O> results = new ArrayList<>(futures.size());
                    futures.forEach(f -> results.add(f.join()));
                    return results;
                });
    }
}
