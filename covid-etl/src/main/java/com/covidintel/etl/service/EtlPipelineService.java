package com.covidintel.etl.service;

import com.covidintel.etl.config.CovidEtlProperties;
import com.covidintel.etl.exception.ExtractionException;
import com.covidintel.etl.model.DataTable;
import com.covidintel.etl.model.DiseaseApiRegion;
import com.covidintel.etl.model.DiseaseApiTimeline;
import com.covidintel.etl.model.DiseaseApiVaccineCoverage;
import com.covidintel.etl.model.EnrichedHistoricalPoint;
import com.covidintel.etl.model.HistoricalPoint;
import com.covidintel.etl.model.PipelineRun;
import com.covidintel.etl.model.QualityReport;
import com.covidintel.etl.model.RegionType;
import com.covidintel.etl.model.Snapshot;
import com.covidintel.etl.model.TableQualityReport;
import com.covidintel.etl.model.VaccineCoverage;
import com.covidintel.etl.model.ValidationCheck;
import com.covidintel.etl.output.OutputRouter;
import com.covidintel.etl.validation.ConsistencyValidator;
import com.covidintel.etl.validation.QualityScorer;
import com.covidintel.etl.validation.TableQualityProfiler;
import com.covidintel.etl.validation.ValidationBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates one ETL cycle: extract, normalise and enrich, validate, score, load.
 *
 * Snapshot enrichment and historical analysis run concurrently; validation starts
 * only after both have completed. Every run is recorded in pipeline_runs whatever
 * its outcome, and the latest quality report is kept in memory for the API.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EtlPipelineService {

    private final DiseaseApiClient apiClient;
    private final SnapshotMapper snapshotMapper;
    private final HistoricalMapper historicalMapper;
    private final VaccineMapper vaccineMapper;
    private final EnrichmentService enrichmentService;
    private final ConsistencyValidator validator;
    private final TableQualityProfiler profiler;
    private final QualityScorer scorer;
    private final OutputRouter outputRouter;
    private final CovidEtlProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<QualityReport> latestReport = new AtomicReference<>();
    private final AtomicReference<PipelineRun> latestRun = new AtomicReference<>();

    /**
     * Extract from disease.sh and run the full cycle.
     * An endpoint that cannot be fetched is treated as an absent table.
     */
    public QualityReport runPipeline() {
        return guarded(this::extractAndProcess);
    }

    /**
     * Claim the run slot and start a full run on a background thread.
     *
     * @return false, without starting anything, when a run is already in progress
     */
    public boolean tryStartInBackground() {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        try {
            new Thread(() -> {
                try {
                    extractAndProcess();
                } catch (RuntimeException e) {
                    log.error("Background pipeline run failed: {}", e.getMessage(), e);
                } finally {
                    running.set(false);
                }
            }, "manual-pipeline-run").start();
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        return true;
    }

    /**
     * Run the cycle on input that has already been extracted.
     */
    public QualityReport runPipeline(RawBatch batch) {
        return guarded(() -> process(batch));
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<QualityReport> latestReport() {
        return Optional.ofNullable(latestReport.get());
    }

    public Optional<PipelineRun> latestRun() {
        return Optional.ofNullable(latestRun.get());
    }

    // ── Extraction ───────────────────────────────────────────────────────────

    RawBatch extract(Instant extractionDate) {
        Map<RegionType, List<Snapshot>> snapshots = new EnumMap<>(RegionType.class);
        Map<DataTable, Integer> malformed = new EnumMap<>(DataTable.class);

        for (RegionType regionType : RegionType.values()) {
            try {
                DiseaseApiClient.Fetched<DiseaseApiRegion> fetched = apiClient.fetchSnapshots(regionType);
                snapshots.put(regionType, fetched.items().stream()
                        .map(raw -> snapshotMapper.map(raw, regionType, extractionDate))
                        .toList());
                malformed.put(regionType.table(), fetched.malformed());
            } catch (ExtractionException e) {
                log.error("Extraction of {} failed, table treated as absent: {}",
                        regionType.table().tableName(), e.getMessage());
            }
        }

        int lastDays = properties.getApi().getHistoricalDays();
        List<HistoricalPoint> historical = List.of();
        try {
            DiseaseApiClient.Fetched<DiseaseApiTimeline> fetched = apiClient.fetchHistorical(lastDays);
            HistoricalMapper.Mapped mapped = historicalMapper.map(fetched.items());
            historical = mapped.points();
            malformed.put(DataTable.HISTORICAL, fetched.malformed() + mapped.malformed());
        } catch (ExtractionException e) {
            log.error("Extraction of historical timelines failed, table treated as absent: {}", e.getMessage());
        }

        List<VaccineCoverage> vaccines = List.of();
        try {
            DiseaseApiClient.Fetched<DiseaseApiVaccineCoverage> fetched = apiClient.fetchVaccineCoverage(lastDays);
            VaccineMapper.Mapped mapped = vaccineMapper.map(fetched.items(), extractionDate);
            vaccines = mapped.rows();
            malformed.put(DataTable.VACCINES, fetched.malformed() + mapped.malformed());
        } catch (ExtractionException e) {
            log.error("Extraction of vaccine coverage failed, table treated as absent: {}", e.getMessage());
        }

        return new RawBatch(snapshots, historical, vaccines, malformed);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private interface Cycle {
        QualityReport run();
    }

    private QualityReport extractAndProcess() {
        log.info("Starting pipeline run with extraction from {}", properties.getApi().getBaseUrl());
        return process(extract(clock.instant()));
    }

    private QualityReport guarded(Cycle cycle) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A pipeline run is already in progress");
        }
        try {
            return cycle.run();
        } finally {
            running.set(false);
        }
    }

    private QualityReport process(RawBatch raw) {
        PipelineRun run = PipelineRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(LocalDateTime.now(clock))
                .status("RUNNING")
                .recordsExtracted(raw.recordCount())
                .build();
        latestRun.set(run);

        try {
            CompletableFuture<EnrichmentService.SnapshotEnrichment> snapshotFuture =
                    enrichmentService.enrichSnapshots(raw.snapshots());
            CompletableFuture<EnrichmentService.HistoricalEnrichment> historicalFuture =
                    enrichmentService.enrichHistorical(raw.historical());

            // single join point: cross-table checks need both sides
            EnrichmentService.SnapshotEnrichment snapshots = await(snapshotFuture);
            EnrichmentService.HistoricalEnrichment historical = await(historicalFuture);
            EnrichmentService.VaccineEnrichment vaccines = enrichmentService.normalizeVaccines(raw.vaccines());

            ValidationBatch batch = new ValidationBatch(snapshots.byTable(), historical.series(),
                    vaccines.rows(), clock.instant());
            List<ValidationCheck> checks = validator.validate(batch);

            Map<DataTable, Integer> received = new EnumMap<>(DataTable.class);
            snapshots.received().forEach((table, count) ->
                    received.put(table, count + raw.extractionMalformed().getOrDefault(table, 0)));
            received.put(DataTable.HISTORICAL,
                    historical.received() + raw.extractionMalformed().getOrDefault(DataTable.HISTORICAL, 0));
            received.put(DataTable.VACCINES,
                    vaccines.received() + raw.extractionMalformed().getOrDefault(DataTable.VACCINES, 0));

            List<TableQualityReport> tableReports =
                    profiler.profile(batch, checks, received, historical.duplicatesDropped());

            int malformed = raw.totalExtractionMalformed() + snapshots.totalMalformed()
                    + historical.malformed() + vaccines.malformed();
            QualityReport report = scorer.report(run.getRunId(), clock.instant(), checks, tableReports, malformed);
            latestReport.set(report);

            log.info("Run {}: {}/{} checks passed ({}%), grade {}",
                    run.getRunId(), report.getPassed(), report.getTotalChecks(),
                    report.getPassPercentage(), report.getGrade());

            run.setMalformedRecords(malformed);
            run.setQualityGrade(report.getGrade().name());

            outputRouter.writeReport(report);
            if (outputRouter.accepts(report.getGrade())) {
                List<EnrichedHistoricalPoint> points = batch.historicalPoints().toList();
                int written = outputRouter.writeData(snapshots.byTable(), points, vaccines.rows(), run.getStartedAt());
                run.setRecordsWritten(written);
                run.setStatus("SUCCESS");
            } else {
                log.warn("Run {} rejected: grade {} is below {}", run.getRunId(),
                        report.getGrade(), properties.getOutput().getRejectBelowGrade());
                run.setStatus("REJECTED");
            }
            return report;

        } catch (RuntimeException e) {
            log.error("Pipeline run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            throw e;
        } finally {
            run.setCompletedAt(LocalDateTime.now(clock));
            outputRouter.writePipelineRun(run);
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
