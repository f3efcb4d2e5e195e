package com.covidintel.etl.service;

import com.covidintel.etl.config.CovidEtlProperties;
import com.covidintel.etl.exception.ExtractionException;
import com.covidintel.etl.model.DataTable;
import com.covidintel.etl.model.DiseaseApiRegion;
import com.covidintel.etl.model.DiseaseApiVaccineCoverage;
import com.covidintel.etl.model.HistoricalMetric;
import com.covidintel.etl.model.HistoricalPoint;
import com.covidintel.etl.model.PipelineRun;
import com.covidintel.etl.model.QualityGrade;
import com.covidintel.etl.model.QualityReport;
import com.covidintel.etl.model.RegionType;
import com.covidintel.etl.model.Snapshot;
import com.covidintel.etl.model.VaccineCoverage;
import com.covidintel.etl.model.ValidationCheck;
import com.covidintel.etl.output.OutputRouter;
import com.covidintel.etl.transform.CountryNameNormalizer;
import com.covidintel.etl.transform.HistoricalSeriesAssembler;
import com.covidintel.etl.transform.MetricCalculator;
import com.covidintel.etl.transform.TemporalAnalyzer;
import com.covidintel.etl.validation.ConsistencyValidator;
import com.covidintel.etl.validation.QualityScorer;
import com.covidintel.etl.validation.StandardChecks;
import com.covidintel.etl.validation.TableQualityProfiler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EtlPipelineServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T06:00:00Z");

    @Mock DiseaseApiClient apiClient;
    @Mock OutputRouter outputRouter;

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private EtlPipelineService service;

    @BeforeEach
    void setUp() {
        CovidEtlProperties properties = new CovidEtlProperties();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        EnrichmentService enrichment = new EnrichmentService(
                new MetricCalculator(clock),
                new TemporalAnalyzer(properties.getTemporal()),
                new CountryNameNormalizer(),
                new HistoricalSeriesAssembler(),
                executor,
                properties);
        service = new EtlPipelineService(
                apiClient,
                new SnapshotMapper(),
                new HistoricalMapper(),
                new VaccineMapper(),
                enrichment,
                new ConsistencyValidator(new StandardChecks(properties.getQuality()).build()),
                new TableQualityProfiler(properties.getQuality()),
                new QualityScorer(),
                outputRouter,
                properties,
                clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static RawBatch smallBatch() {
        Snapshot world = Snapshot.builder()
                .regionType(RegionType.GLOBAL).regionName("World")
                .cases(1_000L).deaths(10L).recovered(900L).active(90L)
                .updated(NOW).extractionDate(NOW).build();
        HistoricalPoint point = HistoricalPoint.builder()
                .country("Testland").metric(HistoricalMetric.CASES).date(LocalDate.of(2024, 2, 29)).value(5).build();
        return new RawBatch(Map.of(RegionType.GLOBAL, List.of(world)), List.of(point));
    }

    private PipelineRun capturedRun() {
        ArgumentCaptor<PipelineRun> captor = ArgumentCaptor.forClass(PipelineRun.class);
        verify(outputRouter).writePipelineRun(captor.capture());
        return captor.getValue();
    }

    @Test
    void runPipeline_acceptedGrade_loadsDataAndRecordsSuccess() {
        when(outputRouter.accepts(any())).thenReturn(true);
        when(outputRouter.writeData(anyMap(), anyList(), anyList(), any())).thenReturn(2);

        QualityReport report = service.runPipeline(smallBatch());

        assertThat(report.getTotalChecks()).isPositive();
        assertThat(report.getTableReports()).isNotEmpty();
        assertThat(service.latestReport()).contains(report);
        verify(outputRouter).writeReport(report);
        verify(outputRouter).writeData(anyMap(), anyList(), anyList(), any());

        PipelineRun run = capturedRun();
        assertThat(run.getStatus()).isEqualTo("SUCCESS");
        assertThat(run.getRunId()).isEqualTo(report.getRunId());
        assertThat(run.getRecordsExtracted()).isEqualTo(2);
        assertThat(run.getRecordsWritten()).isEqualTo(2);
        assertThat(run.getQualityGrade()).isEqualTo(report.getGrade().name());
        assertThat(run.getCompletedAt()).isNotNull();
    }

    @Test
    void runPipeline_gradeBelowFloor_skipsDataButKeepsReport() {
        when(outputRouter.accepts(any())).thenReturn(false);

        QualityReport report = service.runPipeline(smallBatch());

        // a near-empty batch misses volume and coverage floors
        assertThat(report.getGrade()).isEqualTo(QualityGrade.POOR);
        verify(outputRouter).writeReport(report);
        verify(outputRouter, never()).writeData(anyMap(), anyList(), anyList(), any());
        assertThat(capturedRun().getStatus()).isEqualTo("REJECTED");
    }

    @Test
    void runPipeline_loadFailure_recordsFailedRunAndRethrows() {
        when(outputRouter.accepts(any())).thenReturn(true);
        when(outputRouter.writeData(anyMap(), anyList(), anyList(), any())).thenThrow(new IllegalStateException("warehouse down"));

        assertThatThrownBy(() -> service.runPipeline(smallBatch())).hasMessage("warehouse down");

        PipelineRun run = capturedRun();
        assertThat(run.getStatus()).isEqualTo("FAILED");
        assertThat(run.getErrorMessage()).isEqualTo("warehouse down");
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void runPipeline_failedEndpointTreatedAsAbsentTable() {
        DiseaseApiRegion country = new DiseaseApiRegion();
        country.setCountry("USA");
        country.setCases(100L);
        when(apiClient.fetchSnapshots(any())).thenAnswer(invocation -> {
            RegionType type = invocation.getArgument(0);
            if (type == RegionType.STATE) {
                throw new ExtractionException("Extraction failed for /states", new RuntimeException("timeout"));
            }
            return new DiseaseApiClient.Fetched<>(type == RegionType.COUNTRY ? List.of(country) : List.of(), 1);
        });
        when(apiClient.fetchHistorical(30)).thenReturn(new DiseaseApiClient.Fetched<>(List.of(), 0));
        when(apiClient.fetchVaccineCoverage(30)).thenReturn(new DiseaseApiClient.Fetched<>(List.of(), 0));
        when(outputRouter.accepts(any())).thenReturn(false);

        QualityReport report = service.runPipeline();

        ValidationCheck statesVolume = report.getChecks().stream()
                .filter(c -> c.getCheckName().equals(StandardChecks.MINIMUM_VOLUME)
                        && c.getTableName().equals(DataTable.STATES.tableName()))
                .findFirst().orElseThrow();
        assertThat(statesVolume.getObservedCount()).isEqualTo(50);
        assertThat(report.getMalformedRecords()).isEqualTo(3);
        assertThat(report.getChecks())
                .filteredOn(c -> c.getCheckName().equals(StandardChecks.GEOGRAPHIC_COVERAGE)
                        && c.getTableName().equals(DataTable.COUNTRIES.tableName()))
                .singleElement()
                .satisfies(c -> assertThat(c.getDetail()).doesNotContain("United States"));
    }

    @Test
    void latestReport_emptyBeforeFirstRun() {
        assertThat(service.latestReport()).isEmpty();
        assertThat(service.latestRun()).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void runPipeline_vaccineCoverageValidatedAndLoaded() {
        DiseaseApiVaccineCoverage coverage = new DiseaseApiVaccineCoverage();
        coverage.setCountry("USA");
        coverage.setTimeline(Map.of("2/29/24", 100L, "3/1/24", 120L, "bad", 1L));
        when(apiClient.fetchSnapshots(any())).thenReturn(new DiseaseApiClient.Fetched<>(List.of(), 0));
        when(apiClient.fetchHistorical(30)).thenReturn(new DiseaseApiClient.Fetched<>(List.of(), 0));
        when(apiClient.fetchVaccineCoverage(30)).thenReturn(new DiseaseApiClient.Fetched<>(List.of(coverage), 1));
        when(outputRouter.accepts(any())).thenReturn(true);

        QualityReport report = service.runPipeline();

        assertThat(report.getChecks())
                .filteredOn(c -> c.getTableName().equals(DataTable.VACCINES.tableName())
                        && c.getCheckName().equals(StandardChecks.MINIMUM_VOLUME))
                .singleElement()
                .satisfies(c -> assertThat(c.getObservedCount()).isEqualTo(998));
        assertThat(report.getMalformedRecords()).isEqualTo(2);

        ArgumentCaptor<List<VaccineCoverage>> vaccines = ArgumentCaptor.forClass(List.class);
        verify(outputRouter).writeData(anyMap(), anyList(), vaccines.capture(), any());
        assertThat(vaccines.getValue()).extracting(VaccineCoverage::getCountry).containsOnly("United States");
        assertThat(capturedRun().getRecordsExtracted()).isEqualTo(2);
    }

    @Test
    void tryStartInBackground_secondCallWhileRunning_isRefused() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(apiClient.fetchSnapshots(any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return new DiseaseApiClient.Fetched<>(List.of(), 0);
        });
        when(apiClient.fetchHistorical(30)).thenReturn(new DiseaseApiClient.Fetched<>(List.of(), 0));
        when(apiClient.fetchVaccineCoverage(30)).thenReturn(new DiseaseApiClient.Fetched<>(List.of(), 0));
        when(outputRouter.accepts(any())).thenReturn(false);

        assertThat(service.tryStartInBackground()).isTrue();
        assertThat(service.isRunning()).isTrue();
        assertThat(service.tryStartInBackground()).isFalse();
        assertThatThrownBy(() -> service.runPipeline(smallBatch())).isInstanceOf(IllegalStateException.class);

        release.countDown();
        verify(outputRouter, timeout(5_000)).writePipelineRun(any());
        long deadline = System.currentTimeMillis() + 5_000;
        while (service.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(service.isRunning()).isFalse();
        assertThat(service.latestRun()).hasValueSatisfying(run -> assertThat(run.getStatus()).isEqualTo("REJECTED"));
    }
}
