package com.covidintel.etl.output;

import com.covidintel.etl.config.CovidEtlProperties;
import com.covidintel.etl.model.DataTable;
import com.covidintel.etl.model.EnrichedHistoricalPoint;
import com.covidintel.etl.model.EnrichedSnapshot;
import com.covidintel.etl.model.PipelineRun;
import com.covidintel.etl.model.QualityGrade;
import com.covidintel.etl.model.QualityReport;
import com.covidintel.etl.model.VaccineCoverage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Routes output to the appropriate sink(s) based on configuration.
 * Supports CLICKHOUSE, CSV, or BOTH modes, and holds back data tables
 * when the run grades below the configured floor.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final ClickHouseWriter clickHouseWriter;
    private final CsvWriter csvWriter;
    private final CovidEtlProperties properties;

    /** False when a grade floor is configured and {@code grade} is worse than it. */
    public boolean accepts(QualityGrade grade) {
        QualityGrade floor = properties.getOutput().getRejectBelowGrade();
        return floor == null || grade.isAtLeast(floor);
    }

    /**
     * Write the enriched region tables, historical points and vaccine coverage.
     *
     * @return rows handed to the sinks
     */
    public int writeData(Map<DataTable, List<EnrichedSnapshot>> snapshots,
                         List<EnrichedHistoricalPoint> historical,
                         List<VaccineCoverage> vaccines,
                         LocalDateTime runTime) {
        CovidEtlProperties.Output.OutputMode mode = properties.getOutput().getMode();
        int written = 0;

        for (Map.Entry<DataTable, List<EnrichedSnapshot>> entry : snapshots.entrySet()) {
            switch (mode) {
                case CLICKHOUSE -> clickHouseWriter.writeSnapshots(entry.getKey(), entry.getValue());
                case CSV -> csvWriter.writeSnapshots(entry.getKey(), entry.getValue(), runTime);
                case BOTH -> {
                    clickHouseWriter.writeSnapshots(entry.getKey(), entry.getValue());
                    csvWriter.writeSnapshots(entry.getKey(), entry.getValue(), runTime);
                }
            }
            written += entry.getValue().size();
        }

        switch (mode) {
            case CLICKHOUSE -> clickHouseWriter.writeHistorical(historical);
            case CSV -> csvWriter.writeHistorical(historical, runTime);
            case BOTH -> {
                clickHouseWriter.writeHistorical(historical);
                csvWriter.writeHistorical(historical, runTime);
            }
        }
        written += historical.size();

        switch (mode) {
            case CLICKHOUSE -> clickHouseWriter.writeVaccines(vaccines);
            case CSV -> csvWriter.writeVaccines(vaccines, runTime);
            case BOTH -> {
                clickHouseWriter.writeVaccines(vaccines);
                csvWriter.writeVaccines(vaccines, runTime);
            }
        }
        written += vaccines.size();

        log.info("Loaded {} rows via {}", written, mode);
        return written;
    }

    /**
     * Persist the check results. Failures here are logged, never fatal to the run.
     */
    public void writeReport(QualityReport report) {
        CovidEtlProperties.Output.OutputMode mode = properties.getOutput().getMode();
        try {
            if (mode != CovidEtlProperties.Output.OutputMode.CSV) {
                clickHouseWriter.writeChecks(report);
            }
            if (mode != CovidEtlProperties.Output.OutputMode.CLICKHOUSE) {
                csvWriter.writeChecks(report, LocalDateTime.ofInstant(report.getGeneratedAt(), ZoneOffset.UTC));
            }
        } catch (Exception e) {
            log.warn("Failed to write quality report {}: {}", report.getRunId(), e.getMessage());
        }
    }

    public void writePipelineRun(PipelineRun run) {
        try {
            if (properties.getOutput().getMode() != CovidEtlProperties.Output.OutputMode.CSV) {
                clickHouseWriter.writePipelineRun(run);
            }
        } catch (Exception e) {
            log.warn("Failed to write pipeline run metadata: {}", e.getMessage());
        }
    }
}
