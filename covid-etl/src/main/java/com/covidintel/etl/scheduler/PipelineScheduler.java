package com.covidintel.etl.scheduler;

import com.covidintel.etl.config.CovidEtlProperties;
import com.covidintel.etl.output.ClickHouseWriter;
import com.covidintel.etl.service.EtlPipelineService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup pipeline runs.
 *
 * Default schedule: daily at 06:00 UTC, after disease.sh has refreshed its
 * overnight aggregates. Override with covid-etl.scheduling.cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineScheduler {

    private final EtlPipelineService pipelineService;
    private final ClickHouseWriter clickHouseWriter;
    private final CovidEtlProperties properties;

    /**
     * On application startup:
     *  1. Ensure the warehouse schema exists unless output is CSV only
     *  2. Optionally run the pipeline once if run-on-startup is set
     */
    @PostConstruct
    public void onStartup() {
        if (properties.getOutput().getMode() != CovidEtlProperties.Output.OutputMode.CSV) {
            try {
                clickHouseWriter.ensureSchema();
            } catch (Exception e) {
                log.warn("Could not initialise ClickHouse schema: {}", e.getMessage());
            }
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("run-on-startup set, running pipeline now");
            runSafely("Startup");
        } else {
            log.info("Pipeline ready. Schedule: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${covid-etl.scheduling.cron:0 0 6 * * ?}", zone = "UTC")
    public void scheduledRun() {
        log.info("Scheduled pipeline run triggered");
        runSafely("Scheduled");
    }

    private void runSafely(String trigger) {
        try {
            pipelineService.runPipeline();
        } catch (Exception e) {
            log.error("{} pipeline run failed: {}", trigger, e.getMessage(), e);
        }
    }
}
