package com.covidintel.etl.config;

import com.covidintel.etl.model.QualityReport;
import com.covidintel.etl.service.EtlPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class PipelineController {

    private final EtlPipelineService pipelineService;

    @PostMapping("/pipeline/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (!pipelineService.tryStartInBackground()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "A pipeline run is already in progress"));
        }
        log.info("Manual pipeline run triggered");
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @GetMapping("/pipeline/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "covid-etl");
        body.put("version", "1.0.0");
        body.put("dataSource", "disease.sh COVID-19 API");
        body.put("running", pipelineService.isRunning());
        pipelineService.latestRun().ifPresent(run -> body.put("lastRun", run));
        return ResponseEntity.ok(body);
    }

    /**
     * Latest quality report; 404 until a run has completed validation.
     */
    @GetMapping("/quality/latest")
    public ResponseEntity<QualityReport> latestQuality() {
        return ResponseEntity.of(pipelineService.latestReport());
    }
}
