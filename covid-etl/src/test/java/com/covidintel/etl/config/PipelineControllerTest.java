package com.covidintel.etl.config;

import com.covidintel.etl.model.PipelineRun;
import com.covidintel.etl.model.QualityReport;
import com.covidintel.etl.service.EtlPipelineService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineControllerTest {

    @Mock EtlPipelineService pipelineService;
    @InjectMocks PipelineController controller;

    @Test
    void trigger_whileRunning_returnsConflict() {
        when(pipelineService.tryStartInBackground()).thenReturn(false);

        ResponseEntity<Map<String, String>> response = controller.trigger();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        verify(pipelineService, never()).runPipeline();
    }

    @Test
    void trigger_idle_claimsRunAndAccepts() {
        when(pipelineService.tryStartInBackground()).thenReturn(true);

        ResponseEntity<Map<String, String>> response = controller.trigger();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        verify(pipelineService).tryStartInBackground();
        verify(pipelineService, never()).isRunning();
    }

    @Test
    void latestQuality_beforeAnyRun_isNotFound() {
        when(pipelineService.latestReport()).thenReturn(Optional.empty());

        assertThat(controller.latestQuality().getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void latestQuality_returnsReport() {
        QualityReport report = QualityReport.builder().runId("run-1").build();
        when(pipelineService.latestReport()).thenReturn(Optional.of(report));

        assertThat(controller.latestQuality().getBody()).isSameAs(report);
    }

    @Test
    void status_includesLastRunWhenPresent() {
        PipelineRun run = PipelineRun.builder().runId("run-1").status("SUCCESS").build();
        when(pipelineService.isRunning()).thenReturn(false);
        when(pipelineService.latestRun()).thenReturn(Optional.of(run));

        Map<String, Object> body = controller.status().getBody();

        assertThat(body).containsEntry("running", false).containsEntry("lastRun", run);
    }
}
