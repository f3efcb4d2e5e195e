package com.covidintel.etl.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each pipeline run for observability.
 * Stored in the pipeline_runs table in ClickHouse.
 */
@Data
@Builder
public class PipelineRun {

    private String runId;           // UUID
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | REJECTED | FAILED
    private int recordsExtracted;
    private int recordsWritten;
    private int malformedRecords;
    private String qualityGrade;    // null until validation completes
    private String errorMessage;    // null on success
}
