package com.covidintel.etl.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate quality outcome of one pipeline run. Created once, never mutated;
 * the loader gates on {@link #getGrade()} and alerting reads {@link #failedChecks()}.
 */
@Value
@Builder
public class QualityReport {

    String runId;
    Instant generatedAt;

    int totalChecks;
    int passed;
    int failed;
    double passPercentage;
    QualityGrade grade;

    List<ValidationCheck> checks;

    /** Table name -> score over that table's checks */
    Map<String, QualityScore> tableScores;

    List<TableQualityReport> tableReports;

    /** Records isolated during mapping and enrichment */
    int malformedRecords;

    public List<ValidationCheck> failedChecks() {
        return checks.stream().filter(c -> !c.isPassed()).toList();
    }
}
