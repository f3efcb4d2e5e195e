package com.covidintel.etl.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Per-table summary handed to the loader and to monitoring.
 *
 * recordCount is what survived enrichment, expectedCount what the extractor
 * delivered; a mismatch means records were isolated as malformed.
 */
@Value
@Builder
public class TableQualityReport {

    String tableName;
    Instant validationTimestamp;
    long recordCount;
    long expectedCount;
    boolean countMatch;
    boolean valid;

    /** 0-100 */
    double qualityScore;

    @Singular
    List<String> errors;

    @Singular
    List<String> warnings;

    /** Field name -> fraction of rows where the field is null */
    Map<String, Double> nullPercentages;

    double duplicatePercentage;
}
