package com.covidintel.etl.model;

/** Pass/fail tally and grade over a set of checks. */
public record QualityScore(int totalChecks, int passed, int failed, double passPercentage, QualityGrade grade) {
}
