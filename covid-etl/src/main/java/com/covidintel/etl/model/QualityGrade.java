package com.covidintel.etl.model;

/**
 * Categorical run grade. The failed-check bands are fixed policy shared with
 * downstream alerting, so they are a lookup, not a formula:
 *   0 failed -> EXCELLENT, <= 2 -> GOOD, <= 5 -> FAIR, otherwise POOR.
 */
public enum QualityGrade {

    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    public static QualityGrade forFailedChecks(long failed) {
        if (failed <= 0) return EXCELLENT;
        if (failed <= 2) return GOOD;
        if (failed <= 5) return FAIR;
        return POOR;
    }

    /** True when this grade is the same as or better than {@code other}. */
    public boolean isAtLeast(QualityGrade other) {
        return ordinal() <= other.ordinal();
    }
}
