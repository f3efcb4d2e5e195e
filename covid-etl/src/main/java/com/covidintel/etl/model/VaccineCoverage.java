package com.covidintel.etl.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/** Cumulative vaccine doses administered in one country up to one day. */
@Value
@Builder(toBuilder = true)
public class VaccineCoverage {

    String country;
    LocalDate date;
    long totalDoses;
    Instant extractionDate;
    String dataSource;
}
