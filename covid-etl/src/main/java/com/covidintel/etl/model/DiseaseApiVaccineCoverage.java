package com.covidintel.etl.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.Map;

/**
 * Raw DTO for one element of /vaccine/coverage/countries with fullData=false.
 * The timeline maps M/d/yy dates to cumulative doses administered.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiseaseApiVaccineCoverage {

    private String country;

    private Map<String, Long> timeline;
}
