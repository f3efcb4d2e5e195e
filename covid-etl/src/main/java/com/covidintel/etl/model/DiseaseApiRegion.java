package com.covidintel.etl.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Raw DTO matching the disease.sh snapshot JSON (/all, /countries, /continents, /states).
 * Kept separate from the domain model to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiseaseApiRegion {

    /** Epoch millis */
    private Long updated;

    private String country;
    private String continent;
    private String state;

    private CountryInfo countryInfo;

    private Long cases;
    private Long todayCases;
    private Long deaths;
    private Long todayDeaths;
    private Long recovered;
    private Long todayRecovered;
    private Long active;
    private Long critical;

    private Double casesPerOneMillion;
    private Double deathsPerOneMillion;
    private Long tests;
    private Double testsPerOneMillion;
    private Long population;

    private Integer affectedCountries;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CountryInfo {
        private String iso2;
        private String iso3;
    }
}
