package com.covidintel.etl.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.Map;

/**
 * Raw DTO for one element of /historical. Timeline keys are dates in M/d/yy form.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiseaseApiTimeline {

    private String country;

    /** Province list or single province; ignored for country-level series */
    private Object province;

    private Timeline timeline;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Timeline {
        private Map<String, Long> cases;
        private Map<String, Long> deaths;
        private Map<String, Long> recovered;
    }
}
