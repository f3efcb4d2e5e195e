package com.covidintel.etl.service;

import com.covidintel.etl.model.DiseaseApiVaccineCoverage;
import com.covidintel.etl.model.VaccineCoverage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flattens vaccine coverage timelines into one row per (country, date).
 * Uses the same per-entry isolation as the historical timelines.
 */
@Component
@Slf4j
public class VaccineMapper {

    private static final String DATA_SOURCE = "disease.sh";

    public record Mapped(List<VaccineCoverage> rows, int malformed) {}

    public Mapped map(List<DiseaseApiVaccineCoverage> coverage, Instant extractionDate) {
        List<VaccineCoverage> rows = new ArrayList<>();
        int malformed = 0;

        for (DiseaseApiVaccineCoverage raw : coverage) {
            if (raw.getCountry() == null || raw.getCountry().isBlank() || raw.getTimeline() == null) {
                malformed++;
                continue;
            }
            for (Map.Entry<String, Long> entry : raw.getTimeline().entrySet()) {
                LocalDate date = HistoricalMapper.parseTimelineDate(entry.getKey());
                Long doses = entry.getValue();
                if (date == null || doses == null || doses < 0) {
                    malformed++;
                    continue;
                }
                rows.add(VaccineCoverage.builder()
                        .country(raw.getCountry())
                        .date(date)
                        .totalDoses(doses)
                        .extractionDate(extractionDate)
                        .dataSource(DATA_SOURCE)
                        .build());
            }
        }

        log.info("Mapped {} vaccine coverage rows from {} countries ({} malformed)",
                rows.size(), coverage.size(), malformed);
        return new Mapped(rows, malformed);
    }
}
