package com.covidintel.etl.service;

import com.covidintel.etl.model.DiseaseApiVaccineCoverage;
import com.covidintel.etl.model.VaccineCoverage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class VaccineMapperTest {

    private static final Instant EXTRACTED = Instant.parse("2024-03-01T06:00:00Z");

    private final VaccineMapper mapper = new VaccineMapper();

    private static DiseaseApiVaccineCoverage coverage(String country, Map<String, Long> timeline) {
        DiseaseApiVaccineCoverage raw = new DiseaseApiVaccineCoverage();
        raw.setCountry(country);
        raw.setTimeline(timeline);
        return raw;
    }

    @Test
    void map_oneRowPerCountryAndDate() {
        Map<String, Long> timeline = new LinkedHashMap<>();
        timeline.put("2/29/24", 1_000L);
        timeline.put("3/1/24", 1_250L);

        VaccineMapper.Mapped mapped = mapper.map(List.of(coverage("Testland", timeline)), EXTRACTED);

        assertThat(mapped.malformed()).isZero();
        assertThat(mapped.rows())
                .extracting(VaccineCoverage::getDate, VaccineCoverage::getTotalDoses)
                .containsExactly(
                        tuple(LocalDate.of(2024, 2, 29), 1_000L),
                        tuple(LocalDate.of(2024, 3, 1), 1_250L));
        assertThat(mapped.rows()).allSatisfy(row -> {
            assertThat(row.getCountry()).isEqualTo("Testland");
            assertThat(row.getExtractionDate()).isEqualTo(EXTRACTED);
            assertThat(row.getDataSource()).isEqualTo("disease.sh");
        });
    }

    @Test
    void map_badEntriesAndCountriesCountedIndividually() {
        Map<String, Long> timeline = new HashMap<>();
        timeline.put("yesterday", 10L);
        timeline.put("3/1/24", null);
        timeline.put("3/2/24", -1L);
        timeline.put("3/3/24", 40L);

        VaccineMapper.Mapped mapped = mapper.map(List.of(
                coverage("Testland", timeline),
                coverage(null, Map.of("3/1/24", 5L)),
                coverage("Emptyland", null)), EXTRACTED);

        assertThat(mapped.malformed()).isEqualTo(5);
        assertThat(mapped.rows()).singleElement()
                .satisfies(row -> assertThat(row.getTotalDoses()).isEqualTo(40L));
    }
}
