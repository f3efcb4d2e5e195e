package com.covidintel.etl.service;

import com.covidintel.etl.model.DiseaseApiRegion;
import com.covidintel.etl.model.RegionType;
import com.covidintel.etl.model.Snapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class SnapshotMapperTest {

    private static final Instant EXTRACTED = Instant.parse("2024-03-01T06:00:00Z");

    private final SnapshotMapper mapper = new SnapshotMapper();

    private static DiseaseApiRegion raw() {
        DiseaseApiRegion raw = new DiseaseApiRegion();
        raw.setUpdated(1_709_272_800_000L);
        raw.setCountry("UK");
        raw.setContinent("Europe");
        raw.setState("Texas");
        raw.setCases(24_000_000L);
        raw.setDeaths(230_000L);
        raw.setRecovered(23_000_000L);
        raw.setActive(770_000L);
        raw.setPopulation(68_000_000L);
        raw.setCasesPerOneMillion(352_941.0);
        return raw;
    }

    @Test
    void map_country_takesCountryNameAndContinent() {
        Snapshot s = mapper.map(raw(), RegionType.COUNTRY, EXTRACTED);

        assertThat(s.getRegionType()).isEqualTo(RegionType.COUNTRY);
        assertThat(s.getRegionName()).isEqualTo("UK");
        assertThat(s.getContinent()).isEqualTo("Europe");
        assertThat(s.getCountry()).isNull();
        assertThat(s.getCases()).isEqualTo(24_000_000L);
        assertThat(s.getCasesPerOneMillion()).isEqualTo(352_941.0);
        assertThat(s.getUpdated()).isEqualTo(Instant.ofEpochMilli(1_709_272_800_000L));
        assertThat(s.getExtractionDate()).isEqualTo(EXTRACTED);
        assertThat(s.getDataSource()).isEqualTo("disease.sh");
    }

    @Test
    void map_regionNamePerEndpoint() {
        assertThat(mapper.map(raw(), RegionType.GLOBAL, EXTRACTED).getRegionName()).isEqualTo("World");
        assertThat(mapper.map(raw(), RegionType.CONTINENT, EXTRACTED).getRegionName()).isEqualTo("Europe");

        Snapshot state = mapper.map(raw(), RegionType.STATE, EXTRACTED);
        assertThat(state.getRegionName()).isEqualTo("Texas");
        assertThat(state.getCountry()).isEqualTo("USA");
        assertThat(state.getContinent()).isNull();
    }

    @Test
    void map_missingUpdated_staysNull() {
        DiseaseApiRegion raw = raw();
        raw.setUpdated(null);

        assertThat(mapper.map(raw, RegionType.COUNTRY, EXTRACTED).getUpdated()).isNull();
    }
}
