package com.covidintel.etl.service;

import com.covidintel.etl.model.DiseaseApiRegion;
import com.covidintel.etl.model.RegionType;
import com.covidintel.etl.model.Snapshot;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Maps raw disease.sh region DTOs to the canonical snapshot model.
 */
@Component
public class SnapshotMapper {

    static final String DATA_SOURCE = "disease.sh";
    static final String GLOBAL_REGION_NAME = "World";
    static final String STATES_COUNTRY = "USA";

    /**
     * @param raw            Raw DTO from the API
     * @param regionType     Which endpoint the DTO came from
     * @param extractionDate When this extraction cycle started
     */
    public Snapshot map(DiseaseApiRegion raw, RegionType regionType, Instant extractionDate) {
        return Snapshot.builder()
                .regionType(regionType)
                .regionName(regionName(raw, regionType))
                .country(regionType == RegionType.STATE ? STATES_COUNTRY : null)
                .continent(regionType == RegionType.COUNTRY ? raw.getContinent() : null)
                .cases(raw.getCases())
                .deaths(raw.getDeaths())
                .recovered(raw.getRecovered())
                .active(raw.getActive())
                .critical(raw.getCritical())
                .todayCases(raw.getTodayCases())
                .todayDeaths(raw.getTodayDeaths())
                .todayRecovered(raw.getTodayRecovered())
                .population(raw.getPopulation())
                .tests(raw.getTests())
                .casesPerOneMillion(raw.getCasesPerOneMillion())
                .deathsPerOneMillion(raw.getDeathsPerOneMillion())
                .testsPerOneMillion(raw.getTestsPerOneMillion())
                .updated(raw.getUpdated() == null ? null : Instant.ofEpochMilli(raw.getUpdated()))
                .extractionDate(extractionDate)
                .dataSource(DATA_SOURCE)
                .build();
    }

    private String regionName(DiseaseApiRegion raw, RegionType regionType) {
        return switch (regionType) {
            case GLOBAL -> GLOBAL_REGION_NAME;
            case COUNTRY -> raw.getCountry();
            case CONTINENT -> raw.getContinent();
            case STATE -> raw.getState();
        };
    }
}
