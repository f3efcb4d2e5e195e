package com.covidintel.etl.service;

import com.covidintel.etl.config.CovidEtlProperties;
import com.covidintel.etl.exception.ExtractionException;
import com.covidintel.etl.model.DiseaseApiRegion;
import com.covidintel.etl.model.DiseaseApiTimeline;
import com.covidintel.etl.model.DiseaseApiVaccineCoverage;
import com.covidintel.etl.model.RegionType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Thin client over the disease.sh COVID-19 API.
 *
 * Responses are read as a JSON tree and converted element by element, so one
 * badly typed element is counted as malformed instead of failing the whole table.
 * No retry: transport failures surface as {@link ExtractionException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DiseaseApiClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CovidEtlProperties properties;

    /** Converted elements plus the count of elements that could not be converted. */
    public record Fetched<T>(List<T> items, int malformed) {}

    /**
     * Fetch the current snapshot for one region type.
     * GLOBAL returns a single object; the others return arrays.
     */
    public Fetched<DiseaseApiRegion> fetchSnapshots(RegionType regionType) {
        String path = switch (regionType) {
            case GLOBAL -> "/all";
            case COUNTRY -> "/countries";
            case CONTINENT -> "/continents";
            case STATE -> "/states";
        };
        return convert(callApi(properties.getApi().getBaseUrl() + path), DiseaseApiRegion.class);
    }

    /**
     * Fetch per-country timelines for the last N days.
     */
    public Fetched<DiseaseApiTimeline> fetchHistorical(int lastDays) {
        String url = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl() + "/historical")
                .queryParam("lastdays", lastDays)
                .toUriString();
        return convert(callApi(url), DiseaseApiTimeline.class);
    }

    /**
     * Fetch cumulative vaccine doses per country for the last N days, as flat date-to-count timelines.
     */
    public Fetched<DiseaseApiVaccineCoverage> fetchVaccineCoverage(int lastDays) {
        String url = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl() + "/vaccine/coverage/countries")
                .queryParam("lastdays", lastDays)
                .queryParam("fullData", false)
                .toUriString();
        return convert(callApi(url), DiseaseApiVaccineCoverage.class);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private JsonNode callApi(String url) {
        log.debug("Calling disease.sh API: {}", url);
        try {
            JsonNode response = restTemplate.getForObject(url, JsonNode.class);
            return response == null ? objectMapper.createArrayNode() : response;

        } catch (HttpClientErrorException.NotFound e) {
            // 404 means the source has nothing for this endpoint right now
            log.warn("No data found (404) for URL: {}", url);
            return objectMapper.createArrayNode();

        } catch (Exception e) {
            log.error("API call failed for URL {}: {}", url, e.getMessage());
            throw new ExtractionException("Extraction failed for " + url, e);
        }
    }

    <T> Fetched<T> convert(JsonNode body, Class<T> type) {
        List<JsonNode> elements = new ArrayList<>();
        if (body.isArray()) {
            body.forEach(elements::add);
        } else if (body.isObject()) {
            elements.add(body);
        }

        List<T> items = new ArrayList<>(elements.size());
        int malformed = 0;
        for (JsonNode element : elements) {
            try {
                items.add(objectMapper.treeToValue(element, type));
            } catch (JsonProcessingException e) {
                malformed++;
                log.debug("Skipping malformed {} element: {}", type.getSimpleName(), e.getOriginalMessage());
            }
        }

        log.info("Fetched {} {} elements, {} malformed", items.size(), type.getSimpleName(), malformed);
        return new Fetched<>(items, malformed);
    }
}
