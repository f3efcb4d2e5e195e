package com.covidintel.etl.service;

import com.covidintel.etl.model.DiseaseApiTimeline;
import com.covidintel.etl.model.HistoricalMetric;
import com.covidintel.etl.model.HistoricalPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Flattens disease.sh timelines into one point per (country, metric, date).
 *
 * Timeline keys look like "3/9/23". Entries with an unparseable date, a missing
 * value or a negative value are isolated and counted. A country published only
 * as province rows (Canada, Australia) gets the sum of its provinces; when a
 * country-level row exists its province rows are ignored.
 */
@Component
@Slf4j
public class HistoricalMapper {

    private static final DateTimeFormatter TIMELINE_DATE = DateTimeFormatter.ofPattern("M/d/yy");

    public record Mapped(List<HistoricalPoint> points, int malformed) {}

    public Mapped map(List<DiseaseApiTimeline> timelines) {
        List<HistoricalPoint> points = new ArrayList<>();
        Map<String, List<DiseaseApiTimeline>> provincesByCountry = new LinkedHashMap<>();
        Set<String> countryLevel = new HashSet<>();
        int malformed = 0;

        for (DiseaseApiTimeline raw : timelines) {
            if (raw.getCountry() == null || raw.getCountry().isBlank() || raw.getTimeline() == null) {
                malformed++;
                continue;
            }
            if (isProvinceRow(raw)) {
                provincesByCountry.computeIfAbsent(raw.getCountry(), c -> new ArrayList<>()).add(raw);
                continue;
            }

            countryLevel.add(raw.getCountry());
            DiseaseApiTimeline.Timeline timeline = raw.getTimeline();
            for (HistoricalMetric metric : HistoricalMetric.values()) {
                malformed += flatten(values(timeline, metric), (date, value) -> points.add(
                        point(raw.getCountry(), metric, date, value)));
            }
        }

        int summed = 0;
        for (Map.Entry<String, List<DiseaseApiTimeline>> entry : provincesByCountry.entrySet()) {
            if (countryLevel.contains(entry.getKey())) continue;
            malformed += sumProvinces(entry.getKey(), entry.getValue(), points);
            summed++;
        }

        log.info("Mapped {} historical points from {} timelines ({} malformed, {} countries summed from provinces)",
                points.size(), timelines.size(), malformed, summed);
        return new Mapped(points, malformed);
    }

    /** Parse a timeline key such as "3/9/23"; null when it is not a date. */
    static LocalDate parseTimelineDate(String key) {
        if (key == null) return null;
        try {
            return LocalDate.parse(key.trim(), TIMELINE_DATE);
        } catch (DateTimeParseException e) {
            log.warn("Could not parse timeline date: {}", key);
            return null;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private interface PointSink {
        void accept(LocalDate date, long value);
    }

    private static boolean isProvinceRow(DiseaseApiTimeline raw) {
        return raw.getProvince() instanceof String province && !province.isBlank()
                && !"mainland".equalsIgnoreCase(province);
    }

    private int sumProvinces(String country, List<DiseaseApiTimeline> provinces, List<HistoricalPoint> out) {
        Map<HistoricalMetric, Map<LocalDate, Long>> totals = new EnumMap<>(HistoricalMetric.class);
        int malformed = 0;
        for (DiseaseApiTimeline province : provinces) {
            for (HistoricalMetric metric : HistoricalMetric.values()) {
                Map<LocalDate, Long> byDate = totals.computeIfAbsent(metric, m -> new TreeMap<>());
                malformed += flatten(values(province.getTimeline(), metric),
                        (date, value) -> byDate.merge(date, value, Long::sum));
            }
        }
        totals.forEach((metric, byDate) ->
                byDate.forEach((date, value) -> out.add(point(country, metric, date, value))));
        log.debug("Summed {} province timelines into {}", provinces.size(), country);
        return malformed;
    }

    private static Map<String, Long> values(DiseaseApiTimeline.Timeline timeline, HistoricalMetric metric) {
        return switch (metric) {
            case CASES -> timeline.getCases();
            case DEATHS -> timeline.getDeaths();
            case RECOVERED -> timeline.getRecovered();
        };
    }

    private int flatten(Map<String, Long> values, PointSink sink) {
        if (values == null) return 0;
        int malformed = 0;
        for (Map.Entry<String, Long> entry : values.entrySet()) {
            LocalDate date = parseTimelineDate(entry.getKey());
            Long value = entry.getValue();
            if (date == null || value == null || value < 0) {
                malformed++;
                continue;
            }
            sink.accept(date, value);
        }
        return malformed;
    }

    private static HistoricalPoint point(String country, HistoricalMetric metric, LocalDate date, long value) {
        return HistoricalPoint.builder()
                .country(country)
                .metric(metric)
                .date(date)
                .value(value)
                .build();
    }
}
