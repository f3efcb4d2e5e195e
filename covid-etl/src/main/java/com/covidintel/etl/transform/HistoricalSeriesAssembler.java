package com.covidintel.etl.transform;

import com.covidintel.etl.model.HistoricalPoint;
import com.covidintel.etl.model.SeriesKey;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups flat historical points into per-(country, metric) series sorted by date,
 * satisfying the temporal analyzer's precondition.
 *
 * A repeated (country, metric, date) keeps the last occurrence, matching how the
 * source republishes corrected values. Points missing country, metric or date are
 * isolated and counted.
 */
@Slf4j
public class HistoricalSeriesAssembler {

    public record AssembledSeries(Map<SeriesKey, List<HistoricalPoint>> series,
                                  int duplicatesDropped,
                                  int malformed) {}

    public AssembledSeries assemble(List<HistoricalPoint> points) {
        Map<SeriesKey, TreeMap<LocalDate, HistoricalPoint>> grouped = new LinkedHashMap<>();
        int duplicates = 0;
        int malformed = 0;

        for (HistoricalPoint p : points) {
            if (p == null || p.getCountry() == null || p.getMetric() == null || p.getDate() == null) {
                malformed++;
                continue;
            }
            HistoricalPoint replaced = grouped
                    .computeIfAbsent(p.seriesKey(), k -> new TreeMap<>())
                    .put(p.getDate(), p);
            if (replaced != null) duplicates++;
        }

        Map<SeriesKey, List<HistoricalPoint>> series = new LinkedHashMap<>();
        grouped.forEach((key, byDate) -> series.put(key, new ArrayList<>(byDate.values())));

        if (duplicates > 0 || malformed > 0) {
            log.info("Assembled {} series: dropped {} duplicate dates, {} malformed points",
                    series.size(), duplicates, malformed);
        }
        return new AssembledSeries(series, duplicates, malformed);
    }
}
