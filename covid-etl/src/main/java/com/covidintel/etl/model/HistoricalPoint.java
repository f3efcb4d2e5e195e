package com.covidintel.etl.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/** One (country, metric, day) observation of a cumulative value. */
@Value
@Builder(toBuilder = true)
public class HistoricalPoint {

    String country;
    HistoricalMetric metric;
    LocalDate date;
    long value;

    public SeriesKey seriesKey() {
        return new SeriesKey(country, metric);
    }
}
