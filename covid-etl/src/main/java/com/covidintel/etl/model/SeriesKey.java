package com.covidintel.etl.model;

/** Identity of a historical series. */
public record SeriesKey(String country, HistoricalMetric metric) {

    @Override
    public String toString() {
        return country + "/" + (metric == null ? "?" : metric.code());
    }
}
