package com.covidintel.etl.exception;

import com.covidintel.etl.model.SeriesKey;
import lombok.Getter;

/**
 * Raised when a historical series reaches the temporal analyzer unsorted,
 * with a repeated date, or mixed with another series. Indicates an upstream bug.
 */
@Getter
public class SeriesOutOfOrderException extends CovidEtlException {

    private final SeriesKey series;

    public SeriesOutOfOrderException(SeriesKey series, String message) {
        super("SERIES_OUT_OF_ORDER", "Series " + series + ": " + message);
        this.series = series;
    }
}
