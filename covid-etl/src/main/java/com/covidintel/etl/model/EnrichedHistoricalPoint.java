package com.covidintel.etl.model;

import lombok.Builder;
import lombok.Value;

/**
 * Historical point with day-over-day change, trailing averages and calendar columns.
 */
@Value
@Builder
public class EnrichedHistoricalPoint {

    HistoricalPoint point;

    /** value(t) - value(t-1); null on the first point of a series */
    Long dailyChange;

    /** dailyChange / value(t-1) as a fraction; null when undefined */
    Double dailyChangePct;

    /** Mean of the trailing <= 7 present values, current point included */
    Double value7DayAvg;

    /** Mean of the non-null daily changes in the same window */
    Double dailyChange7DayAvg;

    int year;
    int month;

    /** ISO day of week, Monday = 1 */
    int dayOfWeek;

    /** ISO week of year */
    int weekOfYear;
}
