package com.covidintel.etl.validation;

/** Raw result of a violation counter before the threshold is applied. */
public record CheckOutcome(long observed, String detail) {

    public static CheckOutcome rows(long observed) {
        return new CheckOutcome(observed, observed + " violating rows");
    }
}
