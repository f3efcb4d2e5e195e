package com.covidintel.etl.exception;

public class ExtractionException extends CovidEtlException {
    public ExtractionException(String message, Throwable cause) {
        super("EXTRACTION_FAILED", message, cause);
    }
}
