package com.covidintel.etl.exception;

public class MalformedRecordException extends CovidEtlException {
    public MalformedRecordException(String message) {
        super("MALFORMED_RECORD", message);
    }
}
