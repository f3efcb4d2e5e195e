package com.covidintel.etl.exception;

import lombok.Getter;

@Getter
public abstract class CovidEtlException extends RuntimeException {
    private final String errorCode;
    protected CovidEtlException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected CovidEtlException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
