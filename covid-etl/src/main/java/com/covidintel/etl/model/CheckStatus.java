package com.covidintel.etl.model;

public enum CheckStatus {
    PASS,
    FAIL
}
