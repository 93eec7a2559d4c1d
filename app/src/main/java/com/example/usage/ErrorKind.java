package com.example.usage;

public enum ErrorKind {
    UNAUTHORIZED,
    RATE_LIMIT_EXCEEDED,
    TRANSIENT_FETCH_ERROR,
    MALFORMED_RESPONSE,
    REQUEST_REJECTED,
    INVALID_RECORD,
    TOTAL_MISMATCH,
    CANCELLED
}
