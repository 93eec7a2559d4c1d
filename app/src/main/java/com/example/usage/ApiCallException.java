package com.example.usage;

import java.time.Duration;

class ApiCallException extends RuntimeException {

    enum Outcome { UNAUTHORIZED, RATE_LIMITED, TRANSIENT, API_VERSION_REJECTED, REJECTED, MALFORMED }

    private final Outcome outcome;
    private final int status;
    private final Duration retryAfter;

    ApiCallException(Outcome outcome, int status, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.outcome = outcome;
        this.status = status;
        this.retryAfter = retryAfter;
    }

    Outcome outcome() { return outcome; }
    int status() { return status; }
    /** Provider-specified delay, or null when the response named none. */
    Duration retryAfter() { return retryAfter; }
}
