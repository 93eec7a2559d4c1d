package com.example.usage;

/**
 * Pagination state of a {@link UsageFetch}. FETCHING loops on itself while pages carry a
 * continuation link; RATE_LIMITED is entered while waiting to retry the same page.
 */
public enum FetchState {
    FETCHING,
    RATE_LIMITED,
    DONE,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
