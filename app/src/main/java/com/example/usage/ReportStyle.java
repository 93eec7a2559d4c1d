package com.example.usage;

public enum ReportStyle {
    /** {@code { grandTotal }} */
    FLAT_TOTAL,
    /** {@code { groups: [{ key, total }], grandTotal }} */
    GROUPED,
    /** {@code { series: [{ date, total }] }}, ascending by date. */
    DAILY_SERIES
}
