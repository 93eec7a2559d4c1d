package com.example.usage;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.function.Function;

/** Key extractors for {@link AggregationEngine}. None of them returns null. */
public final class GroupKeys {
    public static final String NONE = "(none)";

    private GroupKeys() {}

    public static Function<UsageRecord, String> instanceName() {
        return UsageRecord::instanceName;
    }

    public static Function<UsageRecord, String> instancePath() {
        return UsageRecord::instancePath;
    }

    public static Function<UsageRecord, LocalDate> date() {
        return UsageRecord::date;
    }

    public static Function<UsageRecord, String> resourceGroup() {
        return r -> orNone(r.resourceGroup());
    }

    public static Function<UsageRecord, String> meterCategory() {
        return r -> orNone(r.meterCategory());
    }

    public static Function<UsageRecord, YearMonth> billingMonth() {
        return r -> YearMonth.from(r.billingPeriodStart());
    }

    /** Storage meters split per account ("Storage (acct)"), every other category as is. */
    public static Function<UsageRecord, String> storageDetailCategory() {
        return r -> "Storage".equals(r.meterCategory())
                ? "Storage (" + r.instanceName() + ")"
                : orNone(r.meterCategory());
    }

    /** Two keys joined with " | ", e.g. instance and category. */
    public static Function<UsageRecord, String> composite(Function<UsageRecord, ?> first,
                                                          Function<UsageRecord, ?> second) {
        return r -> first.apply(r) + " | " + second.apply(r);
    }

    private static String orNone(String value) {
        return value == null ? NONE : value;
    }
}
