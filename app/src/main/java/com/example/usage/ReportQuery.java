package com.example.usage;

import java.time.LocalDate;
import java.util.List;

/**
 * One report request. {@code contains} and {@code pattern} match instance name or path
 * ignoring case. {@code storage} keeps only storage-related records when true, drops them when
 * false and ignores the distinction when null. {@code top} keeps the N largest groups.
 */
public record ReportQuery(
        String subscriptionId,
        LocalDate startDate,
        LocalDate endDate,
        GroupBy groupBy,
        ReportStyle style,
        CostMeasure measure,
        String contains,
        String pattern,
        List<String> meterCategories,
        String resourceGroup,
        Boolean storage,
        Integer top) {

    public ReportQuery {
        groupBy = groupBy == null ? GroupBy.INSTANCE : groupBy;
        style = style == null ? ReportStyle.GROUPED : style;
        measure = measure == null ? CostMeasure.BILLED_COST : measure;
        meterCategories = meterCategories == null ? List.of() : List.copyOf(meterCategories);
    }

    public static ReportQuery grouped(String subscriptionId, LocalDate startDate, LocalDate endDate, GroupBy groupBy) {
        return new ReportQuery(subscriptionId, startDate, endDate, groupBy, ReportStyle.GROUPED,
                CostMeasure.BILLED_COST, null, null, List.of(), null, null, null);
    }
}
