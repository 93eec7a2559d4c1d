package com.example.usage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders aggregation results. Nothing is rendered unless the billed cost and price * quantity
 * of the result's input agree within the configured tolerance.
 */
@Component
public class ReportFormatter {
    private static final Logger log = LoggerFactory.getLogger(ReportFormatter.class);

    static final String OTHER = "(other)";

    private final BigDecimal tolerance;
    private final int scale;
    private final ObjectMapper mapper;

    public ReportFormatter(UsageProperties properties, ObjectMapper mapper) {
        this.tolerance = properties.getTolerance();
        this.scale = properties.getDisplayScale();
        this.mapper = mapper;
    }

    public UsageReport format(AggregationResult<?> result, ReportStyle style) {
        verifyTotals(result);
        return switch (style) {
            case FLAT_TOTAL -> new UsageReport.FlatTotal(round(result.grandTotal()));
            case GROUPED -> grouped(result);
            case DAILY_SERIES -> series(result);
        };
    }

    /** Fails with {@link TotalMismatchException} when the two independent totals disagree. */
    public void verifyTotals(AggregationResult<?> result) {
        var dual = result.dualTotal();
        if (!dual.consistent(tolerance)) {
            log.error("Dual-total check failed over {} records: cost {} vs price*quantity {} ({} inconsistent records)",
                    result.recordCount(), dual.billedCost(), dual.priceTimesQuantity(), dual.violationCount());
            throw new TotalMismatchException(dual, tolerance, result.recordCount());
        }
    }

    public String toJson(UsageReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Report could not be serialized", e);
        }
    }

    private UsageReport grouped(AggregationResult<?> result) {
        var lines = new ArrayList<UsageReport.Grouped.Line>(result.groups().size());
        for (var group : result.groups()) {
            lines.add(new UsageReport.Grouped.Line(String.valueOf(group.key()), round(group.total())));
        }
        // groups cut by top(n) are summed into one line so the lines still add up to the grand total
        var rest = result.grandTotal().subtract(result.sumOfGroups());
        if (rest.signum() != 0) {
            lines.add(new UsageReport.Grouped.Line(OTHER, round(rest)));
        }
        return new UsageReport.Grouped(lines, round(result.grandTotal()));
    }

    private UsageReport series(AggregationResult<?> result) {
        var points = new ArrayList<UsageReport.Series.Point>(result.groups().size());
        for (var group : result.groups()) {
            if (!(group.key() instanceof LocalDate date)) {
                throw new IllegalArgumentException("Daily series needs date keys, got " + group.key());
            }
            points.add(new UsageReport.Series.Point(date, round(group.total())));
        }
        points.sort((a, b) -> a.date().compareTo(b.date()));
        return new UsageReport.Series(points);
    }

    private BigDecimal round(BigDecimal value) {
        return value.setScale(scale, RoundingMode.HALF_UP);
    }
}
