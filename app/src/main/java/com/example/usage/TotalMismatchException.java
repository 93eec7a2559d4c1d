package com.example.usage;

import java.math.BigDecimal;
import java.util.stream.Collectors;

public class TotalMismatchException extends UsageReportException {
    private final DualTotal dualTotal;

    public TotalMismatchException(DualTotal dualTotal, BigDecimal tolerance, long recordCount) {
        super(ErrorKind.TOTAL_MISMATCH, Stage.FORMAT, describe(dualTotal, tolerance), recordCount, 0, null);
        this.dualTotal = dualTotal;
    }

    public DualTotal dualTotal() { return dualTotal; }

    private static String describe(DualTotal dual, BigDecimal tolerance) {
        var message = new StringBuilder()
                .append("Billed cost ").append(dual.billedCost().toPlainString())
                .append(" and price * quantity ").append(dual.priceTimesQuantity().toPlainString())
                .append(" differ by ").append(dual.difference().toPlainString())
                .append(" (tolerance ").append(tolerance.toPlainString()).append(")");
        if (dual.violationCount() > 0) {
            message.append("; ").append(dual.violationCount()).append(" record(s) inconsistent, e.g. ")
                    .append(dual.sampleViolations().stream()
                            .map(r -> r.instanceName() + "@" + r.date() + " drift " + r.costDrift().toPlainString())
                            .collect(Collectors.joining(", ")));
        }
        return message.toString();
    }
}
