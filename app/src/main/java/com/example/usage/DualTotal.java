package com.example.usage;

import java.math.BigDecimal;
import java.util.List;

/**
 * The same input summed two ways: provider cost and effective price * quantity. Records whose
 * own pair differs by more than the tolerance are counted, with the first few kept as samples.
 */
public record DualTotal(BigDecimal billedCost, BigDecimal priceTimesQuantity,
                        long violationCount, List<UsageRecord> sampleViolations) {

    public BigDecimal difference() {
        return billedCost.subtract(priceTimesQuantity).abs();
    }

    public boolean consistent(BigDecimal tolerance) {
        return violationCount == 0 && difference().compareTo(tolerance) <= 0;
    }
}
