package com.example.usage;

import java.math.BigDecimal;
import java.util.List;

/**
 * Key-by-key difference between two periods. Rows are ordered by descending difference, so the
 * biggest increases come first.
 */
public record PeriodComparison<K>(List<Row<K>> rows, Summary summary) {

    public record Row<K>(K key, BigDecimal previousTotal, BigDecimal currentTotal) {
        public BigDecimal difference() {
            return currentTotal.subtract(previousTotal);
        }
    }

    public record Summary(
            int keys,
            BigDecimal previousTotal,
            BigDecimal currentTotal,
            BigDecimal difference,
            int increased,
            int decreased,
            int unchanged,
            int added,
            int removed) {}
}
