package com.example.usage;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

/**
 * Ranked group totals plus the grand total of the ungrouped input. Groups are ordered by
 * descending total, then ascending key.
 */
public record AggregationResult<K extends Comparable<? super K>>(
        List<GroupTotal<K>> groups,
        BigDecimal grandTotal,
        long recordCount,
        CostMeasure measure,
        DualTotal dualTotal) {

    public static <K extends Comparable<? super K>> Comparator<GroupTotal<K>> ranking() {
        return Comparator.<GroupTotal<K>, BigDecimal>comparing(GroupTotal<K>::total).reversed()
                .thenComparing(GroupTotal<K>::key);
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    /** First {@code n} groups; the grand total still covers the whole input. */
    public AggregationResult<K> top(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative");
        }
        return n >= groups.size() ? this
                : new AggregationResult<>(List.copyOf(groups.subList(0, n)), grandTotal, recordCount, measure, dualTotal);
    }

    /** Same groups ordered by ascending key, as needed for time series. */
    public AggregationResult<K> sortedByKey() {
        var sorted = groups.stream().sorted(Comparator.comparing(GroupTotal<K>::key)).toList();
        return new AggregationResult<>(sorted, grandTotal, recordCount, measure, dualTotal);
    }

    public BigDecimal total(K key) {
        return groups.stream()
                .filter(g -> g.key().equals(key))
                .map(GroupTotal::total)
                .findFirst()
                .orElse(BigDecimal.ZERO);
    }

    public BigDecimal sumOfGroups() {
        return groups.stream().map(GroupTotal::total).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
