package com.example.usage;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Group-by/sum over materialized usage records. The grouping dimension is supplied by the
 * caller (see {@link GroupKeys}), so the same engine serves per-instance, per-day and
 * per-category rollups.
 */
@Component
public class AggregationEngine {
    static final int VIOLATION_SAMPLES = 10;

    private final BigDecimal tolerance;

    public AggregationEngine(UsageProperties properties) {
        this.tolerance = properties.getTolerance();
    }

    public <K extends Comparable<? super K>> AggregationResult<K> aggregate(
            List<UsageRecord> records, Function<? super UsageRecord, ? extends K> keyFn) {
        return aggregate(records, keyFn, CostMeasure.BILLED_COST);
    }

    public <K extends Comparable<? super K>> AggregationResult<K> aggregate(
            List<UsageRecord> records, Function<? super UsageRecord, ? extends K> keyFn, CostMeasure measure) {
        Objects.requireNonNull(keyFn, "keyFn");
        Objects.requireNonNull(measure, "measure");

        var totals = new HashMap<K, BigDecimal>();
        var counts = new HashMap<K, Long>();
        var grandTotal = BigDecimal.ZERO;
        for (var record : records) {
            K key = Objects.requireNonNull(keyFn.apply(record), "group key");
            var value = measure.apply(record);
            totals.merge(key, value, BigDecimal::add);
            counts.merge(key, 1L, Long::sum);
            grandTotal = grandTotal.add(value);
        }

        var groups = new ArrayList<GroupTotal<K>>(totals.size());
        for (Map.Entry<K, BigDecimal> e : totals.entrySet()) {
            groups.add(new GroupTotal<>(e.getKey(), e.getValue(), counts.get(e.getKey())));
        }
        groups.sort(AggregationResult.ranking());
        return new AggregationResult<>(List.copyOf(groups), grandTotal, records.size(), measure, dualTotal(records));
    }

    /** Both totals over the same input, with per-record drift beyond the tolerance collected. */
    public DualTotal dualTotal(List<UsageRecord> records) {
        var billed = BigDecimal.ZERO;
        var computed = BigDecimal.ZERO;
        long violations = 0;
        var samples = new ArrayList<UsageRecord>();
        for (var record : records) {
            billed = billed.add(record.costInBillingCurrency());
            computed = computed.add(record.priceTimesQuantity());
            if (record.costDrift().abs().compareTo(tolerance) > 0) {
                violations++;
                if (samples.size() < VIOLATION_SAMPLES) {
                    samples.add(record);
                }
            }
        }
        return new DualTotal(billed, computed, violations, List.copyOf(samples));
    }
}
