package com.example.usage;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

@Component
public class PeriodComparator {

    public <K extends Comparable<? super K>> PeriodComparison<K> compare(
            AggregationResult<K> previous, AggregationResult<K> current) {
        var previousTotals = totals(previous);
        var currentTotals = totals(current);
        var keys = new TreeSet<K>(previousTotals.keySet());
        keys.addAll(currentTotals.keySet());

        var rows = new ArrayList<PeriodComparison.Row<K>>(keys.size());
        int increased = 0, decreased = 0, unchanged = 0, added = 0, removed = 0;
        for (var key : keys) {
            var before = previousTotals.get(key);
            var after = currentTotals.get(key);
            var row = new PeriodComparison.Row<>(key,
                    before == null ? BigDecimal.ZERO : before,
                    after == null ? BigDecimal.ZERO : after);
            rows.add(row);
            if (before == null) added++;
            if (after == null) removed++;
            switch (row.difference().signum()) {
                case 1 -> increased++;
                case -1 -> decreased++;
                default -> unchanged++;
            }
        }
        rows.sort(Comparator.comparing(PeriodComparison.Row<K>::difference).reversed()
                .thenComparing(PeriodComparison.Row<K>::key));

        var summary = new PeriodComparison.Summary(rows.size(), previous.grandTotal(), current.grandTotal(),
                current.grandTotal().subtract(previous.grandTotal()),
                increased, decreased, unchanged, added, removed);
        return new PeriodComparison<>(rows, summary);
    }

    private static <K extends Comparable<? super K>> Map<K, BigDecimal> totals(AggregationResult<K> result) {
        var totals = new TreeMap<K, BigDecimal>();
        result.groups().forEach(g -> totals.put(g.key(), g.total()));
        return totals;
    }
}
