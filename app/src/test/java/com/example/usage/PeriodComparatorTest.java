package com.example.usage;

import static com.example.usage.UsageFixtures.cost;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class PeriodComparatorTest {

    private final AggregationEngine engine = new AggregationEngine(new UsageProperties());
    private final PeriodComparator comparator = new PeriodComparator();

    @Test
    void joinsBothPeriodsAndRanksByIncrease() {
        var april = engine.aggregate(List.of(cost("vm-a", "10"), cost("vm-b", "8"), cost("vm-old", "4"),
                cost("vm-flat", "2")), GroupKeys.instanceName());
        var may = engine.aggregate(List.of(cost("vm-a", "15"), cost("vm-b", "6"), cost("vm-new", "3"),
                cost("vm-flat", "2")), GroupKeys.instanceName());

        var comparison = comparator.compare(april, may);

        assertThat(comparison.rows()).extracting(PeriodComparison.Row::key)
                .containsExactly("vm-a", "vm-new", "vm-flat", "vm-b", "vm-old");
        assertThat(comparison.rows().get(0).difference()).isEqualByComparingTo("5");
        assertThat(comparison.rows().get(4).currentTotal()).isEqualByComparingTo("0");

        var summary = comparison.summary();
        assertThat(summary.keys()).isEqualTo(5);
        assertThat(summary.previousTotal()).isEqualByComparingTo("24");
        assertThat(summary.currentTotal()).isEqualByComparingTo("26");
        assertThat(summary.difference()).isEqualByComparingTo("2");
        assertThat(summary.increased()).isEqualTo(2);
        assertThat(summary.decreased()).isEqualTo(2);
        assertThat(summary.unchanged()).isEqualTo(1);
        assertThat(summary.added()).isEqualTo(1);
        assertThat(summary.removed()).isEqualTo(1);
    }

    @Test
    void emptyPeriodsCompareToNothing() {
        var empty = engine.aggregate(List.<UsageRecord>of(), GroupKeys.instanceName());

        var comparison = comparator.compare(empty, empty);

        assertThat(comparison.rows()).isEmpty();
        assertThat(comparison.summary().difference()).isEqualByComparingTo("0");
    }
}
