package com.example.usage;

import static com.example.usage.UsageFixtures.cost;
import static com.example.usage.UsageFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class AggregationEngineTest {

    private final AggregationEngine engine = new AggregationEngine(new UsageProperties());

    @Test
    void groupsByInstanceAndRanksByTotal() {
        var records = List.of(cost("vm-a", "10"), cost("vm-b", "5"), cost("vm-a", "3"));

        var result = engine.aggregate(records, GroupKeys.instanceName());

        assertThat(result.groups()).extracting(GroupTotal::key).containsExactly("vm-a", "vm-b");
        assertThat(result.groups().get(0).total()).isEqualByComparingTo("13");
        assertThat(result.groups().get(0).recordCount()).isEqualTo(2);
        assertThat(result.groups().get(1).total()).isEqualByComparingTo("5");
        assertThat(result.grandTotal()).isEqualByComparingTo("18");
        assertThat(result.recordCount()).isEqualTo(3);
    }

    @Test
    void emptyInputGivesZeroTotal() {
        var result = engine.aggregate(List.of(), GroupKeys.instanceName());

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.grandTotal()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(result.dualTotal().consistent(new BigDecimal("0.01"))).isTrue();
    }

    @Test
    void tiesAreBrokenByAscendingKey() {
        var records = List.of(cost("vm-c", "4"), cost("vm-a", "4"), cost("vm-b", "4.00"));

        var result = engine.aggregate(records, GroupKeys.instanceName());

        assertThat(result.groups()).extracting(GroupTotal::key).containsExactly("vm-a", "vm-b", "vm-c");
    }

    @Test
    void creditsAreSummedUnmodified() {
        var records = List.of(cost("vm-a", "10"), cost("vm-a", "-2.5"), cost("vm-b", "-1"));

        var result = engine.aggregate(records, GroupKeys.instanceName());

        assertThat(result.total("vm-a")).isEqualByComparingTo("7.5");
        assertThat(result.total("vm-b")).isEqualByComparingTo("-1");
        assertThat(result.grandTotal()).isEqualByComparingTo("6.5");
    }

    @Test
    void grandTotalEqualsSumOfGroups() {
        var records = randomRecords(200, 42);

        var result = engine.aggregate(records, GroupKeys.instanceName());
        var direct = records.stream().map(UsageRecord::costInBillingCurrency).reduce(BigDecimal.ZERO, BigDecimal::add);

        assertThat(result.sumOfGroups()).isEqualByComparingTo(result.grandTotal());
        assertThat(result.grandTotal()).isEqualByComparingTo(direct);
    }

    @Test
    void resultDoesNotDependOnInputOrder() {
        var records = randomRecords(150, 7);
        var shuffled = new ArrayList<>(records);
        Collections.shuffle(shuffled, new Random(99));

        var original = engine.aggregate(records, GroupKeys.instanceName());
        var reordered = engine.aggregate(shuffled, GroupKeys.instanceName());

        assertThat(reordered.groups()).isEqualTo(original.groups());
        assertThat(reordered.grandTotal()).isEqualByComparingTo(original.grandTotal());
    }

    @Test
    void priceTimesQuantityIsAnIndependentMeasure() {
        var records = List.of(
                record("vm-a", UsageFixtures.DAY, "24", "0.25", "6", "Virtual Machines"),
                record("vm-b", UsageFixtures.DAY, "10", "0.1", "1", "Virtual Machines"));

        var billed = engine.aggregate(records, GroupKeys.instanceName(), CostMeasure.BILLED_COST);
        var computed = engine.aggregate(records, GroupKeys.instanceName(), CostMeasure.PRICE_TIMES_QUANTITY);

        assertThat(computed.grandTotal()).isEqualByComparingTo(billed.grandTotal());
        assertThat(computed.measure()).isEqualTo(CostMeasure.PRICE_TIMES_QUANTITY);
        assertThat(billed.dualTotal().violationCount()).isZero();
    }

    @Test
    void dualTotalCollectsInconsistentRecords() {
        var records = List.of(
                cost("vm-a", "10"),
                record("vm-b", UsageFixtures.DAY, "2", "3", "7", "Virtual Machines"));

        var dual = engine.dualTotal(records);

        assertThat(dual.billedCost()).isEqualByComparingTo("17");
        assertThat(dual.priceTimesQuantity()).isEqualByComparingTo("16");
        assertThat(dual.violationCount()).isEqualTo(1);
        assertThat(dual.sampleViolations()).extracting(UsageRecord::instanceName).containsExactly("vm-b");
    }

    @Test
    void chainsDateGroupingAndTopN() {
        var d1 = LocalDate.of(2025, 5, 1);
        var d2 = LocalDate.of(2025, 5, 2);
        var records = List.of(cost("vm-a", "1", d2), cost("vm-b", "5", d1), cost("vm-a", "2", d1), cost("vm-c", "0.5", d2));

        var byDate = engine.aggregate(records, GroupKeys.date()).sortedByKey();
        var top = engine.aggregate(records, GroupKeys.instanceName()).top(2);

        assertThat(byDate.groups()).extracting(GroupTotal::key).containsExactly(d1, d2);
        assertThat(byDate.total(d1)).isEqualByComparingTo("7");
        assertThat(top.groups()).extracting(GroupTotal::key).containsExactly("vm-b", "vm-a");
        assertThat(top.grandTotal()).isEqualByComparingTo("8.5");
    }

    @Test
    void groupsByBillingMonthAndStorageAccount() {
        var records = List.of(
                record("acct1", LocalDate.of(2025, 4, 30), "1", "2", "2", "Storage"),
                record("vm-a", LocalDate.of(2025, 5, 1), "1", "3", "3", "Virtual Machines"),
                record("acct1", LocalDate.of(2025, 5, 2), "1", "1", "1", "Storage"));

        var byMonth = engine.aggregate(records, GroupKeys.billingMonth());
        var byCategory = engine.aggregate(records, GroupKeys.storageDetailCategory());

        assertThat(byMonth.total(YearMonth.of(2025, 5))).isEqualByComparingTo("4");
        assertThat(byCategory.groups()).extracting(GroupTotal::key)
                .containsExactly("Storage (acct1)", "Virtual Machines");
    }

    static List<UsageRecord> randomRecords(int count, long seed) {
        var random = new Random(seed);
        var records = new ArrayList<UsageRecord>();
        for (int i = 0; i < count; i++) {
            var cents = random.nextInt(20_000) - 1_000;
            var value = BigDecimal.valueOf(cents, 2).toPlainString();
            records.add(cost("vm-" + random.nextInt(12), value, UsageFixtures.DAY.plusDays(random.nextInt(30))));
        }
        return records;
    }
}
