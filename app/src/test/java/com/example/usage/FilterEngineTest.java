package com.example.usage;

import static com.example.usage.UsageFixtures.cost;
import static com.example.usage.UsageFixtures.meter;
import static com.example.usage.UsagePredicates.allOf;
import static com.example.usage.UsagePredicates.anyOf;
import static com.example.usage.UsagePredicates.dateBetween;
import static com.example.usage.UsagePredicates.instanceMatches;
import static com.example.usage.UsagePredicates.instanceNameContains;
import static com.example.usage.UsagePredicates.instancePathContains;
import static com.example.usage.UsagePredicates.meterCategoryIn;
import static com.example.usage.UsagePredicates.not;
import static com.example.usage.UsagePredicates.resourceGroupIs;
import static com.example.usage.UsagePredicates.storageRelated;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FilterEngineTest {

    private final FilterEngine filterEngine = new FilterEngine();
    private final AggregationEngine engine = new AggregationEngine(new UsageProperties());

    private final List<UsageRecord> records = List.of(
            cost("Web-Prod-01", "10", LocalDate.of(2025, 5, 1)),
            cost("db-prod-01", "20", LocalDate.of(2025, 5, 2)),
            cost("web-test-02", "5", LocalDate.of(2025, 5, 3)),
            cost("WEB-prod-03", "7", LocalDate.of(2025, 5, 4)));

    @Test
    void substringMatchIgnoresCaseAndKeepsOrder() {
        var matched = filterEngine.filter(records, instanceNameContains("web"));

        assertThat(matched).extracting(UsageRecord::instanceName)
                .containsExactly("Web-Prod-01", "web-test-02", "WEB-prod-03");
    }

    @Test
    void pathContainsMatchesResourceProviderSegments() {
        assertThat(filterEngine.filter(records, instancePathContains("MICROSOFT.COMPUTE"))).hasSize(4);
        assertThat(filterEngine.filter(records, instancePathContains("storageAccounts"))).isEmpty();
    }

    @Test
    void regexMatchIgnoresCase() {
        var matched = filterEngine.filter(records, instanceMatches("^web-prod-\\d+$"));

        assertThat(matched).extracting(UsageRecord::instanceName).containsExactly("Web-Prod-01", "WEB-prod-03");
    }

    @Test
    void predicatesCompose() {
        var inRange = dateBetween(LocalDate.of(2025, 5, 2), LocalDate.of(2025, 5, 4));

        var both = filterEngine.filter(records, allOf(instanceNameContains("prod"), inRange));
        var either = filterEngine.filter(records, anyOf(instanceNameContains("db"), instanceNameContains("test")));

        assertThat(both).extracting(UsageRecord::instanceName).containsExactly("db-prod-01", "WEB-prod-03");
        assertThat(either).extracting(UsageRecord::instanceName).containsExactly("db-prod-01", "web-test-02");
    }

    @Test
    void meterCategoryMembershipIgnoresCase() {
        assertThat(filterEngine.filter(records, meterCategoryIn(List.of("virtual machines")))).hasSize(4);
        assertThat(filterEngine.filter(records, meterCategoryIn(List.of("Storage")))).isEmpty();
    }

    @Test
    void resourceGroupMatchIgnoresCase() {
        assertThat(filterEngine.filter(records, resourceGroupIs("RG-App"))).hasSize(4);
        assertThat(filterEngine.filter(records, not(resourceGroupIs("rg-app")))).isEmpty();
    }

    @Test
    void storageCoversStorageBackupAndDiskMeters() {
        var mixed = List.of(
                meter("acct-1", "1", "Storage", "Tables", "LRS Data Stored"),
                meter("vault-1", "1", "Backup", null, null),
                meter("vm-1", "1", "Virtual Machines", "Premium SSD Managed Disks", "P10 Disks"),
                meter("vm-2", "1", "Virtual Machines", null, "Snapshot LRS"),
                meter("vm-3", "1", "Virtual Machines", "Dv3 Series", "D2 v3"),
                meter("ip-1", "1", null, null, null));

        assertThat(filterEngine.filter(mixed, storageRelated())).extracting(UsageRecord::instanceName)
                .containsExactly("acct-1", "vault-1", "vm-1", "vm-2");
        assertThat(filterEngine.filter(mixed, not(storageRelated()))).extracting(UsageRecord::instanceName)
                .containsExactly("vm-3", "ip-1");
    }

    @Test
    void inputIsLeftUntouched() {
        var input = new ArrayList<>(records);

        var matched = filterEngine.filter(input, instanceNameContains("db"));

        assertThat(input).containsExactlyElementsOf(records);
        assertThat(matched).isNotSameAs(input).hasSize(1);
    }

    @Test
    void filteringCommutesWithAggregation() {
        var records = AggregationEngineTest.randomRecords(120, 3);
        var predicate = instanceNameContains("vm-1");

        var filteredFirst = engine.aggregate(filterEngine.filter(records, predicate), GroupKeys.instanceName());
        var aggregatedFirst = engine.aggregate(records, GroupKeys.instanceName()).groups().stream()
                .filter(g -> g.key().toLowerCase().contains("vm-1"))
                .toList();

        assertThat(filteredFirst.groups()).isEqualTo(aggregatedFirst);
    }
}
