package com.example.usage;

import java.util.function.Function;

public enum GroupBy {
    INSTANCE(GroupKeys.instanceName()),
    INSTANCE_PATH(GroupKeys.instancePath()),
    DATE(r -> r.date().toString()),
    RESOURCE_GROUP(GroupKeys.resourceGroup()),
    METER_CATEGORY(GroupKeys.meterCategory()),
    BILLING_MONTH(r -> GroupKeys.billingMonth().apply(r).toString()),
    STORAGE_DETAIL(GroupKeys.storageDetailCategory()),
    INSTANCE_AND_CATEGORY(GroupKeys.composite(GroupKeys.instanceName(), GroupKeys.meterCategory()));

    private final Function<UsageRecord, String> key;

    GroupBy(Function<UsageRecord, String> key) {
        this.key = key;
    }

    public Function<UsageRecord, String> key() {
        return key;
    }
}
