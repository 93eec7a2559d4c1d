package com.example.usage;

import java.math.BigDecimal;
import java.time.LocalDate;

public record UsageRecord(
        String instancePath,
        String instanceName,
        String resourceGroup,
        LocalDate date,
        BigDecimal quantity,
        BigDecimal effectivePrice,
        BigDecimal costInBillingCurrency,
        String meterCategory,
        String meterSubCategory,
        String meterName,
        LocalDate billingPeriodStart,
        BigDecimal payGPrice) {

    public BigDecimal priceTimesQuantity() {
        return effectivePrice.multiply(quantity);
    }

    /** List-price cost; without a pay-as-you-go price the effective price stands in. */
    public BigDecimal payGCost() {
        return payGPrice == null ? priceTimesQuantity() : payGPrice.multiply(quantity);
    }

    /** Provider cost minus price * quantity. */
    public BigDecimal costDrift() {
        return costInBillingCurrency.subtract(priceTimesQuantity());
    }

    public static String leafName(String path) {
        var trimmed = path.endsWith("/") && path.length() > 1 ? path.substring(0, path.length() - 1) : path;
        var slash = trimmed.lastIndexOf('/');
        return slash < 0 ? trimmed : trimmed.substring(slash + 1);
    }
}
