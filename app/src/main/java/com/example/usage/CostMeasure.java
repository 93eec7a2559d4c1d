package com.example.usage;

import java.math.BigDecimal;
import java.util.function.Function;

public enum CostMeasure implements Function<UsageRecord, BigDecimal> {
    BILLED_COST {
        @Override
        public BigDecimal apply(UsageRecord record) {
            return record.costInBillingCurrency();
        }
    },
    PRICE_TIMES_QUANTITY {
        @Override
        public BigDecimal apply(UsageRecord record) {
            return record.priceTimesQuantity();
        }
    },
    PAYG_COST {
        @Override
        public BigDecimal apply(UsageRecord record) {
            return record.payGCost();
        }
    }
}
