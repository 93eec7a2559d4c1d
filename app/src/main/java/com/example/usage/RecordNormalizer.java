package com.example.usage;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps raw usageDetails entries to {@link UsageRecord}. Reads the {@code properties} object of
 * an API record, or the node itself for flattened exports.
 */
@Component
public class RecordNormalizer {
    private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);

    private static final DateTimeFormatter LEGACY_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy");
    private static final String UNSET_PERIOD = "0001-01-01";

    public UsageRecord normalize(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new InvalidRecordException("properties", "record is not a JSON object");
        }
        var props = raw.path("properties").isObject() ? raw.get("properties") : raw;

        var path = text(props, "instanceName");
        if (path == null) {
            path = text(props, "resourceId");
        }
        if (path == null) {
            throw new InvalidRecordException("instanceName", "is missing");
        }
        var date = date(props, "date");
        var periodStart = text(props, "billingPeriodStartDate");
        var billingStart = periodStart == null || periodStart.startsWith(UNSET_PERIOD)
                ? date
                : date(props, "billingPeriodStartDate");

        return new UsageRecord(
                path,
                UsageRecord.leafName(path),
                text(props, "resourceGroup"),
                date,
                decimal(props, "quantity"),
                decimal(props, "effectivePrice"),
                decimal(props, "costInBillingCurrency"),
                text(props, "meterCategory"),
                text(props, "meterSubCategory"),
                text(props, "meterName"),
                billingStart,
                optionalDecimal(props, "payGPrice"));
    }

    public NormalizedBatch normalizeAll(Iterable<JsonNode> raws, InvalidRecordPolicy policy) {
        var records = new ArrayList<UsageRecord>();
        long index = 0;
        long skipped = 0;
        for (var raw : raws) {
            try {
                records.add(normalize(raw));
            } catch (InvalidRecordException e) {
                if (policy == InvalidRecordPolicy.ABORT) {
                    throw e.at(index);
                }
                skipped++;
                log.warn("Skipping record {}: {}", index, e.getMessage());
            }
            index++;
        }
        if (skipped > 0) {
            log.warn("Skipped {} of {} usage records", skipped, index);
        }
        logPayGCoverage(records);
        return new NormalizedBatch(records, skipped);
    }

    private static void logPayGCoverage(List<UsageRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        var priced = records.stream().filter(r -> r.payGPrice() != null).count();
        if (priced == 0) {
            log.warn("No pay-as-you-go prices in {} records; PAYG_COST falls back to effective price", records.size());
        } else {
            log.info("Pay-as-you-go price present on {}/{} records", priced, records.size());
        }
    }

    private static String text(JsonNode props, String field) {
        var node = props.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        var value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static BigDecimal decimal(JsonNode props, String field) {
        var node = props.get(field);
        if (node == null || node.isNull()) {
            throw new InvalidRecordException(field, "is missing");
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidRecordException(field, "is not numeric: '" + node.asText() + "'");
            }
        }
        throw new InvalidRecordException(field, "is not numeric: " + node);
    }

    private static BigDecimal optionalDecimal(JsonNode props, String field) {
        var node = props.get(field);
        return node == null || node.isNull() ? null : decimal(props, field);
    }

    private static LocalDate date(JsonNode props, String field) {
        var value = text(props, field);
        if (value == null) {
            throw new InvalidRecordException(field, "is missing");
        }
        try {
            if (value.length() == 10 && value.charAt(4) == '-') {
                return LocalDate.parse(value);
            }
            if (value.contains("T")) {
                return value.endsWith("Z") || value.matches(".*[+-]\\d\\d:\\d\\d$")
                        ? OffsetDateTime.parse(value).toLocalDate()
                        : LocalDate.parse(value.substring(0, value.indexOf('T')));
            }
            return LocalDate.parse(value, LEGACY_DATE);
        } catch (DateTimeParseException e) {
            throw new InvalidRecordException(field, "is not a date: '" + value + "'");
        }
    }
}
