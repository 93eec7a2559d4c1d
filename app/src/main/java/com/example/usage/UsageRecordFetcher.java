package com.example.usage;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class UsageRecordFetcher {
    private final UsageApiClient client;
    private final UsageProperties properties;
    private final Sleeper sleeper;
    private final UsageFetch.FetchMeters meters;

    public UsageRecordFetcher(UsageApiClient client, UsageProperties properties, Sleeper sleeper,
                              MeterRegistry meterRegistry) {
        this.client = client;
        this.properties = properties;
        this.sleeper = sleeper;
        this.meters = new UsageFetch.FetchMeters(
                meterRegistry.counter("usage_fetch_pages_total"),
                meterRegistry.counter("usage_fetch_retries_total"),
                meterRegistry.counter("usage_fetch_records_total"));
    }

    /**
     * Starts a lazy fetch of the raw usage records for an inclusive date range. No request is
     * made until the returned sequence is iterated.
     */
    public UsageFetch fetch(String subscriptionId, LocalDate startDate, LocalDate endDate,
                            CredentialProvider credential) {
        if (!StringUtils.hasText(subscriptionId)) {
            throw new IllegalArgumentException("subscriptionId must be provided");
        }
        if (startDate == null || endDate == null || startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate must not be after endDate: " + startDate + " > " + endDate);
        }
        var token = credential.bearerToken(subscriptionId);
        return new UsageFetch(client, properties, sleeper, meters, subscriptionId.trim(), startDate, endDate, token);
    }
}
