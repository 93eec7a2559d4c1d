package com.example.usage;

import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "usage")
public class UsageProperties {

    private String apiVersion = "2023-05-01";
    /** Version retried once when the first page rejects {@link #apiVersion}; blank disables it. */
    private String fallbackApiVersion = "2021-10-01";
    private String expand = "meterDetails,additionalInfo";
    private BigDecimal tolerance = new BigDecimal("0.01");
    private int displayScale = 2;
    private InvalidRecordPolicy invalidRecordPolicy = InvalidRecordPolicy.ABORT;
    private int fetchParallelism = 1;
    private final Retry retry = new Retry();

    public String getApiVersion() { return apiVersion; }
    public void setApiVersion(String apiVersion) { this.apiVersion = apiVersion; }

    public String getFallbackApiVersion() { return fallbackApiVersion; }
    public void setFallbackApiVersion(String fallbackApiVersion) { this.fallbackApiVersion = fallbackApiVersion; }

    public String getExpand() { return expand; }
    public void setExpand(String expand) { this.expand = expand; }

    public BigDecimal getTolerance() { return tolerance; }
    public void setTolerance(BigDecimal tolerance) { this.tolerance = tolerance; }

    public int getDisplayScale() { return displayScale; }
    public void setDisplayScale(int displayScale) { this.displayScale = displayScale; }

    public InvalidRecordPolicy getInvalidRecordPolicy() { return invalidRecordPolicy; }
    public void setInvalidRecordPolicy(InvalidRecordPolicy invalidRecordPolicy) { this.invalidRecordPolicy = invalidRecordPolicy; }

    public int getFetchParallelism() { return fetchParallelism; }
    public void setFetchParallelism(int fetchParallelism) { this.fetchParallelism = fetchParallelism; }

    public Retry getRetry() { return retry; }

    public static class Retry {
        private int rateLimitAttempts = 5;
        private int transientAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(60);

        public int getRateLimitAttempts() { return rateLimitAttempts; }
        public void setRateLimitAttempts(int rateLimitAttempts) { this.rateLimitAttempts = rateLimitAttempts; }

        public int getTransientAttempts() { return transientAttempts; }
        public void setTransientAttempts(int transientAttempts) { this.transientAttempts = transientAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

        /** Delay before retry number {@code attempt} (1-based): initial * 2^(attempt-1), capped. */
        public Duration backoff(int attempt) {
            var shift = Math.min(Math.max(0, attempt - 1), 30);
            var delay = initialBackoff.multipliedBy(1L << shift);
            return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
        }
    }
}
