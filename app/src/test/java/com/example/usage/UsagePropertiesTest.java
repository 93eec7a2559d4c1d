package com.example.usage;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class UsagePropertiesTest {

    @Test
    void bindsKebabCaseSettings() {
        Map<String, String> props = new HashMap<>();
        props.put("usage.api-version", "2024-08-01");
        props.put("usage.tolerance", "0.05");
        props.put("usage.invalid-record-policy", "skip");
        props.put("usage.retry.rate-limit-attempts", "7");
        props.put("usage.retry.initial-backoff", "500ms");

        var properties = new Binder(new MapConfigurationPropertySource(props))
                .bind("usage", Bindable.of(UsageProperties.class))
                .get();

        assertThat(properties.getApiVersion()).isEqualTo("2024-08-01");
        assertThat(properties.getTolerance()).isEqualByComparingTo("0.05");
        assertThat(properties.getInvalidRecordPolicy()).isEqualTo(InvalidRecordPolicy.SKIP);
        assertThat(properties.getRetry().getRateLimitAttempts()).isEqualTo(7);
        assertThat(properties.getRetry().getInitialBackoff()).isEqualTo(Duration.ofMillis(500));
        assertThat(properties.getFallbackApiVersion()).isEqualTo("2021-10-01");
    }

    @Test
    void backoffDoublesUpToTheCap() {
        var retry = new UsageProperties().getRetry();
        retry.setMaxBackoff(Duration.ofSeconds(10));

        assertThat(retry.backoff(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(retry.backoff(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(retry.backoff(4)).isEqualTo(Duration.ofSeconds(8));
        assertThat(retry.backoff(5)).isEqualTo(Duration.ofSeconds(10));
        assertThat(retry.backoff(40)).isEqualTo(Duration.ofSeconds(10));
    }
}
