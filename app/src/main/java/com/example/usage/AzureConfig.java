// src/main/java/com/example/usage/AzureConfig.java
package com.example.usage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(UsageProperties.class)
public class AzureConfig {
    @Bean
    UsageApiClient usageApiClient(
            RestClient.Builder builder,
            ObjectMapper mapper,
            @Value("${AZURE_MANAGEMENT_ENDPOINT:https://management.azure.com}") String endpoint) {

        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(10));
        requestFactory.setReadTimeout(Duration.ofSeconds(120));   // usage pages can be slow to build

        RestClient restClient = builder
                .requestFactory(requestFactory)
                .build();
        return new UsageApiClient(restClient, endpoint, mapper);
    }

    @Bean
    CredentialProvider credentialProvider(@Value("${AZURE_ACCESS_TOKEN:}") String token) {
        return new StaticCredentialProvider(token);
    }

    @Bean
    Sleeper backoffSleeper() {
        return Sleeper.THREAD;
    }

    @Bean(destroyMethod = "shutdown")
    ExecutorService usageFetchExecutor(UsageProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getFetchParallelism()));
    }
}
