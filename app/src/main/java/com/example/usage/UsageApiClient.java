package com.example.usage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Issues single page requests against the Consumption usageDetails API and classifies the
 * response. Retrying is the caller's business.
 */
public class UsageApiClient {
    private static final Logger log = LoggerFactory.getLogger(UsageApiClient.class);

    static final String CONSUMPTION_RETRY_AFTER = "x-ms-ratelimit-microsoft.consumption-retry-after";

    private final RestClient restClient;
    private final String endpoint;
    private final ObjectMapper mapper;

    public UsageApiClient(RestClient restClient, String endpoint, ObjectMapper mapper) {
        this.restClient = restClient;
        this.endpoint = endpoint;
        this.mapper = mapper;
    }

    public URI firstPage(String subscriptionId, LocalDate start, LocalDate end, String apiVersion, String expand) {
        var builder = UriComponentsBuilder.fromUriString(endpoint)
                .path("/subscriptions/{subscriptionId}/providers/Microsoft.Consumption/usageDetails")
                .queryParam("startDate", start.toString())
                .queryParam("endDate", end.toString())
                .queryParam("api-version", apiVersion);
        if (StringUtils.hasText(expand)) {
            builder = builder.queryParam("$expand", expand);
        }
        return builder.buildAndExpand(subscriptionId).encode().toUri();
    }

    public UsagePage getPage(URI uri, String bearerToken) {
        try {
            return restClient.get()
                    .uri(uri)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken)
                    .accept(MediaType.APPLICATION_JSON)
                    .exchange((request, response) -> read(response));
        } catch (ResourceAccessException e) {
            throw new ApiCallException(ApiCallException.Outcome.TRANSIENT, 0,
                    "I/O error requesting " + uri.getPath() + ": " + e.getMessage(), null, e);
        }
    }

    private UsagePage read(ClientHttpResponse response) throws IOException {
        var status = response.getStatusCode().value();
        var body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);

        if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
            throw new ApiCallException(ApiCallException.Outcome.UNAUTHORIZED, status,
                    "Credential rejected (" + status + "): " + errorMessage(body), null, null);
        }
        var retryAfter = retryAfter(response.getHeaders());
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()
                || (status == HttpStatus.SERVICE_UNAVAILABLE.value() && retryAfter != null)) {
            throw new ApiCallException(ApiCallException.Outcome.RATE_LIMITED, status,
                    "Rate limited (" + status + ")", retryAfter, null);
        }
        if (status >= 500) {
            throw new ApiCallException(ApiCallException.Outcome.TRANSIENT, status,
                    "Server error (" + status + "): " + errorMessage(body), null, null);
        }
        if (status >= 400) {
            throw rejected(status, errorMessage(body));
        }

        JsonNode json;
        try {
            json = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ApiCallException(ApiCallException.Outcome.MALFORMED, status,
                    "Page body is not JSON: " + e.getOriginalMessage(), null, e);
        }
        if (json != null && json.has("error")) {
            throw rejected(status, errorMessage(body));
        }
        return UsagePage.from(json);
    }

    private ApiCallException rejected(int status, String message) {
        var outcome = message.toLowerCase(Locale.ROOT).contains("api-version")
                ? ApiCallException.Outcome.API_VERSION_REJECTED
                : ApiCallException.Outcome.REJECTED;
        return new ApiCallException(outcome, status, "Request rejected (" + status + "): " + message, null, null);
    }

    private String errorMessage(String body) {
        if (!StringUtils.hasText(body)) {
            return "no body";
        }
        try {
            var error = mapper.readTree(body).path("error");
            if (error.hasNonNull("message")) {
                return error.get("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    static Duration retryAfter(HttpHeaders headers) {
        var value = headers.getFirst(CONSUMPTION_RETRY_AFTER);
        if (value == null) {
            value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        }
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Math.max(0, Long.parseLong(value.trim())));
        } catch (NumberFormatException notSeconds) {
            try {
                var at = ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
                var delay = Duration.between(ZonedDateTime.now(at.getZone()), at);
                return delay.isNegative() ? Duration.ZERO : delay;
            } catch (DateTimeParseException e) {
                log.warn("Ignoring unparseable Retry-After '{}'", value);
                return null;
            }
        }
    }
}
