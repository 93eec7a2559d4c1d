package com.example.usage;

import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Lazy sequence of raw usage records for one subscription and date range.
 *
 * <p>Pages are requested only when the consumer has drained the previous one, so each
 * continuation link is followed strictly in order. The sequence has a single consumer and
 * cannot be restarted; callers that need a second pass must collect it first.
 * {@link #cancel()} may be called from any thread and takes effect before the next page
 * request or during a backoff wait.
 */
public final class UsageFetch implements Iterable<JsonNode> {
    private static final Logger log = LoggerFactory.getLogger(UsageFetch.class);

    private final UsageApiClient client;
    private final UsageProperties.Retry retry;
    private final Sleeper sleeper;
    private final Counter pagesCounter;
    private final Counter retriesCounter;
    private final Counter recordsCounter;
    private final String subscriptionId;
    private final LocalDate start;
    private final LocalDate end;
    private final String token;
    private final String expand;
    private final String fallbackApiVersion;

    private final Deque<JsonNode> buffer = new ArrayDeque<>();
    private volatile FetchState state = FetchState.FETCHING;
    private volatile boolean cancelRequested;
    private UsageReportException failure;
    private URI next;
    private String apiVersion;
    private boolean fellBack;
    private boolean consumed;
    private long recordsYielded;
    private int pagesFetched;

    UsageFetch(UsageApiClient client, UsageProperties properties, Sleeper sleeper,
               FetchMeters meters, String subscriptionId, LocalDate start, LocalDate end, String token) {
        this.client = client;
        this.retry = properties.getRetry();
        this.sleeper = sleeper;
        this.pagesCounter = meters.pages();
        this.retriesCounter = meters.retries();
        this.recordsCounter = meters.records();
        this.subscriptionId = subscriptionId;
        this.start = start;
        this.end = end;
        this.token = token;
        this.expand = properties.getExpand();
        this.fallbackApiVersion = properties.getFallbackApiVersion();
        this.apiVersion = properties.getApiVersion();
        this.next = client.firstPage(subscriptionId, start, end, apiVersion, expand);
    }

    record FetchMeters(Counter pages, Counter retries, Counter records) {}

    public FetchState state() { return state; }
    public long recordsYielded() { return recordsYielded; }
    public int pagesFetched() { return pagesFetched; }
    public String apiVersion() { return apiVersion; }

    public void cancel() {
        cancelRequested = true;
    }

    @Override
    public synchronized Iterator<JsonNode> iterator() {
        if (consumed) {
            throw new IllegalStateException("A usage fetch can only be iterated once");
        }
        consumed = true;
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return advance();
            }

            @Override
            public JsonNode next() {
                if (!advance()) {
                    throw new NoSuchElementException();
                }
                recordsYielded++;
                recordsCounter.increment();
                return buffer.poll();
            }
        };
    }

    public Stream<JsonNode> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private boolean advance() {
        while (buffer.isEmpty()) {
            if (failure != null) {
                throw failure;
            }
            if (state.terminal()) {
                return false;
            }
            loadNextPage();
        }
        return true;
    }

    private void loadNextPage() {
        var pageIndex = pagesFetched + 1;
        checkCancelled(pageIndex);
        var rateLimited = 0;
        var transientFailures = 0;
        while (true) {
            try {
                var page = client.getPage(next, token);
                pagesFetched++;
                pagesCounter.increment();
                buffer.addAll(page.records());
                next = page.hasMore() ? URI.create(page.nextLink()) : null;
                state = next == null ? FetchState.DONE : FetchState.FETCHING;
                log.info("Fetched usage page {} for {} ({} records, {} so far)",
                        pagesFetched, subscriptionId, page.records().size(), recordsYielded + buffer.size());
                return;
            } catch (ApiCallException e) {
                switch (e.outcome()) {
                    case UNAUTHORIZED -> throw fail(new UnauthorizedException(e.getMessage(), recordsYielded, pageIndex));
                    case MALFORMED -> throw fail(new MalformedResponseException(
                            "Malformed usage page " + pageIndex + ": " + e.getMessage(), recordsYielded, pageIndex, e));
                    case REJECTED -> throw fail(new RequestRejectedException(e.getMessage(), recordsYielded, pageIndex));
                    case API_VERSION_REJECTED -> {
                        if (!canFallBack()) {
                            throw fail(new RequestRejectedException(e.getMessage(), recordsYielded, pageIndex));
                        }
                        log.warn("API version {} rejected, falling back to {}", apiVersion, fallbackApiVersion);
                        fellBack = true;
                        apiVersion = fallbackApiVersion;
                        next = client.firstPage(subscriptionId, start, end, apiVersion, expand);
                    }
                    case RATE_LIMITED -> {
                        rateLimited++;
                        if (rateLimited >= retry.getRateLimitAttempts()) {
                            throw fail(new RateLimitExceededException(rateLimited, recordsYielded, pageIndex));
                        }
                        var delay = e.retryAfter() != null ? e.retryAfter() : retry.backoff(rateLimited);
                        log.warn("Usage page {} rate limited (attempt {}/{}), retrying in {}",
                                pageIndex, rateLimited, retry.getRateLimitAttempts(), delay);
                        state = FetchState.RATE_LIMITED;
                        pause(delay, pageIndex);
                        state = FetchState.FETCHING;
                    }
                    case TRANSIENT -> {
                        transientFailures++;
                        if (transientFailures >= retry.getTransientAttempts()) {
                            throw fail(new TransientFetchException(
                                    "Usage page " + pageIndex + " failed after " + transientFailures + " attempts: "
                                            + e.getMessage(), recordsYielded, pageIndex, e));
                        }
                        var delay = retry.backoff(transientFailures);
                        log.warn("Usage page {} failed ({}), retrying in {}", pageIndex, e.getMessage(), delay);
                        pause(delay, pageIndex);
                    }
                }
            }
        }
    }

    private boolean canFallBack() {
        return pagesFetched == 0 && !fellBack
                && StringUtils.hasText(fallbackApiVersion) && !fallbackApiVersion.equals(apiVersion);
    }

    private void pause(Duration delay, int pageIndex) {
        retriesCounter.increment();
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelRequested = true;
        }
        checkCancelled(pageIndex);
    }

    private void checkCancelled(int pageIndex) {
        if (cancelRequested) {
            var cancelled = new FetchCancelledException(recordsYielded, pageIndex);
            failure = cancelled;
            state = FetchState.CANCELLED;
            log.info("Usage fetch for {} cancelled after {} records", subscriptionId, recordsYielded);
            throw cancelled;
        }
    }

    private UsageReportException fail(UsageReportException e) {
        failure = e;
        state = FetchState.FAILED;
        log.error("Usage fetch for {} failed: {}", subscriptionId, e.getMessage());
        return e;
    }
}
