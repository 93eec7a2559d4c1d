package com.example.usage;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Runs the report pipeline for one query: fetch, normalize, filter, aggregate, format.
 * Pipeline failures come back as {@link ReportOutcome.Failure}; invalid query arguments are
 * rejected with {@link IllegalArgumentException}.
 */
@Service
public class UsageReportService {
    private static final Logger log = LoggerFactory.getLogger(UsageReportService.class);

    private final UsageRecordFetcher fetcher;
    private final RecordNormalizer normalizer;
    private final FilterEngine filterEngine;
    private final AggregationEngine aggregationEngine;
    private final ReportFormatter formatter;
    private final PeriodComparator comparator;
    private final CredentialProvider credentials;
    private final UsageProperties properties;
    private final ExecutorService executor;

    public UsageReportService(UsageRecordFetcher fetcher, RecordNormalizer normalizer, FilterEngine filterEngine,
                              AggregationEngine aggregationEngine, ReportFormatter formatter,
                              PeriodComparator comparator, CredentialProvider credentials,
                              UsageProperties properties, ExecutorService usageFetchExecutor) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.filterEngine = filterEngine;
        this.aggregationEngine = aggregationEngine;
        this.formatter = formatter;
        this.comparator = comparator;
        this.credentials = credentials;
        this.properties = properties;
        this.executor = usageFetchExecutor;
    }

    public ReportOutcome<UsageReport> run(ReportQuery query) {
        try {
            var batch = load(query);
            AggregationResult<?> result = query.style() == ReportStyle.DAILY_SERIES
                    ? aggregationEngine.aggregate(batch.records(), GroupKeys.date(), query.measure())
                    : limit(aggregationEngine.aggregate(batch.records(), query.groupBy().key(), query.measure()), query);
            var report = formatter.format(result, query.style());
            log.info("Report for {} {}..{}: {} records, {} groups, grand total {}", query.subscriptionId(),
                    query.startDate(), query.endDate(), result.recordCount(), result.groups().size(),
                    result.grandTotal());
            return new ReportOutcome.Success<>(report, batch.skipped());
        } catch (UsageReportException e) {
            log.error("Report for {} failed at {}: {}", query.subscriptionId(), e.stage(), e.getMessage());
            return ReportOutcome.failure(e);
        }
    }

    /** Compares two periods grouped by the current query's dimension. */
    public ReportOutcome<PeriodComparison<String>> compare(ReportQuery previous, ReportQuery current) {
        try {
            var before = load(previous);
            var after = load(current);
            var key = current.groupBy().key();
            var previousResult = aggregationEngine.aggregate(before.records(), key, current.measure());
            var currentResult = aggregationEngine.aggregate(after.records(), key, current.measure());
            formatter.verifyTotals(previousResult);
            formatter.verifyTotals(currentResult);
            return new ReportOutcome.Success<>(comparator.compare(previousResult, currentResult),
                    before.skipped() + after.skipped());
        } catch (UsageReportException e) {
            log.error("Period comparison for {} failed at {}: {}", current.subscriptionId(), e.stage(), e.getMessage());
            return ReportOutcome.failure(e);
        }
    }

    NormalizedBatch load(ReportQuery query) {
        var filter = predicate(query);
        var ranges = DateRanges.monthly(query.startDate(), query.endDate());
        NormalizedBatch batch;
        if (ranges.size() == 1 || properties.getFetchParallelism() <= 1) {
            var fetch = fetcher.fetch(query.subscriptionId(), query.startDate(), query.endDate(), credentials);
            batch = normalizer.normalizeAll(fetch, properties.getInvalidRecordPolicy());
        } else {
            batch = normalizer.normalizeAll(fetchInParallel(query, ranges), properties.getInvalidRecordPolicy());
        }
        var records = filter == null ? batch.records() : filterEngine.filter(batch.records(), filter);
        return new NormalizedBatch(records, batch.skipped());
    }

    private List<JsonNode> fetchInParallel(ReportQuery query, List<DateRanges.Range> ranges) {
        log.info("Fetching {} in {} sub-ranges", query.subscriptionId(), ranges.size());
        var futures = new ArrayList<Future<List<JsonNode>>>(ranges.size());
        for (var range : ranges) {
            futures.add(executor.submit(() -> {
                var fetch = fetcher.fetch(query.subscriptionId(), range.start(), range.end(), credentials);
                List<JsonNode> records = new ArrayList<>();
                fetch.forEach(records::add);
                return records;
            }));
        }
        var all = new ArrayList<JsonNode>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                all.addAll(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new FetchCancelledException(all.size(), 0);
            } catch (ExecutionException e) {
                var siblings = all.size() + completedRecords(futures.subList(i + 1, futures.size()));
                futures.forEach(f -> f.cancel(true));
                if (e.getCause() instanceof UsageReportException failure) {
                    throw failure.withSiblingRecords(siblings);
                }
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw new TransientFetchException("Sub-range fetch failed: " + e.getCause(), siblings, 0, e.getCause());
            }
        }
        return all;
    }

    private static long completedRecords(List<Future<List<JsonNode>>> futures) {
        long count = 0;
        for (var future : futures) {
            if (!future.isDone() || future.isCancelled()) {
                continue;
            }
            try {
                count += future.get().size();
            } catch (ExecutionException e) {
                if (e.getCause() instanceof UsageReportException failed) {
                    count += failed.partialRecords();
                } else {
                    log.debug("Sub-range failed without a record count: {}", e.getCause().toString());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return count;
            }
        }
        return count;
    }

    private static Predicate<UsageRecord> predicate(ReportQuery query) {
        var conditions = new ArrayList<Predicate<UsageRecord>>();
        if (StringUtils.hasText(query.contains())) {
            conditions.add(UsagePredicates.instanceContains(query.contains().trim()));
        }
        if (StringUtils.hasText(query.pattern())) {
            conditions.add(UsagePredicates.instanceMatches(query.pattern()));
        }
        if (!query.meterCategories().isEmpty()) {
            conditions.add(UsagePredicates.meterCategoryIn(query.meterCategories()));
        }
        if (StringUtils.hasText(query.resourceGroup())) {
            conditions.add(UsagePredicates.resourceGroupIs(query.resourceGroup().trim()));
        }
        if (query.storage() != null) {
            conditions.add(query.storage()
                    ? UsagePredicates.storageRelated()
                    : UsagePredicates.not(UsagePredicates.storageRelated()));
        }
        return conditions.stream().reduce(Predicate::and).orElse(null);
    }

    private static <K extends Comparable<? super K>> AggregationResult<K> limit(AggregationResult<K> result,
                                                                                ReportQuery query) {
        return query.top() == null ? result : result.top(query.top());
    }
}
