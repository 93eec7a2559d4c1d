package com.example.usage;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Predicate constructors for {@link FilterEngine}. Text matching ignores case; the records
 * themselves keep the provider's casing.
 */
public final class UsagePredicates {

    private static final Set<String> STORAGE_CATEGORIES = Set.of("Storage", "Backup");
    private static final List<String> DISK_KEYWORDS = List.of("disk", "ssd", "hdd", "snapshot");

    private UsagePredicates() {}

    public static Predicate<UsageRecord> instanceNameContains(String fragment) {
        return contains(UsageRecord::instanceName, fragment);
    }

    public static Predicate<UsageRecord> instancePathContains(String fragment) {
        return contains(UsageRecord::instancePath, fragment);
    }

    public static Predicate<UsageRecord> instanceContains(String fragment) {
        return instanceNameContains(fragment).or(instancePathContains(fragment));
    }

    public static Predicate<UsageRecord> instanceNameMatches(String regex) {
        return matches(UsageRecord::instanceName, regex);
    }

    public static Predicate<UsageRecord> instancePathMatches(String regex) {
        return matches(UsageRecord::instancePath, regex);
    }

    public static Predicate<UsageRecord> instanceMatches(String regex) {
        return instanceNameMatches(regex).or(instancePathMatches(regex));
    }

    /** Inclusive on both ends. */
    public static Predicate<UsageRecord> dateBetween(LocalDate from, LocalDate to) {
        return r -> !r.date().isBefore(from) && !r.date().isAfter(to);
    }

    public static Predicate<UsageRecord> resourceGroupIs(String resourceGroup) {
        return r -> r.resourceGroup() != null && r.resourceGroup().equalsIgnoreCase(resourceGroup);
    }

    /**
     * Storage and Backup meters, plus disk and snapshot charges billed under other categories
     * (matched on meter sub-category or name).
     */
    public static Predicate<UsageRecord> storageRelated() {
        return r -> (r.meterCategory() != null && STORAGE_CATEGORIES.contains(r.meterCategory()))
                || mentionsDisk(r.meterSubCategory())
                || mentionsDisk(r.meterName());
    }

    public static Predicate<UsageRecord> meterCategoryIn(Collection<String> categories) {
        Set<String> folded = categories.stream().map(UsagePredicates::fold).collect(Collectors.toSet());
        return r -> r.meterCategory() != null && folded.contains(fold(r.meterCategory()));
    }

    @SafeVarargs
    public static Predicate<UsageRecord> allOf(Predicate<UsageRecord>... predicates) {
        return List.of(predicates).stream().reduce(r -> true, Predicate::and);
    }

    @SafeVarargs
    public static Predicate<UsageRecord> anyOf(Predicate<UsageRecord>... predicates) {
        return List.of(predicates).stream().reduce(r -> false, Predicate::or);
    }

    public static Predicate<UsageRecord> not(Predicate<UsageRecord> predicate) {
        return predicate.negate();
    }

    private static Predicate<UsageRecord> contains(Function<UsageRecord, String> field, String fragment) {
        var needle = fold(fragment);
        return r -> {
            var value = field.apply(r);
            return value != null && fold(value).contains(needle);
        };
    }

    private static Predicate<UsageRecord> matches(Function<UsageRecord, String> field, String regex) {
        var pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return r -> {
            var value = field.apply(r);
            return value != null && pattern.matcher(value).find();
        };
    }

    private static boolean mentionsDisk(String value) {
        if (value == null) {
            return false;
        }
        var folded = fold(value);
        return DISK_KEYWORDS.stream().anyMatch(folded::contains);
    }

    private static String fold(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
