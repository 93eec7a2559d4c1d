package com.example.usage;

import java.util.List;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

@Component
public class FilterEngine {

    /** Matching records in their original order, as a new list. */
    public List<UsageRecord> filter(List<UsageRecord> records, Predicate<? super UsageRecord> predicate) {
        return records.stream().filter(predicate).toList();
    }
}
