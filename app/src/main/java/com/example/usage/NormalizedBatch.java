package com.example.usage;

import java.util.List;

public record NormalizedBatch(List<UsageRecord> records, long skipped) {}
