package com.example.usage;

public enum InvalidRecordPolicy {
    ABORT,
    SKIP
}
