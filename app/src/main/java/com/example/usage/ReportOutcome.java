package com.example.usage;

public interface ReportOutcome<T> {

    record Success<T>(T report, long skippedRecords) implements ReportOutcome<T> {}

    record Failure<T>(ReportError error) implements ReportOutcome<T> {}

    static <T> ReportOutcome<T> failure(UsageReportException e) {
        return new Failure<>(ReportError.of(e));
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }
}
