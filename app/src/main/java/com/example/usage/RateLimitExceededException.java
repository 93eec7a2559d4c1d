package com.example.usage;

public class RateLimitExceededException extends UsageReportException {
    private final int attempts;

    public RateLimitExceededException(int attempts, long partialRecords, int pageIndex) {
        super(ErrorKind.RATE_LIMIT_EXCEEDED, Stage.FETCH,
                "Still rate limited on page " + pageIndex + " after " + attempts + " attempts ("
                        + partialRecords + " records retrieved)",
                partialRecords, pageIndex, null);
        this.attempts = attempts;
    }

    public int attempts() { return attempts; }
}
