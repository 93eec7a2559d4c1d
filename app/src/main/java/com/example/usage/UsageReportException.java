package com.example.usage;

/**
 * Base of every failure the report pipeline raises. Carries enough context for a caller to
 * decide on manual recovery: the stage, how many records were already retrieved and, for
 * fetch failures, the page that failed (1-based, 0 when not applicable).
 */
public abstract class UsageReportException extends RuntimeException {
    private final ErrorKind kind;
    private final Stage stage;
    private long partialRecords;
    private final int pageIndex;

    protected UsageReportException(ErrorKind kind, Stage stage, String message,
                                   long partialRecords, int pageIndex, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.stage = stage;
        this.partialRecords = partialRecords;
        this.pageIndex = pageIndex;
    }

    public ErrorKind kind() { return kind; }
    public Stage stage() { return stage; }
    public long partialRecords() { return partialRecords; }
    public int pageIndex() { return pageIndex; }

    /** Adds records that sibling sub-range fetches had retrieved when this one failed. */
    UsageReportException withSiblingRecords(long records) {
        partialRecords += records;
        return this;
    }
}
