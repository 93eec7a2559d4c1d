package com.example.usage;

public class InvalidRecordException extends UsageReportException {
    private final String field;
    private final String reason;
    private final long recordIndex;

    public InvalidRecordException(String field, String reason) {
        this(field, reason, -1, null);
    }

    public InvalidRecordException(String field, String reason, long recordIndex, Throwable cause) {
        super(ErrorKind.INVALID_RECORD, Stage.NORMALIZE,
                (recordIndex >= 0 ? "Record " + recordIndex + ": " : "") + "field '" + field + "' " + reason,
                Math.max(recordIndex, 0), 0, cause);
        this.field = field;
        this.reason = reason;
        this.recordIndex = recordIndex;
    }

    public String field() { return field; }
    public long recordIndex() { return recordIndex; }

    InvalidRecordException at(long index) {
        return new InvalidRecordException(field, reason, index, getCause());
    }
}
