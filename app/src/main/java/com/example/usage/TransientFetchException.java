package com.example.usage;

public class TransientFetchException extends UsageReportException {
    public TransientFetchException(String message, long partialRecords, int pageIndex, Throwable cause) {
        super(ErrorKind.TRANSIENT_FETCH_ERROR, Stage.FETCH, message, partialRecords, pageIndex, cause);
    }
}
