package com.example.usage;

public class RequestRejectedException extends UsageReportException {
    public RequestRejectedException(String message, long partialRecords, int pageIndex) {
        super(ErrorKind.REQUEST_REJECTED, Stage.FETCH, message, partialRecords, pageIndex, null);
    }
}
