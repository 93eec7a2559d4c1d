package com.example.usage;

public class MalformedResponseException extends UsageReportException {
    public MalformedResponseException(String message, long partialRecords, int pageIndex, Throwable cause) {
        super(ErrorKind.MALFORMED_RESPONSE, Stage.FETCH, message, partialRecords, pageIndex, cause);
    }
}
