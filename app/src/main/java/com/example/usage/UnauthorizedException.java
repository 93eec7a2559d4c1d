package com.example.usage;

public class UnauthorizedException extends UsageReportException {
    public UnauthorizedException(String message, long partialRecords, int pageIndex) {
        super(ErrorKind.UNAUTHORIZED, Stage.FETCH, message, partialRecords, pageIndex, null);
    }
}
