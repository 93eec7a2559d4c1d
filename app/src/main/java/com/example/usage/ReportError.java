package com.example.usage;

public record ReportError(ErrorKind kind, Stage stage, String message, long partialRecords, int pageIndex) {

    public static ReportError of(UsageReportException e) {
        return new ReportError(e.kind(), e.stage(), e.getMessage(), e.partialRecords(), e.pageIndex());
    }
}
