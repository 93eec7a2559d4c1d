package com.example.usage;

public class FetchCancelledException extends UsageReportException {
    public FetchCancelledException(long partialRecords, int pageIndex) {
        super(ErrorKind.CANCELLED, Stage.FETCH,
                "Fetch cancelled before page " + pageIndex + " (" + partialRecords + " records retrieved)",
                partialRecords, pageIndex, null);
    }
}
