package com.example.usage;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

final class DateRanges {

    record Range(LocalDate start, LocalDate end) {}

    private DateRanges() {}

    static List<Range> monthly(LocalDate start, LocalDate end) {
        var ranges = new ArrayList<Range>();
        var cursor = start;
        while (!cursor.isAfter(end)) {
            var monthEnd = cursor.withDayOfMonth(cursor.lengthOfMonth());
            var pieceEnd = monthEnd.isAfter(end) ? end : monthEnd;
            ranges.add(new Range(cursor, pieceEnd));
            cursor = pieceEnd.plusDays(1);
        }
        return ranges;
    }
}
