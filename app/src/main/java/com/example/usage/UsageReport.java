package com.example.usage;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public interface UsageReport {

    record FlatTotal(BigDecimal grandTotal) implements UsageReport {}

    record Grouped(List<Line> groups, BigDecimal grandTotal) implements UsageReport {
        public record Line(String key, BigDecimal total) {}
    }

    record Series(List<Point> series) implements UsageReport {
        public record Point(LocalDate date, BigDecimal total) {}
    }
}
