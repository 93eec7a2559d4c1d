package com.example.usage;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/usage")
public class UsageReportController {
  static final String SKIPPED_RECORDS = "X-Skipped-Records";

  private final UsageReportService svc;
  public UsageReportController(UsageReportService svc) { this.svc = svc; }

  @GetMapping("/reports")
  public ResponseEntity<Object> report(@RequestParam String subscription,
                                       @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
                                       @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
                                       @RequestParam(defaultValue = "INSTANCE") GroupBy groupBy,
                                       @RequestParam(defaultValue = "GROUPED") ReportStyle style,
                                       @RequestParam(defaultValue = "BILLED_COST") CostMeasure measure,
                                       @RequestParam(required = false) String contains,
                                       @RequestParam(required = false) String pattern,
                                       @RequestParam(required = false) List<String> meterCategory,
                                       @RequestParam(required = false) String resourceGroup,
                                       @RequestParam(required = false) Boolean storage,
                                       @RequestParam(required = false) Integer top) {
    var query = new ReportQuery(subscription, start, end, groupBy, style, measure, contains, pattern, meterCategory,
        resourceGroup, storage, top);
    return render(svc.run(query));
  }

  @GetMapping("/reports/compare")
  public ResponseEntity<Object> compare(@RequestParam String subscription,
                                        @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate previousStart,
                                        @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate previousEnd,
                                        @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
                                        @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
                                        @RequestParam(defaultValue = "INSTANCE") GroupBy groupBy,
                                        @RequestParam(defaultValue = "BILLED_COST") CostMeasure measure,
                                        @RequestParam(required = false) String contains,
                                        @RequestParam(required = false) String pattern,
                                        @RequestParam(required = false) List<String> meterCategory,
                                        @RequestParam(required = false) String resourceGroup,
                                        @RequestParam(required = false) Boolean storage) {
    var previous = new ReportQuery(subscription, previousStart, previousEnd, groupBy, ReportStyle.GROUPED,
        measure, contains, pattern, meterCategory, resourceGroup, storage, null);
    var current = new ReportQuery(subscription, start, end, groupBy, ReportStyle.GROUPED,
        measure, contains, pattern, meterCategory, resourceGroup, storage, null);
    return render(svc.compare(previous, current));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(Map.of("status", "error", "message", String.valueOf(e.getMessage())));
  }

  static ResponseEntity<Object> render(ReportOutcome<?> outcome) {
    if (outcome instanceof ReportOutcome.Success<?> ok) {
      return ResponseEntity.ok()
          .header(SKIPPED_RECORDS, String.valueOf(ok.skippedRecords()))
          .body(ok.report());
    }
    var error = ((ReportOutcome.Failure<?>) outcome).error();
    return ResponseEntity.status(statusOf(error.kind())).body(error);
  }

  static HttpStatus statusOf(ErrorKind kind) {
    return switch (kind) {
      case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
      case RATE_LIMIT_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
      case TRANSIENT_FETCH_ERROR, MALFORMED_RESPONSE, REQUEST_REJECTED -> HttpStatus.BAD_GATEWAY;
      case INVALID_RECORD, TOTAL_MISMATCH -> HttpStatus.UNPROCESSABLE_ENTITY;
      case CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
    };
  }
}
