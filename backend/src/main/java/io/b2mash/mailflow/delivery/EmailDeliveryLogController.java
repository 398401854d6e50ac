package io.b2mash.mailflow.delivery;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Admin endpoints for delivery log browsing and statistics. */
@RestController
@RequestMapping("/api/email/delivery-logs")
public class EmailDeliveryLogController {

  private final EmailDeliveryLogService deliveryLogService;

  public EmailDeliveryLogController(EmailDeliveryLogService deliveryLogService) {
    this.deliveryLogService = deliveryLogService;
  }

  /** Defaults to the last 30 days if no date range is provided. */
  @GetMapping
  public ResponseEntity<Page<EmailDeliveryLogResponse>> getDeliveryLogs(
      @RequestParam(required = false) EmailDeliveryStatus status,
      @RequestParam(required = false) String templateKey,
      @RequestParam(required = false) String toAddress,
      @RequestParam(required = false) Instant from,
      @RequestParam(required = false) Instant to,
      Pageable pageable) {
    Instant effectiveFrom = from != null ? from : Instant.now().minus(30, ChronoUnit.DAYS);
    Instant effectiveTo = to != null ? to : Instant.now().plusSeconds(1);
    return ResponseEntity.ok(
        deliveryLogService
            .findByFilters(
                status,
                blankToNull(templateKey),
                blankToNull(toAddress),
                effectiveFrom,
                effectiveTo,
                pageable)
            .map(EmailDeliveryLogResponse::from));
  }

  @GetMapping("/stats")
  public ResponseEntity<EmailDeliveryStats> getStats(
      @RequestParam(required = false) Instant since) {
    Instant effectiveSince = since != null ? since : Instant.now().minus(7, ChronoUnit.DAYS);
    return ResponseEntity.ok(deliveryLogService.getStats(effectiveSince));
  }

  @GetMapping("/{id}")
  public ResponseEntity<EmailDeliveryLogResponse> getDeliveryLog(@PathVariable UUID id) {
    return ResponseEntity.ok(EmailDeliveryLogResponse.from(deliveryLogService.findById(id)));
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
