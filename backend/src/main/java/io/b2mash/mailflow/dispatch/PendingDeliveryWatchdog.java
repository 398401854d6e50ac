package io.b2mash.mailflow.dispatch;

import io.b2mash.mailflow.config.EmailDispatchProperties;
import io.b2mash.mailflow.delivery.EmailDeliveryLogService;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fails deliveries that stayed PENDING past the configured threshold, e.g. a queued job lost to a
 * restart. Runs on every node; the guarded update makes concurrent runs harmless.
 */
@Component
@ConditionalOnProperty(
    name = "mailflow.email.watchdog.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class PendingDeliveryWatchdog {

  private static final Logger log = LoggerFactory.getLogger(PendingDeliveryWatchdog.class);

  private final EmailDeliveryLogService deliveryLogService;
  private final EmailDispatchProperties properties;
  private final Clock clock;

  public PendingDeliveryWatchdog(
      EmailDeliveryLogService deliveryLogService, EmailDispatchProperties properties, Clock clock) {
    this.deliveryLogService = deliveryLogService;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${mailflow.email.watchdog.interval:PT1M}")
  public void sweep() {
    failStalePending();
  }

  int failStalePending() {
    var staleAfter = properties.watchdog().staleAfter();
    Instant cutoff = Instant.now(clock).minus(staleAfter);
    int failed =
        deliveryLogService.failStalePending(
            cutoff, "Delivery did not complete within " + staleAfter);
    if (failed > 0) {
      log.warn("Marked {} deliveries stuck in PENDING since before {} as FAILED", failed, cutoff);
    }
    return failed;
  }
}
