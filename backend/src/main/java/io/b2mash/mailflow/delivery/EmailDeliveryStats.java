package io.b2mash.mailflow.delivery;

import java.time.Instant;
import java.util.Map;

/** Delivery counts per status for logs created since {@code since}. */
public record EmailDeliveryStats(
    Instant since, long total, Map<EmailDeliveryStatus, Long> byStatus, long pendingNow) {}
