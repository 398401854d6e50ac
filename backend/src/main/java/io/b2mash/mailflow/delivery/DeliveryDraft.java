package io.b2mash.mailflow.delivery;

import java.util.List;
import java.util.Map;

/** Addressing and audit fields of a delivery, known before rendering. */
public record DeliveryDraft(
    String templateKey,
    String toAddress,
    String fromAddress,
    List<String> cc,
    List<String> bcc,
    Map<String, Object> contextData,
    String initiatedBy) {}
