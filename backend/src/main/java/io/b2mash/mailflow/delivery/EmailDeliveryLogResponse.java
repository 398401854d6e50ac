package io.b2mash.mailflow.delivery;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** DTO record for the delivery log API response. */
public record EmailDeliveryLogResponse(
    UUID id,
    String templateKey,
    String toAddress,
    String fromAddress,
    List<String> cc,
    List<String> bcc,
    String subject,
    String htmlBody,
    String textBody,
    EmailDeliveryStatus status,
    String correlationId,
    String providerId,
    Map<String, Object> contextData,
    String initiatedBy,
    String errorMessage,
    Instant createdAt,
    Instant sentAt,
    Instant deliveredAt,
    Instant openedAt,
    Instant clickedAt,
    Instant updatedAt) {

  public static EmailDeliveryLogResponse from(EmailDeliveryLog log) {
    return new EmailDeliveryLogResponse(
        log.getId(),
        log.getTemplateKey(),
        log.getToAddress(),
        log.getFromAddress(),
        List.copyOf(log.getCc()),
        List.copyOf(log.getBcc()),
        log.getSubject(),
        log.getHtmlBody(),
        log.getTextBody(),
        log.getStatus(),
        log.getCorrelationId(),
        log.getProviderId(),
        log.getContextData(),
        log.getInitiatedBy(),
        log.getErrorMessage(),
        log.getCreatedAt(),
        log.getSentAt(),
        log.getDeliveredAt(),
        log.getOpenedAt(),
        log.getClickedAt(),
        log.getUpdatedAt());
  }
}
