package io.b2mash.mailflow.webhook;

import io.b2mash.mailflow.delivery.DeliveryEventType;
import io.b2mash.mailflow.delivery.EmailDeliveryLogService;
import io.b2mash.mailflow.delivery.EventOutcome;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Ingests provider delivery events of the form {@code {"event": "...", "message_id": "..."}}.
 * Unknown events and unknown message ids are accepted without changes so providers do not retry
 * them. Only an unparseable body is an error.
 */
@Service
public class EmailWebhookService {

  private static final Logger log = LoggerFactory.getLogger(EmailWebhookService.class);

  /** Maximum length of provider-supplied values echoed into logs. */
  private static final int MAX_LOGGED_LENGTH = 64;

  private final EmailDeliveryLogService deliveryLogService;
  private final ObjectMapper objectMapper;

  public EmailWebhookService(
      EmailDeliveryLogService deliveryLogService, ObjectMapper objectMapper) {
    this.deliveryLogService = deliveryLogService;
    this.objectMapper = objectMapper;
  }

  /**
   * Parses and applies one webhook body.
   *
   * @throws WebhookPayloadException if the body is empty or not a JSON object
   */
  public EventOutcome processWebhook(String payload) {
    var event = parseEvent(payload);
    var eventName = event.get("event");
    var messageId = event.get("message_id");
    if (!(eventName instanceof String name)) {
      log.debug("Webhook event without an event name, ignoring");
      return EventOutcome.REJECTED;
    }
    if (!(messageId instanceof String correlationId) || correlationId.isBlank()) {
      log.warn("Webhook {} event without message_id, ignoring", sanitize(name));
      return EventOutcome.UNKNOWN_CORRELATION;
    }
    return ingest(name, correlationId);
  }

  /** Applies a single event to the delivery log carrying {@code correlationId}. */
  public EventOutcome ingest(String eventName, String correlationId) {
    var type = DeliveryEventType.fromWireName(eventName);
    if (type.isEmpty()) {
      log.debug("Ignoring unrecognized webhook event '{}'", sanitize(eventName));
      return EventOutcome.REJECTED;
    }

    var outcome = deliveryLogService.applyEvent(correlationId, type.get());
    if (outcome == EventOutcome.UNKNOWN_CORRELATION) {
      log.warn(
          "Webhook {} event for unknown message_id '{}', ignoring",
          type.get().wireName(),
          sanitize(correlationId));
    }
    return outcome;
  }

  private Map<String, Object> parseEvent(String payload) {
    if (payload == null || payload.isBlank()) {
      throw new WebhookPayloadException("Empty payload");
    }
    try {
      var event = objectMapper.readValue(payload, new TypeReference<Map<String, Object>>() {});
      if (event == null) {
        throw new WebhookPayloadException("Payload must be a JSON object");
      }
      return event;
    } catch (JacksonException e) {
      log.warn("Failed to parse webhook payload: {}", e.getMessage());
      throw new WebhookPayloadException("Invalid JSON payload: " + e.getMessage(), e);
    }
  }

  /** Truncates and strips control characters from provider values before logging. */
  private static String sanitize(String value) {
    if (value == null) {
      return "null";
    }
    var sanitized = value.replaceAll("\\p{Cntrl}", "");
    return sanitized.length() > MAX_LOGGED_LENGTH
        ? sanitized.substring(0, MAX_LOGGED_LENGTH)
        : sanitized;
  }
}
