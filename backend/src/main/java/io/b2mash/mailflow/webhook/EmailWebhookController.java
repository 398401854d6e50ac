package io.b2mash.mailflow.webhook;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/** Public ingress for provider delivery events. */
@RestController
@RequestMapping("/api/webhooks/email")
public class EmailWebhookController {

  private static final Logger log = LoggerFactory.getLogger(EmailWebhookController.class);

  private final EmailWebhookService webhookService;

  public EmailWebhookController(EmailWebhookService webhookService) {
    this.webhookService = webhookService;
  }

  @PostMapping
  public ResponseEntity<Map<String, String>> handleWebhook(
      @RequestBody(required = false) String payload) {
    try {
      webhookService.processWebhook(payload);
      return ResponseEntity.ok(Map.of("status", "ok"));
    } catch (WebhookPayloadException e) {
      log.warn("Invalid webhook payload: {}", e.getMessage());
      return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
  }

  @RequestMapping(
      method = {RequestMethod.GET, RequestMethod.PUT, RequestMethod.PATCH, RequestMethod.DELETE})
  public ResponseEntity<Map<String, String>> rejectMethod() {
    return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
        .header(HttpHeaders.ALLOW, "POST")
        .body(Map.of("error", "POST method required"));
  }
}
