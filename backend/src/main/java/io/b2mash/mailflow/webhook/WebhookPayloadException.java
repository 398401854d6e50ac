package io.b2mash.mailflow.webhook;

/** Thrown when a webhook body is not a parseable JSON object. */
public class WebhookPayloadException extends RuntimeException {

  public WebhookPayloadException(String message) {
    super(message);
  }

  public WebhookPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
