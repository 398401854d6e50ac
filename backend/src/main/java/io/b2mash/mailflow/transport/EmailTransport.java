package io.b2mash.mailflow.transport;

/** Port for handing a rendered email to an outbound mail channel (SMTP, logging no-op). */
public interface EmailTransport {

  /** Transport identifier (e.g., "smtp", "noop"). */
  String providerId();

  /**
   * Sends a message. Implementations report channel failures through {@link SendResult} rather
   * than throwing.
   */
  SendResult send(EmailMessage message);
}
