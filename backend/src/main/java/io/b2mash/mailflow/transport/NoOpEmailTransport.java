package io.b2mash.mailflow.transport;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

/**
 * Fallback transport used when no SMTP configuration is present. Logs the message instead of
 * sending it and returns a synthetic correlation id.
 */
@Component
@ConditionalOnMissingBean(SmtpEmailTransport.class)
public class NoOpEmailTransport implements EmailTransport {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailTransport.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult send(EmailMessage message) {
    log.info("NoOp email: would send to {} with subject '{}'", message.to(), message.subject());
    return SendResult.accepted("NOOP-" + UUID.randomUUID());
  }
}
