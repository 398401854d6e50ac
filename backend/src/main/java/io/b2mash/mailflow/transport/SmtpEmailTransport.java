package io.b2mash.mailflow.transport;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * SMTP transport backed by {@link JavaMailSender}. Only active when {@code spring.mail.host} is
 * configured. The Message-ID header assigned on send becomes the delivery's correlation id.
 */
@Component
@ConditionalOnProperty(name = "spring.mail.host")
public class SmtpEmailTransport implements EmailTransport {

  private static final Logger log = LoggerFactory.getLogger(SmtpEmailTransport.class);

  private final JavaMailSender mailSender;

  public SmtpEmailTransport(JavaMailSender mailSender) {
    this.mailSender = mailSender;
  }

  @Override
  public String providerId() {
    return "smtp";
  }

  @Override
  public SendResult send(EmailMessage message) {
    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
      populateMessage(helper, message);
      mailSender.send(mimeMessage);
      String messageId = mimeMessage.getMessageID();
      log.debug("SMTP email sent to {} with Message-ID: {}", message.to(), messageId);
      return SendResult.accepted(messageId);
    } catch (MailException | MessagingException e) {
      log.warn("Failed to send SMTP email to {}: {}", message.to(), e.getMessage());
      return SendResult.failed(e.getMessage());
    }
  }

  private void populateMessage(MimeMessageHelper helper, EmailMessage message)
      throws MessagingException {
    if (message.htmlBody() == null && message.plainTextBody() == null) {
      throw new IllegalArgumentException(
          "Email must have at least one of htmlBody or plainTextBody");
    }
    helper.setFrom(message.from());
    helper.setTo(message.to());
    if (!message.cc().isEmpty()) {
      helper.setCc(message.cc().toArray(String[]::new));
    }
    if (!message.bcc().isEmpty()) {
      helper.setBcc(message.bcc().toArray(String[]::new));
    }
    helper.setSubject(message.subject());
    if (message.htmlBody() != null && message.plainTextBody() != null) {
      helper.setText(message.plainTextBody(), message.htmlBody());
    } else if (message.htmlBody() != null) {
      helper.setText(message.htmlBody(), true);
    } else {
      helper.setText(message.plainTextBody(), false);
    }
  }
}
