package io.b2mash.mailflow.transport;

import java.util.List;
import java.util.Objects;

/** Transport-agnostic email payload, already rendered. */
public record EmailMessage(
    String to,
    String from,
    List<String> cc,
    List<String> bcc,
    String subject,
    String htmlBody,
    String plainTextBody) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    cc = cc != null ? List.copyOf(cc) : List.of();
    bcc = bcc != null ? List.copyOf(bcc) : List.of();
  }
}
