package io.b2mash.mailflow.transport;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class NoOpEmailTransportTest {

  private final NoOpEmailTransport transport = new NoOpEmailTransport();

  @Test
  void send_accepts_with_synthetic_unique_id() {
    var message =
        new EmailMessage("a@example.com", "noreply@mailflow.local", null, null, "Hi", null, "Hi");

    var first = transport.send(message);
    var second = transport.send(message);

    assertThat(first.success()).isTrue();
    assertThat(first.providerMessageId()).startsWith("NOOP-");
    assertThat(first.providerMessageId()).isNotEqualTo(second.providerMessageId());
    assertThat(transport.providerId()).isEqualTo("noop");
  }
}
