package io.b2mash.mailflow.delivery;

/**
 * Lifecycle of one dispatch attempt. Non-terminal statuses are ordered by precedence; FAILED and
 * BOUNCED are terminal.
 */
public enum EmailDeliveryStatus {

  /** Log created and content frozen; the transport has not yet accepted the message. */
  PENDING(0, false),

  /** Message accepted by the transport; the correlation id is known. */
  SENT(1, false),

  /** Provider confirmed delivery to the recipient's mailbox. */
  DELIVERED(2, false),

  /** Recipient opened the message. */
  OPENED(3, false),

  /** Recipient clicked a link in the message. */
  CLICKED(4, false),

  /** Provider reported a hard or soft bounce. */
  BOUNCED(-1, true),

  /** Rendering, transport or timeout failure. */
  FAILED(-1, true);

  private final int precedence;
  private final boolean terminal;

  EmailDeliveryStatus(int precedence, boolean terminal) {
    this.precedence = precedence;
    this.terminal = terminal;
  }

  /** Position in the normal lifecycle; meaningful only for non-terminal statuses. */
  public int precedence() {
    return precedence;
  }

  public boolean isTerminal() {
    return terminal;
  }
}
