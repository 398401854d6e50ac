package io.b2mash.mailflow.delivery;

/**
 * Decides how a delivery event changes a log. Pure function of (current status, target status);
 * the caller applies the decision with a conditional update guarded by {@code current}.
 */
public final class DeliveryStateMachine {

  public enum Transition {
    /** Move status to the target and record its timestamp. */
    ADVANCE,
    /** Keep status, record the target's timestamp only (late, lower-precedence event). */
    TIMESTAMP_ONLY,
    /** No change at all. */
    REJECTED
  }

  private DeliveryStateMachine() {}

  public static Transition decide(EmailDeliveryStatus current, EmailDeliveryStatus target) {
    if (current.isTerminal()) {
      return Transition.REJECTED;
    }
    if (target.isTerminal()) {
      // Terminal outcomes are only reachable before the provider confirmed delivery
      return current == EmailDeliveryStatus.PENDING || current == EmailDeliveryStatus.SENT
          ? Transition.ADVANCE
          : Transition.REJECTED;
    }
    if (target.precedence() > current.precedence()) {
      return Transition.ADVANCE;
    }
    return Transition.TIMESTAMP_ONLY;
  }
}
