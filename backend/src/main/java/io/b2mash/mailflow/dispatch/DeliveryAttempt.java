package io.b2mash.mailflow.dispatch;

import io.b2mash.mailflow.transport.SendResult;

/**
 * Outcome of one {@link EmailDeliveryJob} run.
 *
 * @param result what the transport reported
 * @param recorded whether the outcome was written to the log; false when the log had already left
 *     PENDING, e.g. because the stale-delivery watchdog failed it during a slow send
 */
public record DeliveryAttempt(SendResult result, boolean recorded) {

  public boolean sentButUnrecorded() {
    return result.success() && !recorded;
  }
}
