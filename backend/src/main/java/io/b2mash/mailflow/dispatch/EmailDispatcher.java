package io.b2mash.mailflow.dispatch;

import io.b2mash.mailflow.delivery.EmailDeliveryLog;
import java.time.Duration;

/** Hands a persisted PENDING delivery to the transport, either inline or through a worker. */
public interface EmailDispatcher {

  DispatchMode mode();

  /**
   * @param pending a log in PENDING with its rendered content frozen
   * @param timeout upper bound for the transport call
   * @return the log as the caller should observe it after this call
   */
  EmailDeliveryLog dispatch(EmailDeliveryLog pending, Duration timeout);
}
