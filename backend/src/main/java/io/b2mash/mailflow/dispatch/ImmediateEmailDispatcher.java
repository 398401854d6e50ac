package io.b2mash.mailflow.dispatch;

import io.b2mash.mailflow.delivery.EmailDeliveryLog;
import io.b2mash.mailflow.delivery.EmailDeliveryLogService;
import io.b2mash.mailflow.exception.ResourceConflictException;
import io.b2mash.mailflow.transport.EmailTransportException;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Calls the transport on the caller's thread of control. The log has left PENDING by the time this
 * returns; a transport failure is recorded first and then surfaced as {@link
 * EmailTransportException}. A send whose outcome could not be recorded surfaces as a conflict
 * rather than as the stale log.
 */
@Component
public class ImmediateEmailDispatcher implements EmailDispatcher {

  private final EmailDeliveryJob deliveryJob;
  private final EmailDeliveryLogService deliveryLogService;

  public ImmediateEmailDispatcher(
      EmailDeliveryJob deliveryJob, EmailDeliveryLogService deliveryLogService) {
    this.deliveryJob = deliveryJob;
    this.deliveryLogService = deliveryLogService;
  }

  @Override
  public DispatchMode mode() {
    return DispatchMode.IMMEDIATE;
  }

  @Override
  public EmailDeliveryLog dispatch(EmailDeliveryLog pending, Duration timeout) {
    var attempt = deliveryJob.deliver(pending, timeout);
    if (!attempt.result().success()) {
      throw new EmailTransportException(pending.getId(), attempt.result().errorMessage());
    }
    if (attempt.sentButUnrecorded()) {
      throw new ResourceConflictException(
          "Delivery state lost",
          "Delivery "
              + pending.getId()
              + " was accepted by the transport as '"
              + attempt.result().providerMessageId()
              + "' but its log had already left PENDING");
    }
    return deliveryLogService.findById(pending.getId());
  }
}
