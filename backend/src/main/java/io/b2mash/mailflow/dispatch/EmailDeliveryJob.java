package io.b2mash.mailflow.dispatch;

import io.b2mash.mailflow.config.EmailExecutorConfig;
import io.b2mash.mailflow.delivery.EmailDeliveryLog;
import io.b2mash.mailflow.delivery.EmailDeliveryLogService;
import io.b2mash.mailflow.transport.EmailMessage;
import io.b2mash.mailflow.transport.EmailTransport;
import io.b2mash.mailflow.transport.SendResult;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Transmits one PENDING delivery and records the outcome: SENT with the transport's correlation
 * id, or FAILED with the transport error. The transport call runs on its own pool so it can be
 * abandoned once the timeout elapses.
 */
@Component
public class EmailDeliveryJob {

  private static final Logger log = LoggerFactory.getLogger(EmailDeliveryJob.class);

  private final EmailTransport transport;
  private final EmailDeliveryLogService deliveryLogService;
  private final AsyncTaskExecutor transportExecutor;

  public EmailDeliveryJob(
      EmailTransport transport,
      EmailDeliveryLogService deliveryLogService,
      @Qualifier(EmailExecutorConfig.TRANSPORT_EXECUTOR) AsyncTaskExecutor transportExecutor) {
    this.transport = transport;
    this.deliveryLogService = deliveryLogService;
    this.transportExecutor = transportExecutor;
  }

  /**
   * Runs the transport and moves the log out of PENDING. Never throws for transport failures. The
   * returned attempt reports whether the outcome could still be recorded.
   */
  public DeliveryAttempt deliver(EmailDeliveryLog pending, Duration timeout) {
    var result = transmit(pending, timeout);
    boolean recorded;
    if (result.success()) {
      if (result.providerMessageId() == null) {
        log.warn(
            "Transport {} returned no message id for delivery {}; webhook events cannot be"
                + " correlated",
            transport.providerId(),
            pending.getId());
      }
      recorded =
          deliveryLogService.markSent(
              pending.getId(), result.providerMessageId(), transport.providerId());
      if (!recorded) {
        log.error(
            "Delivery {} was accepted by {} as {} but had already left PENDING; the log does not"
                + " reflect the send",
            pending.getId(),
            transport.providerId(),
            result.providerMessageId());
      }
    } else {
      recorded = deliveryLogService.markFailed(pending.getId(), result.errorMessage());
    }
    return new DeliveryAttempt(result, recorded);
  }

  private SendResult transmit(EmailDeliveryLog pending, Duration timeout) {
    var message = toMessage(pending);
    Future<SendResult> future;
    try {
      future = transportExecutor.submit(() -> transport.send(message));
    } catch (RuntimeException e) {
      log.error("Could not start transport for delivery {}", pending.getId(), e);
      return SendResult.failed("Transport unavailable: " + e.getMessage());
    }

    try {
      var result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return result != null ? result : SendResult.failed("Transport returned no result");
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn(
          "Transport {} timed out after {} ms for delivery {}",
          transport.providerId(),
          timeout.toMillis(),
          pending.getId());
      return SendResult.failed("Transport timed out after " + timeout.toMillis() + " ms");
    } catch (ExecutionException e) {
      var cause = e.getCause() != null ? e.getCause() : e;
      log.error(
          "Transport {} threw for delivery {}", transport.providerId(), pending.getId(), cause);
      return SendResult.failed("Transport error: " + cause.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return SendResult.failed("Interrupted while waiting for the transport");
    }
  }

  private static EmailMessage toMessage(EmailDeliveryLog deliveryLog) {
    return new EmailMessage(
        deliveryLog.getToAddress(),
        deliveryLog.getFromAddress(),
        deliveryLog.getCc(),
        deliveryLog.getBcc(),
        deliveryLog.getSubject(),
        deliveryLog.getHtmlBody(),
        deliveryLog.getTextBody());
  }
}
