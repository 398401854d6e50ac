package io.b2mash.mailflow.dispatch;

import io.b2mash.mailflow.config.EmailExecutorConfig;
import io.b2mash.mailflow.delivery.EmailDeliveryLog;
import io.b2mash.mailflow.delivery.EmailDeliveryLogService;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Returns the PENDING log straight away and lets the dispatch pool send it. Inside a transaction
 * the job is submitted only after commit, so the worker never looks for a log that is not visible
 * yet. Accepted jobs cannot be cancelled.
 */
@Component
public class QueuedEmailDispatcher implements EmailDispatcher {

  private static final Logger log = LoggerFactory.getLogger(QueuedEmailDispatcher.class);

  private final EmailDeliveryJob deliveryJob;
  private final EmailDeliveryLogService deliveryLogService;
  private final TaskExecutor dispatchExecutor;

  public QueuedEmailDispatcher(
      EmailDeliveryJob deliveryJob,
      EmailDeliveryLogService deliveryLogService,
      @Qualifier(EmailExecutorConfig.DISPATCH_EXECUTOR) TaskExecutor dispatchExecutor) {
    this.deliveryJob = deliveryJob;
    this.deliveryLogService = deliveryLogService;
    this.dispatchExecutor = dispatchExecutor;
  }

  @Override
  public DispatchMode mode() {
    return DispatchMode.QUEUED;
  }

  @Override
  public EmailDeliveryLog dispatch(EmailDeliveryLog pending, Duration timeout) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              submit(pending, timeout);
            }
          });
    } else {
      submit(pending, timeout);
    }
    return pending;
  }

  private void submit(EmailDeliveryLog pending, Duration timeout) {
    try {
      dispatchExecutor.execute(() -> run(pending, timeout));
      log.debug("Queued delivery {} to {}", pending.getId(), pending.getToAddress());
    } catch (TaskRejectedException e) {
      log.warn("Dispatch queue rejected delivery {}: {}", pending.getId(), e.getMessage());
      deliveryLogService.markRejected(pending.getId(), "Dispatch queue is full: " + e.getMessage());
    }
  }

  private void run(EmailDeliveryLog pending, Duration timeout) {
    try {
      var attempt = deliveryJob.deliver(pending, timeout);
      if (!attempt.recorded()) {
        log.warn(
            "Outcome of queued delivery {} was not recorded; the log had already left PENDING",
            pending.getId());
      }
    } catch (RuntimeException e) {
      log.error("Queued delivery {} failed unexpectedly", pending.getId(), e);
      deliveryLogService.markFailed(
          pending.getId(), "Unexpected dispatch error: " + e.getMessage());
    }
  }
}
