package io.b2mash.mailflow.delivery;

import io.b2mash.mailflow.delivery.DeliveryStateMachine.Transition;
import io.b2mash.mailflow.exception.ResourceNotFoundException;
import io.b2mash.mailflow.template.RenderedEmail;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns every write to {@link EmailDeliveryLog}. Creation happens once per dispatch; all later
 * changes go through guarded conditional updates so concurrent writers cannot regress a log.
 */
@Service
public class EmailDeliveryLogService {

  private static final Logger log = LoggerFactory.getLogger(EmailDeliveryLogService.class);

  /**
   * Each lost race means another writer moved the status forward, and there are only a handful of
   * statuses to move through.
   */
  static final int MAX_EVENT_ATTEMPTS = 8;

  private final EmailDeliveryLogRepository repository;
  private final Clock clock;

  public EmailDeliveryLogService(EmailDeliveryLogRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Transactional
  public EmailDeliveryLog createPending(DeliveryDraft draft, RenderedEmail rendered) {
    var deliveryLog =
        EmailDeliveryLog.pending(
            draft.templateKey(),
            draft.toAddress(),
            draft.fromAddress(),
            draft.cc(),
            draft.bcc(),
            rendered.subject(),
            rendered.htmlBody(),
            rendered.textBody(),
            draft.contextData(),
            draft.initiatedBy());
    var saved = repository.save(deliveryLog);
    log.debug(
        "Created PENDING delivery {} template={} to={}",
        saved.getId(),
        saved.getTemplateKey(),
        saved.getToAddress());
    return saved;
  }

  @Transactional
  public EmailDeliveryLog createFailed(DeliveryDraft draft, String errorMessage) {
    var deliveryLog =
        EmailDeliveryLog.failed(
            draft.templateKey(),
            draft.toAddress(),
            draft.fromAddress(),
            draft.cc(),
            draft.bcc(),
            draft.contextData(),
            draft.initiatedBy(),
            errorMessage);
    var saved = repository.save(deliveryLog);
    log.warn(
        "Recorded FAILED delivery {} template={} to={}: {}",
        saved.getId(),
        saved.getTemplateKey(),
        saved.getToAddress(),
        errorMessage);
    return saved;
  }

  /**
   * Moves a PENDING log to SENT and stores the transport's correlation id in the same update.
   *
   * @return false if the log was no longer PENDING (e.g. the watchdog already failed it)
   */
  @Transactional
  public boolean markSent(UUID id, String correlationId, String providerId) {
    int updated = repository.markSent(id, correlationId, providerId, Instant.now(clock));
    if (updated == 0) {
      log.warn("Delivery {} was not PENDING when the transport accepted it", id);
      return false;
    }
    log.debug("Delivery {} SENT via {} correlationId={}", id, providerId, correlationId);
    return true;
  }

  /**
   * Moves a PENDING log to FAILED.
   *
   * @return false if the log was no longer PENDING
   */
  @Transactional
  public boolean markFailed(UUID id, String errorMessage) {
    int updated = repository.markFailed(id, errorMessage, Instant.now(clock));
    if (updated == 0) {
      log.warn("Delivery {} was not PENDING when marking it failed: {}", id, errorMessage);
      return false;
    }
    log.warn("Delivery {} FAILED: {}", id, errorMessage);
    return true;
  }

  /**
   * Same as {@link #markFailed(UUID, String)} but always in its own transaction, so it can be
   * called from a transaction completion callback.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public boolean markRejected(UUID id, String errorMessage) {
    return markFailed(id, errorMessage);
  }

  /** Fails every log that has been PENDING since before {@code cutoff}. */
  @Transactional
  public int failStalePending(Instant cutoff, String errorMessage) {
    return repository.failStalePending(cutoff, errorMessage, Instant.now(clock));
  }

  /**
   * Applies a provider event to the log carrying {@code correlationId}. Reads the current status,
   * asks {@link DeliveryStateMachine} what to do and writes with an update guarded by that status;
   * if another writer changed the status in between, re-reads and decides again.
   */
  @Transactional
  public EventOutcome applyEvent(String correlationId, DeliveryEventType event) {
    for (int attempt = 0; attempt < MAX_EVENT_ATTEMPTS; attempt++) {
      var current = repository.findByCorrelationId(correlationId).orElse(null);
      if (current == null) {
        return EventOutcome.UNKNOWN_CORRELATION;
      }

      var status = current.getStatus();
      var transition = DeliveryStateMachine.decide(status, event.targetStatus());
      if (transition == Transition.REJECTED) {
        log.info(
            "Ignoring {} event for delivery {} in status {}",
            event.wireName(),
            current.getId(),
            status);
        return EventOutcome.REJECTED;
      }
      if (transition == Transition.TIMESTAMP_ONLY && timestampOf(current, event) != null) {
        return EventOutcome.DUPLICATE;
      }

      var newStatus = transition == Transition.ADVANCE ? event.targetStatus() : status;
      if (write(current.getId(), event, status, newStatus) == 1) {
        log.debug(
            "Delivery {} {} -> {} on {} event",
            current.getId(),
            status,
            newStatus,
            event.wireName());
        return transition == Transition.ADVANCE
            ? EventOutcome.ADVANCED
            : EventOutcome.TIMESTAMP_RECORDED;
      }
      log.debug(
          "Delivery {} changed concurrently while applying {}, retrying",
          current.getId(),
          event.wireName());
    }
    throw new IllegalStateException(
        "Could not apply "
            + event.wireName()
            + " event for correlation id "
            + correlationId
            + " after "
            + MAX_EVENT_ATTEMPTS
            + " attempts");
  }

  @Transactional(readOnly = true)
  public EmailDeliveryLog findById(UUID id) {
    return repository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("EmailDeliveryLog", id));
  }

  @Transactional(readOnly = true)
  public Page<EmailDeliveryLog> findByFilters(
      EmailDeliveryStatus status,
      String templateKey,
      String toAddress,
      Instant from,
      Instant to,
      Pageable pageable) {
    return repository.findByFilters(status, templateKey, toAddress, from, to, pageable);
  }

  @Transactional(readOnly = true)
  public EmailDeliveryStats getStats(Instant since) {
    var byStatus = new EnumMap<EmailDeliveryStatus, Long>(EmailDeliveryStatus.class);
    for (var status : EmailDeliveryStatus.values()) {
      byStatus.put(status, 0L);
    }
    long total = 0;
    for (var row : repository.countByStatusSince(since)) {
      byStatus.put(row.getStatus(), row.getCount());
      total += row.getCount();
    }
    long pendingNow = repository.countByStatus(EmailDeliveryStatus.PENDING);
    return new EmailDeliveryStats(since, total, byStatus, pendingNow);
  }

  private int write(
      UUID id, DeliveryEventType event, EmailDeliveryStatus expected, EmailDeliveryStatus next) {
    var now = Instant.now(clock);
    return switch (event) {
      case DELIVERED -> repository.recordDelivered(id, expected, next, now);
      case OPENED -> repository.recordOpened(id, expected, next, now);
      case CLICKED -> repository.recordClicked(id, expected, next, now);
      case BOUNCED -> repository.advanceStatus(id, expected, next, now);
    };
  }

  private static Instant timestampOf(EmailDeliveryLog deliveryLog, DeliveryEventType event) {
    return switch (event) {
      case DELIVERED -> deliveryLog.getDeliveredAt();
      case OPENED -> deliveryLog.getOpenedAt();
      case CLICKED -> deliveryLog.getClickedAt();
      case BOUNCED -> null;
    };
  }
}
