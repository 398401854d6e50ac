package io.b2mash.mailflow.delivery;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Delivery log store. Every status change is a single conditional UPDATE guarded by the status the
 * caller last read; a return value of 0 means another writer got there first.
 */
public interface EmailDeliveryLogRepository extends JpaRepository<EmailDeliveryLog, UUID> {

  Optional<EmailDeliveryLog> findByCorrelationId(String correlationId);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE EmailDeliveryLog l
      SET l.status = io.b2mash.mailflow.delivery.EmailDeliveryStatus.SENT,
          l.correlationId = :correlationId,
          l.providerId = :providerId,
          l.sentAt = COALESCE(l.sentAt, :at),
          l.updatedAt = :at
      WHERE l.id = :id
        AND l.status = io.b2mash.mailflow.delivery.EmailDeliveryStatus.PENDING
      """)
  int markSent(
      @Param("id") UUID id,
      @Param("correlationId") String correlationId,
      @Param("providerId") String providerId,
      @Param("at") Instant at);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE EmailDeliveryLog l
      SET l.status = io.b2mash.mailflow.delivery.EmailDeliveryStatus.FAILED,
          l.errorMessage = :errorMessage,
          l.updatedAt = :at
      WHERE l.id = :id
        AND l.status = io.b2mash.mailflow.delivery.EmailDeliveryStatus.PENDING
      """)
  int markFailed(
      @Param("id") UUID id,
      @Param("errorMessage") String errorMessage,
      @Param("at") Instant at);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE EmailDeliveryLog l
      SET l.status = io.b2mash.mailflow.delivery.EmailDeliveryStatus.FAILED,
          l.errorMessage = :errorMessage,
          l.updatedAt = :at
      WHERE l.status = io.b2mash.mailflow.delivery.EmailDeliveryStatus.PENDING
        AND l.createdAt < :cutoff
      """)
  int failStalePending(
      @Param("cutoff") Instant cutoff,
      @Param("errorMessage") String errorMessage,
      @Param("at") Instant at);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE EmailDeliveryLog l
      SET l.status = :newStatus,
          l.deliveredAt = COALESCE(l.deliveredAt, :at),
          l.updatedAt = :at
      WHERE l.id = :id AND l.status = :expected
      """)
  int recordDelivered(
      @Param("id") UUID id,
      @Param("expected") EmailDeliveryStatus expected,
      @Param("newStatus") EmailDeliveryStatus newStatus,
      @Param("at") Instant at);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE EmailDeliveryLog l
      SET l.status = :newStatus,
          l.openedAt = COALESCE(l.openedAt, :at),
          l.updatedAt = :at
      WHERE l.id = :id AND l.status = :expected
      """)
  int recordOpened(
      @Param("id") UUID id,
      @Param("expected") EmailDeliveryStatus expected,
      @Param("newStatus") EmailDeliveryStatus newStatus,
      @Param("at") Instant at);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE EmailDeliveryLog l
      SET l.status = :newStatus,
          l.clickedAt = COALESCE(l.clickedAt, :at),
          l.updatedAt = :at
      WHERE l.id = :id AND l.status = :expected
      """)
  int recordClicked(
      @Param("id") UUID id,
      @Param("expected") EmailDeliveryStatus expected,
      @Param("newStatus") EmailDeliveryStatus newStatus,
      @Param("at") Instant at);

  /** Status change with no dedicated timestamp column (BOUNCED). */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE EmailDeliveryLog l
      SET l.status = :newStatus,
          l.updatedAt = :at
      WHERE l.id = :id AND l.status = :expected
      """)
  int advanceStatus(
      @Param("id") UUID id,
      @Param("expected") EmailDeliveryStatus expected,
      @Param("newStatus") EmailDeliveryStatus newStatus,
      @Param("at") Instant at);

  @Query(
      """
      SELECT l FROM EmailDeliveryLog l
      WHERE (:status IS NULL OR l.status = :status)
        AND (:templateKey IS NULL OR l.templateKey = :templateKey)
        AND (:toAddress IS NULL OR l.toAddress = :toAddress)
        AND l.createdAt >= :from
        AND l.createdAt < :to
      ORDER BY l.createdAt DESC
      """)
  Page<EmailDeliveryLog> findByFilters(
      @Param("status") EmailDeliveryStatus status,
      @Param("templateKey") String templateKey,
      @Param("toAddress") String toAddress,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);

  @Query(
      """
      SELECT l.status AS status, COUNT(l) AS count
      FROM EmailDeliveryLog l
      WHERE l.createdAt >= :since
      GROUP BY l.status
      """)
  List<StatusCount> countByStatusSince(@Param("since") Instant since);

  long countByStatus(EmailDeliveryStatus status);

  /** Projection row for {@link #countByStatusSince(Instant)}. */
  interface StatusCount {
    EmailDeliveryStatus getStatus();

    long getCount();
  }
}
