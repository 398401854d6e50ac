package io.b2mash.mailflow.delivery;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One dispatch attempt and its lifecycle. Content fields are frozen at creation; afterwards only
 * status, correlation id, timestamps and error message change, and only through the guarded
 * updates in {@link EmailDeliveryLogRepository}.
 */
@Entity
@Table(name = "email_delivery_logs")
public class EmailDeliveryLog {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "template_key", nullable = false, length = 100, updatable = false)
  private String templateKey;

  @Column(name = "to_address", nullable = false, length = 320, updatable = false)
  private String toAddress;

  @Column(name = "from_address", nullable = false, length = 320, updatable = false)
  private String fromAddress;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "cc", nullable = false, columnDefinition = "jsonb", updatable = false)
  private List<String> cc = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "bcc", nullable = false, columnDefinition = "jsonb", updatable = false)
  private List<String> bcc = new ArrayList<>();

  @Column(name = "subject", columnDefinition = "TEXT", updatable = false)
  private String subject;

  @Column(name = "html_body", columnDefinition = "TEXT", updatable = false)
  private String htmlBody;

  @Column(name = "text_body", columnDefinition = "TEXT", updatable = false)
  private String textBody;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private EmailDeliveryStatus status;

  @Column(name = "correlation_id", length = 255)
  private String correlationId;

  @Column(name = "provider_id", length = 50)
  private String providerId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "context_data", nullable = false, columnDefinition = "jsonb", updatable = false)
  private Map<String, Object> contextData = new LinkedHashMap<>();

  @Column(name = "initiated_by", length = 255, updatable = false)
  private String initiatedBy;

  @Column(name = "error_message", columnDefinition = "TEXT")
  private String errorMessage;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "sent_at")
  private Instant sentAt;

  @Column(name = "delivered_at")
  private Instant deliveredAt;

  @Column(name = "opened_at")
  private Instant openedAt;

  @Column(name = "clicked_at")
  private Instant clickedAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected EmailDeliveryLog() {}

  private EmailDeliveryLog(
      String templateKey,
      String toAddress,
      String fromAddress,
      List<String> cc,
      List<String> bcc,
      Map<String, Object> contextData,
      String initiatedBy) {
    this.templateKey = templateKey;
    this.toAddress = toAddress;
    this.fromAddress = fromAddress;
    this.cc = cc != null ? new ArrayList<>(cc) : new ArrayList<>();
    this.bcc = bcc != null ? new ArrayList<>(bcc) : new ArrayList<>();
    this.contextData =
        contextData != null ? new LinkedHashMap<>(contextData) : new LinkedHashMap<>();
    this.initiatedBy = initiatedBy;
  }

  /** A rendered message waiting for the transport. */
  public static EmailDeliveryLog pending(
      String templateKey,
      String toAddress,
      String fromAddress,
      List<String> cc,
      List<String> bcc,
      String subject,
      String htmlBody,
      String textBody,
      Map<String, Object> contextData,
      String initiatedBy) {
    var log =
        new EmailDeliveryLog(
            templateKey, toAddress, fromAddress, cc, bcc, contextData, initiatedBy);
    log.subject = subject;
    log.htmlBody = htmlBody;
    log.textBody = textBody;
    log.status = EmailDeliveryStatus.PENDING;
    return log;
  }

  /** A dispatch that failed before any content could be rendered. */
  public static EmailDeliveryLog failed(
      String templateKey,
      String toAddress,
      String fromAddress,
      List<String> cc,
      List<String> bcc,
      Map<String, Object> contextData,
      String initiatedBy,
      String errorMessage) {
    var log =
        new EmailDeliveryLog(
            templateKey, toAddress, fromAddress, cc, bcc, contextData, initiatedBy);
    log.status = EmailDeliveryStatus.FAILED;
    log.errorMessage = errorMessage;
    return log;
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public String getTemplateKey() {
    return templateKey;
  }

  public String getToAddress() {
    return toAddress;
  }

  public String getFromAddress() {
    return fromAddress;
  }

  public List<String> getCc() {
    return cc;
  }

  public List<String> getBcc() {
    return bcc;
  }

  public String getSubject() {
    return subject;
  }

  public String getHtmlBody() {
    return htmlBody;
  }

  public String getTextBody() {
    return textBody;
  }

  public EmailDeliveryStatus getStatus() {
    return status;
  }

  public String getCorrelationId() {
    return correlationId;
  }

  public String getProviderId() {
    return providerId;
  }

  public Map<String, Object> getContextData() {
    return contextData;
  }

  public String getInitiatedBy() {
    return initiatedBy;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getDeliveredAt() {
    return deliveredAt;
  }

  public Instant getOpenedAt() {
    return openedAt;
  }

  public Instant getClickedAt() {
    return clickedAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
