package io.b2mash.mailflow.template;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "email_templates")
public class EmailTemplate {

  private static final Pattern KEY_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9_-]*$");

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "template_key", nullable = false, unique = true, length = 100, updatable = false)
  private String templateKey;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "subject_template", nullable = false, columnDefinition = "TEXT")
  private String subjectTemplate;

  @Column(name = "html_template", nullable = false, columnDefinition = "TEXT")
  private String htmlTemplate;

  @Column(name = "text_template", nullable = false, columnDefinition = "TEXT")
  private String textTemplate;

  @Column(name = "category", nullable = false, length = 50)
  private String category;

  @Column(name = "language", nullable = false, length = 10)
  private String language;

  @Column(name = "active", nullable = false)
  private boolean active;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "declared_variables", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> declaredVariables = new LinkedHashMap<>();

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected EmailTemplate() {}

  public EmailTemplate(
      String templateKey,
      String name,
      String description,
      String subjectTemplate,
      String htmlTemplate,
      String textTemplate,
      String category,
      String language,
      Map<String, Object> declaredVariables) {
    this.templateKey = templateKey;
    this.name = name;
    this.description = description;
    this.subjectTemplate = subjectTemplate;
    this.htmlTemplate = htmlTemplate;
    this.textTemplate = textTemplate;
    this.category = category;
    this.language = language;
    this.active = true;
    this.declaredVariables =
        declaredVariables != null ? new LinkedHashMap<>(declaredVariables) : new LinkedHashMap<>();
  }

  public static boolean isValidKey(String key) {
    return key != null && KEY_PATTERN.matcher(key).matches();
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  public void update(
      String name,
      String description,
      String subjectTemplate,
      String htmlTemplate,
      String textTemplate,
      String category,
      String language,
      Map<String, Object> declaredVariables) {
    this.name = name;
    this.description = description;
    this.subjectTemplate = subjectTemplate;
    this.htmlTemplate = htmlTemplate;
    this.textTemplate = textTemplate;
    this.category = category;
    this.language = language;
    this.declaredVariables =
        declaredVariables != null ? new LinkedHashMap<>(declaredVariables) : new LinkedHashMap<>();
  }

  public void deactivate() {
    this.active = false;
  }

  public void reactivate() {
    this.active = true;
  }

  public UUID getId() {
    return id;
  }

  public String getTemplateKey() {
    return templateKey;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public String getSubjectTemplate() {
    return subjectTemplate;
  }

  public String getHtmlTemplate() {
    return htmlTemplate;
  }

  public String getTextTemplate() {
    return textTemplate;
  }

  public String getCategory() {
    return category;
  }

  public String getLanguage() {
    return language;
  }

  public boolean isActive() {
    return active;
  }

  public Map<String, Object> getDeclaredVariables() {
    return declaredVariables;
  }

  public long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
