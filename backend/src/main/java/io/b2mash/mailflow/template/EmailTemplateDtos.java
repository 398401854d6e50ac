package io.b2mash.mailflow.template;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public final class EmailTemplateDtos {

  private EmailTemplateDtos() {}

  public record CreateTemplateRequest(
      @NotBlank @Size(max = 100) String key,
      @NotBlank @Size(max = 200) String name,
      String description,
      @NotBlank @Size(max = 1000) String subjectTemplate,
      @NotBlank String htmlTemplate,
      @NotBlank String textTemplate,
      @Size(max = 50) String category,
      @Size(max = 10) String language,
      Map<String, Object> declaredVariables) {}

  public record UpdateTemplateRequest(
      @NotBlank @Size(max = 200) String name,
      String description,
      @NotBlank @Size(max = 1000) String subjectTemplate,
      @NotBlank String htmlTemplate,
      @NotBlank String textTemplate,
      @Size(max = 50) String category,
      @Size(max = 10) String language,
      Map<String, Object> declaredVariables) {}

  public record PreviewRequest(Map<String, Object> context) {}

  public record PreviewResponse(String subject, String htmlBody, String textBody) {

    public static PreviewResponse from(RenderedEmail rendered) {
      return new PreviewResponse(rendered.subject(), rendered.htmlBody(), rendered.textBody());
    }
  }

  public record TestSendRequest(@NotBlank @Email String toAddress, Map<String, Object> context) {}

  public record TemplateResponse(
      UUID id,
      String key,
      String name,
      String description,
      String subjectTemplate,
      String htmlTemplate,
      String textTemplate,
      String category,
      String language,
      boolean active,
      Map<String, Object> declaredVariables,
      Instant createdAt,
      Instant updatedAt) {

    public static TemplateResponse from(EmailTemplate t) {
      return new TemplateResponse(
          t.getId(),
          t.getTemplateKey(),
          t.getName(),
          t.getDescription(),
          t.getSubjectTemplate(),
          t.getHtmlTemplate(),
          t.getTextTemplate(),
          t.getCategory(),
          t.getLanguage(),
          t.isActive(),
          t.getDeclaredVariables(),
          t.getCreatedAt(),
          t.getUpdatedAt());
    }
  }
}
