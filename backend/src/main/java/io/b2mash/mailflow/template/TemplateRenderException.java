package io.b2mash.mailflow.template;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A template body could not be expanded, typically because of malformed expression syntax. */
public class TemplateRenderException extends ErrorResponseException {

  private final String templateKey;
  private final String reason;

  public TemplateRenderException(String templateKey, String reason) {
    this(templateKey, reason, null);
  }

  public TemplateRenderException(String templateKey, String reason, Throwable cause) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(templateKey, reason), cause);
    this.templateKey = templateKey;
    this.reason = reason;
  }

  public String getTemplateKey() {
    return templateKey;
  }

  public String getReason() {
    return reason;
  }

  @Override
  public String getMessage() {
    return "Failed to render template '" + templateKey + "': " + reason;
  }

  private static ProblemDetail createProblem(String templateKey, String reason) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Template rendering failed");
    problem.setDetail("Template '" + templateKey + "' could not be rendered: " + reason);
    return problem;
  }
}
