package io.b2mash.mailflow.template;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** No active template exists for the requested key. */
public class TemplateNotFoundException extends ErrorResponseException {

  private final String templateKey;

  public TemplateNotFoundException(String templateKey) {
    super(HttpStatus.NOT_FOUND, createProblem(templateKey), null);
    this.templateKey = templateKey;
  }

  public String getTemplateKey() {
    return templateKey;
  }

  private static ProblemDetail createProblem(String templateKey) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Template not found");
    problem.setDetail("No active email template found with key '" + templateKey + "'");
    return problem;
  }
}
