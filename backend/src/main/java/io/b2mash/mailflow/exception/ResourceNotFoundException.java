package io.b2mash.mailflow.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A template or delivery log looked up by key or id does not exist. */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object identifier) {
    super(HttpStatus.NOT_FOUND, createProblem(resourceType, identifier), null);
  }

  private static ProblemDetail createProblem(String resourceType, Object identifier) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resourceType + " not found");
    problem.setDetail("No " + resourceType + " exists for '" + identifier + "'");
    problem.setProperty("resourceType", resourceType);
    problem.setProperty("identifier", String.valueOf(identifier));
    return problem;
  }
}
