package io.b2mash.mailflow.transport;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The transport rejected or did not complete an immediate dispatch. The delivery log has already
 * been moved to FAILED when this is thrown.
 */
public class EmailTransportException extends ErrorResponseException {

  private final UUID deliveryLogId;
  private final String reason;

  public EmailTransportException(UUID deliveryLogId, String reason) {
    super(HttpStatus.BAD_GATEWAY, createProblem(deliveryLogId, reason), null);
    this.deliveryLogId = deliveryLogId;
    this.reason = reason;
  }

  public UUID getDeliveryLogId() {
    return deliveryLogId;
  }

  public String getReason() {
    return reason;
  }

  @Override
  public String getMessage() {
    return "Email transport failed for delivery " + deliveryLogId + ": " + reason;
  }

  private static ProblemDetail createProblem(UUID deliveryLogId, String reason) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Email transport failed");
    problem.setDetail(reason);
    problem.setProperty("deliveryLogId", deliveryLogId);
    return problem;
  }
}
