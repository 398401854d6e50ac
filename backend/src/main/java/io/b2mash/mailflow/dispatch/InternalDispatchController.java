package io.b2mash.mailflow.dispatch;

import io.b2mash.mailflow.delivery.EmailDeliveryLogResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Dispatch entry point for internal callers. Authorization is the API-key check in front of
 * {@code /internal/**}; this controller trusts its caller.
 */
@RestController
@RequestMapping("/internal/email")
public class InternalDispatchController {

  private final EmailDispatchService dispatchService;

  public InternalDispatchController(EmailDispatchService dispatchService) {
    this.dispatchService = dispatchService;
  }

  @PostMapping("/dispatch")
  public ResponseEntity<EmailDeliveryLogResponse> dispatch(
      @Valid @RequestBody DispatchRequestBody body) {
    var mode = body.async() ? DispatchMode.QUEUED : DispatchMode.IMMEDIATE;
    var deliveryLog =
        dispatchService.dispatch(
            new DispatchRequest(
                body.templateKey(),
                body.toAddress(),
                body.context(),
                mode,
                body.initiator(),
                body.cc(),
                body.bcc(),
                body.fromAddress(),
                body.timeoutSeconds() != null ? Duration.ofSeconds(body.timeoutSeconds()) : null));
    var status = body.async() ? HttpStatus.ACCEPTED : HttpStatus.OK;
    return ResponseEntity.status(status).body(EmailDeliveryLogResponse.from(deliveryLog));
  }

  @PostMapping("/dispatch/bulk")
  public ResponseEntity<BulkDispatchResult> dispatchBulk(
      @Valid @RequestBody BulkDispatchRequestBody body) {
    return ResponseEntity.ok(
        dispatchService.dispatchBulk(
            body.templateKey(), body.recipients(), body.context(), body.initiator()));
  }

  public record DispatchRequestBody(
      @NotBlank String templateKey,
      @NotBlank @Email String toAddress,
      Map<String, Object> context,
      boolean async,
      String initiator,
      List<@Email String> cc,
      List<@Email String> bcc,
      @Email String fromAddress,
      @Positive Long timeoutSeconds) {}

  public record BulkDispatchRequestBody(
      @NotBlank String templateKey,
      @NotEmpty List<@NotBlank @Email String> recipients,
      Map<String, Object> context,
      String initiator) {}
}
