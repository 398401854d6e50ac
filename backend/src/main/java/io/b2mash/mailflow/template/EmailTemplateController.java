package io.b2mash.mailflow.template;

import io.b2mash.mailflow.delivery.EmailDeliveryLogResponse;
import io.b2mash.mailflow.dispatch.DispatchMode;
import io.b2mash.mailflow.dispatch.DispatchRequest;
import io.b2mash.mailflow.dispatch.EmailDispatchService;
import io.b2mash.mailflow.template.EmailTemplateDtos.CreateTemplateRequest;
import io.b2mash.mailflow.template.EmailTemplateDtos.PreviewRequest;
import io.b2mash.mailflow.template.EmailTemplateDtos.PreviewResponse;
import io.b2mash.mailflow.template.EmailTemplateDtos.TemplateResponse;
import io.b2mash.mailflow.template.EmailTemplateDtos.TestSendRequest;
import io.b2mash.mailflow.template.EmailTemplateDtos.UpdateTemplateRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Operator endpoints for managing, previewing and test-sending email templates. */
@RestController
@RequestMapping("/api/email/templates")
public class EmailTemplateController {

  static final String TEST_SEND_INITIATOR = "admin:test-send";

  private final EmailTemplateService templateService;
  private final EmailDispatchService dispatchService;

  public EmailTemplateController(
      EmailTemplateService templateService, EmailDispatchService dispatchService) {
    this.templateService = templateService;
    this.dispatchService = dispatchService;
  }

  @GetMapping
  public ResponseEntity<List<TemplateResponse>> listTemplates(
      @RequestParam(required = false) String category,
      @RequestParam(defaultValue = "false") boolean activeOnly) {
    return ResponseEntity.ok(templateService.list(category, activeOnly));
  }

  @GetMapping("/{key}")
  public ResponseEntity<TemplateResponse> getTemplate(@PathVariable String key) {
    return ResponseEntity.ok(templateService.get(key));
  }

  @PostMapping
  public ResponseEntity<TemplateResponse> createTemplate(
      @Valid @RequestBody CreateTemplateRequest request) {
    var created = templateService.create(request);
    return ResponseEntity.created(URI.create("/api/email/templates/" + created.key()))
        .body(created);
  }

  @PutMapping("/{key}")
  public ResponseEntity<TemplateResponse> updateTemplate(
      @PathVariable String key, @Valid @RequestBody UpdateTemplateRequest request) {
    return ResponseEntity.ok(templateService.update(key, request));
  }

  @PostMapping("/{key}/deactivate")
  public ResponseEntity<TemplateResponse> deactivateTemplate(@PathVariable String key) {
    return ResponseEntity.ok(templateService.deactivate(key));
  }

  @PostMapping("/{key}/reactivate")
  public ResponseEntity<TemplateResponse> reactivateTemplate(@PathVariable String key) {
    return ResponseEntity.ok(templateService.reactivate(key));
  }

  @PostMapping("/{key}/preview")
  public ResponseEntity<PreviewResponse> previewTemplate(
      @PathVariable String key, @RequestBody(required = false) PreviewRequest request) {
    var context = request != null ? request.context() : null;
    return ResponseEntity.ok(PreviewResponse.from(templateService.preview(key, context)));
  }

  @PostMapping("/{key}/test-send")
  public ResponseEntity<EmailDeliveryLogResponse> testSend(
      @PathVariable String key, @Valid @RequestBody TestSendRequest request) {
    var deliveryLog =
        dispatchService.dispatch(
            DispatchRequest.of(
                key,
                request.toAddress(),
                request.context(),
                DispatchMode.IMMEDIATE,
                TEST_SEND_INITIATOR));
    return ResponseEntity.ok(EmailDeliveryLogResponse.from(deliveryLog));
  }
}
