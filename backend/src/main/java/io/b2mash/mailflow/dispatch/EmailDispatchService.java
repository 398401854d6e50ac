package io.b2mash.mailflow.dispatch;

import io.b2mash.mailflow.config.EmailDispatchProperties;
import io.b2mash.mailflow.delivery.DeliveryDraft;
import io.b2mash.mailflow.delivery.EmailDeliveryLog;
import io.b2mash.mailflow.delivery.EmailDeliveryLogService;
import io.b2mash.mailflow.template.EmailTemplateService;
import io.b2mash.mailflow.template.RenderContextBuilder;
import io.b2mash.mailflow.template.TemplateRenderException;
import io.b2mash.mailflow.template.TemplateRenderer;
import io.b2mash.mailflow.transport.EmailTransportException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the pipeline: resolve, render, persist PENDING, then hand off to the dispatcher
 * for the requested mode. Not idempotent; every call creates a new delivery log.
 */
@Service
public class EmailDispatchService {

  private static final Logger log = LoggerFactory.getLogger(EmailDispatchService.class);

  private final EmailTemplateService templateService;
  private final TemplateRenderer renderer;
  private final RenderContextBuilder contextBuilder;
  private final EmailDeliveryLogService deliveryLogService;
  private final EmailDispatchProperties properties;
  private final Map<DispatchMode, EmailDispatcher> dispatchers;

  public EmailDispatchService(
      EmailTemplateService templateService,
      TemplateRenderer renderer,
      RenderContextBuilder contextBuilder,
      EmailDeliveryLogService deliveryLogService,
      EmailDispatchProperties properties,
      List<EmailDispatcher> dispatchers) {
    this.templateService = templateService;
    this.renderer = renderer;
    this.contextBuilder = contextBuilder;
    this.deliveryLogService = deliveryLogService;
    this.properties = properties;
    this.dispatchers = new EnumMap<>(DispatchMode.class);
    for (var dispatcher : dispatchers) {
      this.dispatchers.put(dispatcher.mode(), dispatcher);
    }
  }

  /** Single-recipient form of {@link #dispatch(DispatchRequest)}. */
  public EmailDeliveryLog dispatch(
      String templateKey,
      String toAddress,
      Map<String, Object> context,
      boolean async,
      String initiator) {
    var mode = async ? DispatchMode.QUEUED : DispatchMode.IMMEDIATE;
    return dispatch(DispatchRequest.of(templateKey, toAddress, context, mode, initiator));
  }

  /**
   * Dispatches one email.
   *
   * @throws io.b2mash.mailflow.template.TemplateNotFoundException if the key has no active
   *     template; no log is created
   * @throws TemplateRenderException if rendering fails; a FAILED log is recorded first
   * @throws EmailTransportException in immediate mode, if the transport fails or times out; the
   *     log is FAILED
   */
  public EmailDeliveryLog dispatch(DispatchRequest request) {
    var template = templateService.resolve(request.templateKey());
    var dispatcher = dispatchers.get(request.mode());
    if (dispatcher == null) {
      throw new IllegalStateException("No dispatcher registered for mode " + request.mode());
    }

    var draft =
        new DeliveryDraft(
            template.getTemplateKey(),
            request.toAddress(),
            request.fromAddress() != null && !request.fromAddress().isBlank()
                ? request.fromAddress()
                : properties.senderAddress(),
            request.cc(),
            request.bcc(),
            request.context(),
            request.initiator());

    final EmailDeliveryLog pending;
    try {
      var rendered = renderer.render(template, contextBuilder.build(request.context()));
      pending = deliveryLogService.createPending(draft, rendered);
    } catch (TemplateRenderException e) {
      deliveryLogService.createFailed(draft, "Template rendering failed: " + e.getReason());
      throw e;
    }

    var timeout = effectiveTimeout(request.timeout());
    log.info(
        "Dispatching template={} to={} mode={} delivery={} initiator={}",
        draft.templateKey(),
        draft.toAddress(),
        request.mode(),
        pending.getId(),
        request.initiator());
    return dispatcher.dispatch(pending, timeout);
  }

  /**
   * Caps the transport timeout below the watchdog threshold. A send still running when the watchdog
   * fails its log could no longer be recorded as SENT; half the threshold leaves room for time
   * spent waiting in the dispatch queue.
   */
  Duration effectiveTimeout(Duration requested) {
    var timeout = requested != null ? requested : properties.transportTimeout();
    var watchdog = properties.watchdog();
    if (watchdog.enabled()) {
      var ceiling = watchdog.staleAfter().dividedBy(2);
      if (timeout.compareTo(ceiling) > 0) {
        log.warn(
            "Transport timeout {} exceeds half the stale-delivery threshold {}; using {}",
            timeout,
            watchdog.staleAfter(),
            ceiling);
        return ceiling;
      }
    }
    return timeout;
  }

  /**
   * Sends the same template to each recipient in immediate mode. One recipient failing, for any
   * reason, does not stop the batch; an unknown template fails the whole call up front.
   */
  public BulkDispatchResult dispatchBulk(
      String templateKey, List<String> recipients, Map<String, Object> context, String initiator) {
    templateService.resolve(templateKey);

    int sent = 0;
    var failedRecipients = new ArrayList<String>();
    for (var recipient : recipients) {
      try {
        dispatch(
            DispatchRequest.of(templateKey, recipient, context, DispatchMode.IMMEDIATE, initiator));
        sent++;
      } catch (EmailTransportException | TemplateRenderException e) {
        log.warn("Bulk dispatch of {} to {} failed: {}", templateKey, recipient, e.getMessage());
        failedRecipients.add(recipient);
      } catch (RuntimeException e) {
        log.error("Bulk dispatch of {} to {} failed unexpectedly", templateKey, recipient, e);
        failedRecipients.add(recipient);
      }
    }
    log.info(
        "Bulk dispatch of {} finished: sent={} failed={}",
        templateKey,
        sent,
        failedRecipients.size());
    return new BulkDispatchResult(sent, failedRecipients.size(), List.copyOf(failedRecipients));
  }
}
