package io.b2mash.mailflow.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.mailflow.TestEntities;
import io.b2mash.mailflow.config.EmailDispatchProperties;
import io.b2mash.mailflow.delivery.DeliveryDraft;
import io.b2mash.mailflow.delivery.EmailDeliveryLogService;
import io.b2mash.mailflow.template.EmailTemplateService;
import io.b2mash.mailflow.template.RenderContextBuilder;
import io.b2mash.mailflow.template.RenderedEmail;
import io.b2mash.mailflow.template.TemplateNotFoundException;
import io.b2mash.mailflow.template.TemplateRenderException;
import io.b2mash.mailflow.template.TemplateRenderer;
import io.b2mash.mailflow.transport.EmailTransportException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class EmailDispatchServiceTest {

  @Mock private EmailTemplateService templateService;
  @Mock private EmailDeliveryLogService deliveryLogService;
  @Mock private EmailDispatcher immediateDispatcher;
  @Mock private EmailDispatcher queuedDispatcher;

  private EmailDispatchService service;

  @BeforeEach
  void setUp() {
    var properties = TestEntities.properties();
    when(immediateDispatcher.mode()).thenReturn(DispatchMode.IMMEDIATE);
    when(queuedDispatcher.mode()).thenReturn(DispatchMode.QUEUED);
    service =
        new EmailDispatchService(
            templateService,
            new TemplateRenderer(),
            new RenderContextBuilder(properties),
            deliveryLogService,
            properties,
            List.of(immediateDispatcher, queuedDispatcher));
  }

  @Test
  void dispatch_persists_rendered_pending_log_then_hands_off() {
    var template =
        TestEntities.template("welcome", "Hi [(${name})]", "<p>[[${site_name}]]</p>", "t");
    var pending = TestEntities.pendingLog(UUID.randomUUID(), "welcome", "a@example.com");
    when(templateService.resolve("welcome")).thenReturn(template);
    when(deliveryLogService.createPending(any(), any())).thenReturn(pending);
    when(immediateDispatcher.dispatch(pending, Duration.ofSeconds(5))).thenReturn(pending);

    var result =
        service.dispatch("welcome", "a@example.com", Map.of("name", "Ann"), false, "user:42");

    assertThat(result).isSameAs(pending);
    var draft = ArgumentCaptor.forClass(DeliveryDraft.class);
    var rendered = ArgumentCaptor.forClass(RenderedEmail.class);
    verify(deliveryLogService).createPending(draft.capture(), rendered.capture());
    assertThat(draft.getValue().fromAddress()).isEqualTo("noreply@test.mailflow.local");
    assertThat(draft.getValue().initiatedBy()).isEqualTo("user:42");
    assertThat(draft.getValue().contextData()).containsOnlyKeys("name");
    assertThat(rendered.getValue().subject()).isEqualTo("Hi Ann");
    assertThat(rendered.getValue().htmlBody()).isEqualTo("<p>Mailflow Test</p>");
    verifyNoInteractions(queuedDispatcher);
  }

  @Test
  void async_dispatch_uses_queued_dispatcher() {
    var template = TestEntities.template("welcome", "Hi", "<p>Hi</p>", "Hi");
    var pending = TestEntities.pendingLog(UUID.randomUUID(), "welcome", "a@example.com");
    when(templateService.resolve("welcome")).thenReturn(template);
    when(deliveryLogService.createPending(any(), any())).thenReturn(pending);
    when(queuedDispatcher.dispatch(eq(pending), any())).thenReturn(pending);

    service.dispatch("welcome", "a@example.com", Map.of(), true, "system");

    verify(queuedDispatcher).dispatch(eq(pending), any());
    verify(immediateDispatcher, never()).dispatch(any(), any());
  }

  @Test
  void request_overrides_sender_and_timeout() {
    var template = TestEntities.template("welcome", "Hi", "<p>Hi</p>", "Hi");
    var pending = TestEntities.pendingLog(UUID.randomUUID(), "welcome", "a@example.com");
    when(templateService.resolve("welcome")).thenReturn(template);
    when(deliveryLogService.createPending(any(), any())).thenReturn(pending);
    when(immediateDispatcher.dispatch(pending, Duration.ofSeconds(2))).thenReturn(pending);

    service.dispatch(
        new DispatchRequest(
            "welcome",
            "a@example.com",
            Map.of(),
            DispatchMode.IMMEDIATE,
            "system",
            List.of("cc@example.com"),
            null,
            "billing@example.com",
            Duration.ofSeconds(2)));

    var draft = ArgumentCaptor.forClass(DeliveryDraft.class);
    verify(deliveryLogService).createPending(draft.capture(), any());
    assertThat(draft.getValue().fromAddress()).isEqualTo("billing@example.com");
    assertThat(draft.getValue().cc()).containsExactly("cc@example.com");
    assertThat(draft.getValue().bcc()).isEmpty();
  }

  @Test
  void missing_template_fails_without_creating_a_log() {
    when(templateService.resolve("missing")).thenThrow(new TemplateNotFoundException("missing"));

    assertThatThrownBy(() -> service.dispatch("missing", "a@example.com", Map.of(), false, "x"))
        .isInstanceOf(TemplateNotFoundException.class);
    verifyNoInteractions(deliveryLogService);
  }

  @Test
  void render_failure_records_failed_log_and_rethrows() {
    var template = TestEntities.template("broken", "Hi [(${name)]", "<p>Hi</p>", "Hi");
    when(templateService.resolve("broken")).thenReturn(template);

    assertThatThrownBy(() -> service.dispatch("broken", "a@example.com", Map.of(), false, "x"))
        .isInstanceOf(TemplateRenderException.class);

    var error = ArgumentCaptor.forClass(String.class);
    verify(deliveryLogService).createFailed(any(), error.capture());
    assertThat(error.getValue()).startsWith("Template rendering failed: ");
    verify(deliveryLogService, never()).createPending(any(), any());
    verify(immediateDispatcher, never()).dispatch(any(), any());
  }

  @Test
  void bulk_dispatch_continues_past_failures() {
    var template = TestEntities.template("news", "News", "<p>News</p>", "News");
    var ok = TestEntities.pendingLog(UUID.randomUUID(), "news", "ok@example.com");
    var bad = TestEntities.pendingLog(UUID.randomUUID(), "news", "bad@example.com");
    when(templateService.resolve("news")).thenReturn(template);
    when(deliveryLogService.createPending(any(), any())).thenReturn(ok, bad, ok);
    when(immediateDispatcher.dispatch(eq(ok), any())).thenReturn(ok);
    when(immediateDispatcher.dispatch(eq(bad), any()))
        .thenThrow(new EmailTransportException(bad.getId(), "550 mailbox unavailable"));

    var result =
        service.dispatchBulk(
            "news",
            List.of("ok@example.com", "bad@example.com", "ok2@example.com"),
            Map.of(),
            "system");

    assertThat(result.totalSent()).isEqualTo(2);
    assertThat(result.totalFailed()).isEqualTo(1);
    assertThat(result.failedRecipients()).containsExactly("bad@example.com");
  }

  @Test
  void long_rendered_subject_is_persisted_intact() {
    var template = TestEntities.template("welcome", "Hi [(${name})]", "<p>Hi</p>", "Hi");
    var pending = TestEntities.pendingLog(UUID.randomUUID(), "welcome", "a@example.com");
    String name = "n".repeat(300);
    when(templateService.resolve("welcome")).thenReturn(template);
    when(deliveryLogService.createPending(any(), any())).thenReturn(pending);
    when(immediateDispatcher.dispatch(eq(pending), any())).thenReturn(pending);

    service.dispatch("welcome", "a@example.com", Map.of("name", name), false, "system");

    var rendered = ArgumentCaptor.forClass(RenderedEmail.class);
    verify(deliveryLogService).createPending(any(), rendered.capture());
    assertThat(rendered.getValue().subject()).isEqualTo("Hi " + name);
  }

  @Test
  void bulk_dispatch_isolates_persistence_failures() {
    var template = TestEntities.template("news", "News", "<p>News</p>", "News");
    when(templateService.resolve("news")).thenReturn(template);
    when(deliveryLogService.createPending(any(), any()))
        .thenThrow(new DataIntegrityViolationException("value too long"));

    var result =
        service.dispatchBulk(
            "news", List.of("a@example.com", "b@example.com"), Map.of(), "system");

    assertThat(result.totalSent()).isZero();
    assertThat(result.totalFailed()).isEqualTo(2);
    assertThat(result.failedRecipients()).containsExactly("a@example.com", "b@example.com");
    verify(immediateDispatcher, never()).dispatch(any(), any());
  }

  @Test
  void transport_timeout_is_capped_below_the_watchdog_threshold() {
    var template = TestEntities.template("welcome", "Hi", "<p>Hi</p>", "Hi");
    var pending = TestEntities.pendingLog(UUID.randomUUID(), "welcome", "a@example.com");
    when(templateService.resolve("welcome")).thenReturn(template);
    when(deliveryLogService.createPending(any(), any())).thenReturn(pending);
    when(immediateDispatcher.dispatch(pending, Duration.ofSeconds(450))).thenReturn(pending);

    service.dispatch(
        new DispatchRequest(
            "welcome",
            "a@example.com",
            Map.of(),
            DispatchMode.IMMEDIATE,
            "system",
            null,
            null,
            null,
            Duration.ofMinutes(20)));

    verify(immediateDispatcher).dispatch(pending, Duration.ofSeconds(450));
  }

  @Test
  void transport_timeout_is_not_capped_when_the_watchdog_is_disabled() {
    var defaults = TestEntities.properties();
    var properties =
        new EmailDispatchProperties(
            defaults.senderAddress(),
            defaults.siteName(),
            defaults.siteUrl(),
            defaults.transportTimeout(),
            defaults.templateCacheTtl(),
            defaults.worker(),
            new EmailDispatchProperties.Watchdog(
                false, Duration.ofMinutes(15), Duration.ofMinutes(1)));
    var unguarded =
        new EmailDispatchService(
            templateService,
            new TemplateRenderer(),
            new RenderContextBuilder(properties),
            deliveryLogService,
            properties,
            List.of());

    assertThat(unguarded.effectiveTimeout(Duration.ofMinutes(20)))
        .isEqualTo(Duration.ofMinutes(20));
    assertThat(service.effectiveTimeout(null)).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  void bulk_dispatch_of_missing_template_fails_up_front() {
    when(templateService.resolve("missing")).thenThrow(new TemplateNotFoundException("missing"));

    assertThatThrownBy(
            () -> service.dispatchBulk("missing", List.of("a@example.com"), Map.of(), "system"))
        .isInstanceOf(TemplateNotFoundException.class);
    verifyNoInteractions(deliveryLogService);
  }
}
