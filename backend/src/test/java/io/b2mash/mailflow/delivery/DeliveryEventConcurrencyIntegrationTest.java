package io.b2mash.mailflow.delivery;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.mailflow.TestcontainersConfiguration;
import io.b2mash.mailflow.template.RenderedEmail;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class DeliveryEventConcurrencyIntegrationTest {

  @Autowired private EmailDeliveryLogService deliveryLogService;
  @Autowired private EmailDeliveryLogRepository deliveryLogRepository;

  @Test
  void racing_events_converge_to_highest_status_with_all_timestamps() throws Exception {
    var correlationId = sentLog();
    var events =
        List.of(
            DeliveryEventType.DELIVERED,
            DeliveryEventType.OPENED,
            DeliveryEventType.CLICKED,
            DeliveryEventType.OPENED,
            DeliveryEventType.DELIVERED,
            DeliveryEventType.CLICKED);

    var outcomes = applyConcurrently(correlationId, events);

    assertThat(outcomes).doesNotContain(EventOutcome.REJECTED, EventOutcome.UNKNOWN_CORRELATION);
    var log = deliveryLogRepository.findByCorrelationId(correlationId).orElseThrow();
    assertThat(log.getStatus()).isEqualTo(EmailDeliveryStatus.CLICKED);
    assertThat(log.getDeliveredAt()).isNotNull();
    assertThat(log.getOpenedAt()).isNotNull();
    assertThat(log.getClickedAt()).isNotNull();
  }

  @Test
  void bounce_racing_engagement_never_regresses_a_terminal_log() throws Exception {
    var correlationId = sentLog();
    var events =
        List.of(
            DeliveryEventType.BOUNCED,
            DeliveryEventType.OPENED,
            DeliveryEventType.CLICKED,
            DeliveryEventType.DELIVERED);

    applyConcurrently(correlationId, events);

    // Either the bounce landed on SENT and blocked all engagement, or it arrived too late
    var log = deliveryLogRepository.findByCorrelationId(correlationId).orElseThrow();
    if (log.getStatus() == EmailDeliveryStatus.BOUNCED) {
      assertThat(log.getDeliveredAt()).isNull();
      assertThat(log.getOpenedAt()).isNull();
      assertThat(log.getClickedAt()).isNull();
    } else {
      assertThat(log.getStatus().isTerminal()).isFalse();
      assertThat(log.getStatus().precedence())
          .isGreaterThanOrEqualTo(EmailDeliveryStatus.DELIVERED.precedence());
    }
  }

  private List<EventOutcome> applyConcurrently(String correlationId, List<DeliveryEventType> events)
      throws Exception {
    var executor = Executors.newFixedThreadPool(events.size());
    try {
      var start = new CountDownLatch(1);
      var futures = new ArrayList<Future<EventOutcome>>();
      for (var event : events) {
        Callable<EventOutcome> task =
            () -> {
              start.await();
              return deliveryLogService.applyEvent(correlationId, event);
            };
        futures.add(executor.submit(task));
      }
      start.countDown();
      var outcomes = new ArrayList<EventOutcome>();
      for (var future : futures) {
        outcomes.add(future.get(30, TimeUnit.SECONDS));
      }
      return outcomes;
    } finally {
      executor.shutdownNow();
    }
  }

  private String sentLog() {
    var draft =
        new DeliveryDraft(
            "concurrency",
            "race@example.com",
            "noreply@test.mailflow.local",
            List.of(),
            List.of(),
            Map.of(),
            "test");
    var pending =
        deliveryLogService.createPending(draft, new RenderedEmail("Subject", "<p>Hi</p>", "Hi"));
    var correlationId = "race-" + UUID.randomUUID();
    deliveryLogService.markSent(pending.getId(), correlationId, "smtp");
    return correlationId;
  }
}
