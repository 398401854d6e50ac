package io.b2mash.mailflow.delivery;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.mailflow.TestcontainersConfiguration;
import io.b2mash.mailflow.template.RenderedEmail;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class EmailDeliveryLogControllerIntegrationTest {

  private static final String API_KEY = "test-api-key";
  private static final String BASE_URL = "/api/email/delivery-logs";
  private static final String TEMPLATE_KEY = "log-query";

  @Autowired private MockMvc mockMvc;
  @Autowired private EmailDeliveryLogService deliveryLogService;

  private UUID sentId;

  @BeforeAll
  void seedLogs() {
    var sent = deliveryLogService.createPending(draft("sent@example.com"), rendered());
    deliveryLogService.markSent(sent.getId(), "log-query-" + UUID.randomUUID(), "smtp");
    sentId = sent.getId();

    deliveryLogService.createFailed(draft("failed@example.com"), "Template rendering failed: x");
  }

  @Test
  void get_by_id_returns_full_log() throws Exception {
    mockMvc
        .perform(get(BASE_URL + "/" + sentId).header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("SENT"))
        .andExpect(jsonPath("$.toAddress").value("sent@example.com"))
        .andExpect(jsonPath("$.providerId").value("smtp"))
        .andExpect(jsonPath("$.contextData.plan").value("pro"));
  }

  @Test
  void unknown_id_returns_404() throws Exception {
    mockMvc
        .perform(get(BASE_URL + "/" + UUID.randomUUID()).header("X-API-KEY", API_KEY))
        .andExpect(status().isNotFound());
  }

  @Test
  void list_filters_by_status_and_template() throws Exception {
    mockMvc
        .perform(
            get(BASE_URL)
                .param("status", "FAILED")
                .param("templateKey", TEMPLATE_KEY)
                .header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content.length()").value(1))
        .andExpect(jsonPath("$.content[0].toAddress").value("failed@example.com"))
        .andExpect(
            jsonPath("$.content[0].errorMessage").value("Template rendering failed: x"));
  }

  @Test
  void list_filters_by_recipient() throws Exception {
    mockMvc
        .perform(
            get(BASE_URL).param("toAddress", "sent@example.com").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content[0].id").value(sentId.toString()));
  }

  @Test
  void stats_count_every_status() throws Exception {
    mockMvc
        .perform(get(BASE_URL + "/stats").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.byStatus.CLICKED").isNumber())
        .andExpect(jsonPath("$.byStatus.SENT").isNumber())
        .andExpect(jsonPath("$.total").isNumber());
  }

  @Test
  void delivery_logs_require_api_key() throws Exception {
    mockMvc.perform(get(BASE_URL)).andExpect(status().isUnauthorized());
  }

  private static DeliveryDraft draft(String to) {
    return new DeliveryDraft(
        TEMPLATE_KEY,
        to,
        "noreply@test.mailflow.local",
        List.of(),
        List.of(),
        Map.of("plan", "pro"),
        "test");
  }

  private static RenderedEmail rendered() {
    return new RenderedEmail("Subject", "<p>Body</p>", "Body");
  }
}
