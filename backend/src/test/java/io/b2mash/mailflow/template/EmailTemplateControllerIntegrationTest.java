package io.b2mash.mailflow.template;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.mailflow.TestcontainersConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class EmailTemplateControllerIntegrationTest {

  private static final String API_KEY = "test-api-key";
  private static final String BASE_URL = "/api/email/templates";

  @Autowired private MockMvc mockMvc;

  @Test
  void create_returns_201_with_location_and_defaults() throws Exception {
    createTemplate("admin-created", "Hello [(${name})]")
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", BASE_URL + "/admin-created"))
        .andExpect(jsonPath("$.key").value("admin-created"))
        .andExpect(jsonPath("$.category").value("general"))
        .andExpect(jsonPath("$.language").value("en"))
        .andExpect(jsonPath("$.active").value(true));

    mockMvc
        .perform(get(BASE_URL + "/admin-created").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subjectTemplate").value("Hello [(${name})]"));
  }

  @Test
  void duplicate_key_returns_409() throws Exception {
    createTemplate("admin-duplicate", "One").andExpect(status().isCreated());

    createTemplate("admin-duplicate", "Two").andExpect(status().isConflict());
  }

  @Test
  void invalid_key_returns_400() throws Exception {
    createTemplate("Not A Slug", "Hi").andExpect(status().isBadRequest());
  }

  @Test
  void malformed_expression_syntax_returns_422() throws Exception {
    createTemplate("admin-broken", "Hello [(${name)]").andExpect(status().isUnprocessableEntity());

    mockMvc
        .perform(get(BASE_URL + "/admin-broken").header("X-API-KEY", API_KEY))
        .andExpect(status().isNotFound());
  }

  @Test
  void preview_renders_with_sample_context() throws Exception {
    createTemplate("admin-preview", "Hi [(${name} ?: 'there')]")
        .andExpect(status().isCreated());

    mockMvc
        .perform(
            post(BASE_URL + "/admin-preview/preview")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"context": {"name": "Dee"}}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subject").value("Hi Dee"))
        .andExpect(jsonPath("$.textBody").value("Sent by Mailflow Test"));

    mockMvc
        .perform(post(BASE_URL + "/admin-preview/preview").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subject").value("Hi there"));
  }

  @Test
  void update_changes_subsequent_renders() throws Exception {
    createTemplate("admin-update", "Old subject").andExpect(status().isCreated());

    mockMvc
        .perform(
            put(BASE_URL + "/admin-update")
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Updated", "subjectTemplate": "New subject",
                     "htmlTemplate": "<p>new</p>", "textTemplate": "new"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subjectTemplate").value("New subject"))
        .andExpect(jsonPath("$.category").value("general"));

    mockMvc
        .perform(post(BASE_URL + "/admin-update/preview").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subject").value("New subject"));
  }

  @Test
  void deactivated_template_cannot_be_sent_until_reactivated() throws Exception {
    createTemplate("admin-toggle", "Toggle").andExpect(status().isCreated());

    mockMvc
        .perform(post(BASE_URL + "/admin-toggle/deactivate").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(false));
    testSend("admin-toggle").andExpect(status().isNotFound());

    mockMvc
        .perform(post(BASE_URL + "/admin-toggle/reactivate").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(true));
    testSend("admin-toggle")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("SENT"))
        .andExpect(jsonPath("$.initiatedBy").value("admin:test-send"));
  }

  @Test
  void list_filters_by_category() throws Exception {
    createTemplate("admin-listed", "Listed").andExpect(status().isCreated());

    mockMvc
        .perform(get(BASE_URL).param("category", "general").header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.key == 'admin-listed')]").exists());
  }

  @Test
  void unknown_template_returns_404() throws Exception {
    mockMvc
        .perform(get(BASE_URL + "/does-not-exist").header("X-API-KEY", API_KEY))
        .andExpect(status().isNotFound());
  }

  @Test
  void admin_endpoints_require_api_key() throws Exception {
    mockMvc.perform(get(BASE_URL)).andExpect(status().isUnauthorized());
    mockMvc
        .perform(get(BASE_URL).header("X-API-KEY", "wrong-key"))
        .andExpect(status().isUnauthorized());
  }

  private ResultActions createTemplate(String key, String subject) throws Exception {
    return mockMvc.perform(
        post(BASE_URL)
            .header("X-API-KEY", API_KEY)
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                """
                {"key": "%s", "name": "Admin template", "subjectTemplate": "%s",
                 "htmlTemplate": "<p>Sent by [[${site_name}]]</p>",
                 "textTemplate": "Sent by [(${site_name})]"}
                """
                    .formatted(key, subject.replace("\"", "\\\""))));
  }

  private ResultActions testSend(String key) throws Exception {
    return mockMvc.perform(
        post(BASE_URL + "/" + key + "/test-send")
            .header("X-API-KEY", API_KEY)
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                """
                {"toAddress": "admin@example.com"}
                """));
  }
}
