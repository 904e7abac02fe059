package io.volunteerhub.emails.scheduledemail;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.volunteerhub.emails.TestcontainersConfiguration;
import io.volunteerhub.emails.integration.storage.StorageService;
import io.volunteerhub.emails.trigger.TriggerKind;
import io.volunteerhub.emails.workshop.AwardService;
import io.volunteerhub.emails.workshop.PersonService;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class ScheduledEmailWorkerControllerTest {

  private static final String API_KEY_HEADER = "X-API-KEY";
  private static final String API_KEY = "test-api-key";

  @MockitoBean private StorageService storageService;

  @Autowired private MockMvc mockMvc;
  @Autowired private PersonService personService;
  @Autowired private AwardService awardService;
  @Autowired private ScheduledEmailRepository scheduledEmailRepository;

  private UUID emailId;
  private String recipient;

  @BeforeEach
  void setUp() {
    when(storageService.bucket()).thenReturn("test-bucket");
    recipient = "worker-api-" + UUID.randomUUID() + "@example.org";
    var person = personService.create("Wanda", "Worker", recipient);
    var award = awardService.grant(person.getId(), "instructor", LocalDate.now(), null);
    emailId =
        scheduledEmailRepository
            .findByTriggerAndSubjectAndState(
                TriggerKind.INSTRUCTOR_BADGE_AWARDED,
                TriggerKind.INSTRUCTOR_BADGE_AWARDED.subjectKind(),
                award.getId(),
                ScheduledEmailStatus.SCHEDULED)
            .get(0)
            .getId();
  }

  @Test
  void requestsWithoutApiKeyAreRejected() throws Exception {
    mockMvc.perform(get("/api/jobs")).andExpect(status().isUnauthorized());
    mockMvc
        .perform(get("/api/jobs").header(API_KEY_HEADER, "wrong-key"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void healthIsPublic() throws Exception {
    mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
  }

  @Test
  void getReturnsStoredEmail() throws Exception {
    mockMvc
        .perform(get("/api/jobs/" + emailId).header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(emailId.toString()))
        .andExpect(jsonPath("$.trigger").value("instructor-badge-awarded"))
        .andExpect(jsonPath("$.state").value("SCHEDULED"))
        .andExpect(jsonPath("$.subjectKind").value("award"))
        .andExpect(jsonPath("$.toHeader[0]").value(recipient));
  }

  @Test
  void getUnknownEmailIsNotFound() throws Exception {
    mockMvc
        .perform(get("/api/jobs/" + UUID.randomUUID()).header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("ScheduledEmail not found"));
  }

  @Test
  void listByStateIncludesEmail() throws Exception {
    mockMvc
        .perform(
            get("/api/jobs")
                .param("state", "SCHEDULED")
                .param("size", "100")
                .header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content[*].id", hasItem(emailId.toString())));
  }

  @Test
  void listEligibleExcludesFutureEmails() throws Exception {
    mockMvc
        .perform(
            get("/api/jobs")
                .param("eligible", "true")
                .param("size", "100")
                .header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content[*].id", not(hasItem(emailId.toString()))));
  }

  @Test
  void lockTwiceReturnsConflict() throws Exception {
    mockMvc
        .perform(
            post("/api/jobs/" + emailId + "/lock")
                .header(API_KEY_HEADER, API_KEY)
                .header("X-WORKER-ID", UUID.randomUUID().toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("LOCKED"));

    mockMvc
        .perform(post("/api/jobs/" + emailId + "/lock").header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.reason").value("lock_conflict"))
        .andExpect(jsonPath("$.state").value("LOCKED"));
  }

  @Test
  void lockUnknownEmailIsNotFound() throws Exception {
    mockMvc
        .perform(post("/api/jobs/" + UUID.randomUUID() + "/lock").header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isNotFound());
  }

  @Test
  void failThenSucceedAfterRelock() throws Exception {
    mockMvc
        .perform(post("/api/jobs/" + emailId + "/lock").header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isOk());
    mockMvc
        .perform(
            post("/api/jobs/" + emailId + "/fail")
                .header(API_KEY_HEADER, API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"details\": \"Mailbox unavailable\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("FAILED"));

    mockMvc
        .perform(post("/api/jobs/" + emailId + "/lock").header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isOk());
    mockMvc
        .perform(post("/api/jobs/" + emailId + "/succeed").header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("SUCCEEDED"));

    mockMvc
        .perform(get("/api/jobs/" + emailId + "/logs").header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(5))
        .andExpect(jsonPath("$[0].stateBefore").doesNotExist())
        .andExpect(jsonPath("$[2].stateAfter").value("FAILED"))
        .andExpect(jsonPath("$[2].details").value("Mailbox unavailable"))
        .andExpect(jsonPath("$[4].stateAfter").value("SUCCEEDED"));
  }

  @Test
  void succeedWithoutLockIsInvalidState() throws Exception {
    mockMvc
        .perform(post("/api/jobs/" + emailId + "/succeed").header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.reason").value("invalid_state"));
  }

  @Test
  void renderedReturnsResolvedEmail() throws Exception {
    mockMvc
        .perform(get("/api/jobs/" + emailId + "/rendered").header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.scheduledEmailId").value(emailId.toString()))
        .andExpect(
            jsonPath("$.subject")
                .value("Congratulations Wanda Worker, you are now a certified instructor"))
        .andExpect(jsonPath("$.to[0]").value(recipient))
        .andExpect(jsonPath("$.attachments").isArray());
  }

  @Test
  void staleLocksRejectsNegativeThreshold() throws Exception {
    mockMvc
        .perform(
            get("/api/jobs/stale-locks")
                .param("olderThanMinutes", "-5")
                .header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isBadRequest());
  }

  @Test
  void staleLocksRejectsThresholdBeyondLimit() throws Exception {
    mockMvc
        .perform(
            get("/api/jobs/stale-locks")
                .param("olderThanMinutes", String.valueOf(Long.MAX_VALUE))
                .header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isBadRequest());
  }

  @Test
  void cancelStopsScheduledEmail() throws Exception {
    mockMvc
        .perform(
            post("/api/jobs/" + emailId + "/cancel")
                .header(API_KEY_HEADER, API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"details": "Workshop postponed"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("CANCELLED"));

    mockMvc
        .perform(get("/api/jobs/" + emailId + "/logs").header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[1].stateAfter").value("CANCELLED"))
        .andExpect(jsonPath("$[1].details").value("Workshop postponed"));

    mockMvc
        .perform(post("/api/jobs/" + emailId + "/lock").header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.reason").value("lock_conflict"));
  }

  @Test
  void cancelTwiceIsInvalidState() throws Exception {
    mockMvc
        .perform(post("/api/jobs/" + emailId + "/cancel").header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isOk());

    mockMvc
        .perform(post("/api/jobs/" + emailId + "/cancel").header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.reason").value("invalid_state"));
  }

  @Test
  void rescheduleMovesSendTime() throws Exception {
    mockMvc
        .perform(
            post("/api/jobs/" + emailId + "/reschedule")
                .header(API_KEY_HEADER, API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"scheduledAt": "2031-03-01T10:00:00Z", "details": "Host on leave"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("SCHEDULED"))
        .andExpect(jsonPath("$.scheduledAt").value("2031-03-01T10:00:00Z"));
  }

  @Test
  void rescheduleWithoutTimeIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/jobs/" + emailId + "/reschedule")
                .header(API_KEY_HEADER, API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void invalidStateFilterIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/jobs").param("state", "SENT").header(API_KEY_HEADER, API_KEY))
        .andExpect(status().isBadRequest());
  }
}
