package io.volunteerhub.emails.emailtemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import io.volunteerhub.emails.TestcontainersConfiguration;
import io.volunteerhub.emails.context.ContextBuilder;
import io.volunteerhub.emails.context.DanglingReferenceException;
import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.context.EntityRef;
import io.volunteerhub.emails.context.RecipientLink;
import io.volunteerhub.emails.integration.storage.StorageService;
import io.volunteerhub.emails.scheduledemail.ScheduledEmail;
import io.volunteerhub.emails.scheduledemail.ScheduledEmailRepository;
import io.volunteerhub.emails.scheduledemail.ScheduledEmailStatus;
import io.volunteerhub.emails.scheduledemail.SubjectRef;
import io.volunteerhub.emails.trigger.TriggerKind;
import io.volunteerhub.emails.workshop.AwardService;
import io.volunteerhub.emails.workshop.PersonService;
import io.volunteerhub.emails.workshop.TaskRole;
import io.volunteerhub.emails.workshop.WorkshopService;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class ScheduledEmailRendererIntegrationTest {

  @MockitoBean private StorageService storageService;

  @Autowired private ScheduledEmailRenderer renderer;
  @Autowired private PersonService personService;
  @Autowired private AwardService awardService;
  @Autowired private WorkshopService workshopService;
  @Autowired private ScheduledEmailRepository scheduledEmailRepository;
  @Autowired private EmailTemplateRepository templateRepository;

  private final LocalDate today = LocalDate.now(ZoneOffset.UTC);

  @BeforeEach
  void stubStorage() {
    when(storageService.bucket()).thenReturn("test-bucket");
  }

  @Test
  void render_usesCurrentEntityValues() {
    var person = personService.create("Ada", "Lovelace", uniqueAddress("ada"));
    var award = awardService.grant(person.getId(), "instructor", today, null);
    var email = scheduledFor(TriggerKind.INSTRUCTOR_BADGE_AWARDED, award.getId());

    String newAddress = uniqueAddress("countess");
    personService.updateContact(person.getId(), "Augusta", "King", newAddress, null);

    var rendered = renderer.render(email);

    assertThat(rendered.subject())
        .isEqualTo("Congratulations Augusta King, you are now a certified instructor");
    assertThat(rendered.body())
        .startsWith("Dear Augusta,")
        .contains("awarded the instructor badge on " + today);
    assertThat(rendered.to()).containsExactly(newAddress);
    assertThat(rendered.from()).isEqualTo("team@volunteerhub.io");
    assertThat(rendered.replyTo()).isEqualTo("instructors@volunteerhub.io");
    assertThat(rendered.bcc()).isEmpty();
    assertThat(rendered.cc()).isEmpty();
  }

  @Test
  void render_expandsListsAndScalars() {
    var start = today.plusDays(21);
    var workshop =
        workshopService.create(
            "ws-" + UUID.randomUUID(),
            "Hall",
            start,
            start.plusDays(1),
            "central-org",
            List.of(),
            null);
    var host = personService.create("Hana", "Host", uniqueAddress("hana"));
    var first = personService.create("Ivan", "One", uniqueAddress("ivan"));
    var second = personService.create("Iris", "Two", uniqueAddress("iris"));
    workshopService.assign(workshop.getId(), host.getId(), TaskRole.HOST, null);
    workshopService.assign(workshop.getId(), first.getId(), TaskRole.INSTRUCTOR, null);
    workshopService.assign(workshop.getId(), second.getId(), TaskRole.INSTRUCTOR, null);
    var email = scheduledFor(TriggerKind.HOST_INSTRUCTORS_INTRODUCTION, workshop.getId());

    var rendered = renderer.render(email);

    assertThat(rendered.subject())
        .isEqualTo("Introductions for workshop " + workshop.getSlug() + " starting " + start);
    assertThat(rendered.body())
        .startsWith("Hi Hana,")
        .contains("instructors for the workshop at Hall:")
        .contains("- Ivan One <" + first.getEmail() + ">\n- Iris Two <" + second.getEmail() + ">")
        .contains("The workshop starts on " + start + ".");
  }

  @Test
  void render_failsOnDanglingReference() {
    var template =
        templateRepository.findByTriggerKind(TriggerKind.INSTRUCTOR_BADGE_AWARDED).orElseThrow();
    var missingPerson = EntityRef.of(EntityKind.PERSON, UUID.randomUUID());
    var email =
        scheduledEmailRepository.save(
            new ScheduledEmail(
                TriggerKind.INSTRUCTOR_BADGE_AWARDED,
                template.getId(),
                SubjectRef.of(EntityKind.AWARD, UUID.randomUUID()),
                Instant.now(),
                ContextBuilder.create().ref("person", missingPerson).build(),
                List.of("gone@example.org"),
                List.of(RecipientLink.ofProperty(missingPerson, "email").toMap()),
                null));

    assertThatThrownBy(() -> renderer.render(email))
        .isInstanceOfSatisfying(
            DanglingReferenceException.class,
            e -> assertThat(e.getUri()).isEqualTo(missingPerson.uri()));
  }

  @Test
  void renderText_reportsTemplateErrors() {
    assertThatThrownBy(() -> renderer.renderText("[(${missing.value})]", Map.of()))
        .isInstanceOf(TemplateRenderingException.class);
  }

  private ScheduledEmail scheduledFor(TriggerKind trigger, UUID subjectId) {
    return scheduledEmailRepository
        .findByTriggerAndSubjectAndState(
            trigger, trigger.subjectKind(), subjectId, ScheduledEmailStatus.SCHEDULED)
        .get(0);
  }

  private static String uniqueAddress(String name) {
    return name + "-" + UUID.randomUUID() + "@example.org";
  }
}
