package io.volunteerhub.emails.trigger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.volunteerhub.emails.config.EmailsProperties;
import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.scheduledemail.ScheduledEmail;
import io.volunteerhub.emails.scheduledemail.SubjectRef;
import io.volunteerhub.emails.workshop.Person;
import io.volunteerhub.emails.workshop.PersonRepository;
import io.volunteerhub.emails.workshop.TaskRole;
import io.volunteerhub.emails.workshop.Workshop;
import io.volunteerhub.emails.workshop.WorkshopRepository;
import io.volunteerhub.emails.workshop.WorkshopTask;
import io.volunteerhub.emails.workshop.WorkshopTaskRepository;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class InstructorTaskCreatedForWorkshopTriggerTest {

  private static final UUID TASK_ID = UUID.randomUUID();
  private static final UUID WORKSHOP_ID = UUID.randomUUID();
  private static final UUID PERSON_ID = UUID.randomUUID();

  @Mock private WorkshopTaskRepository taskRepository;
  @Mock private WorkshopRepository workshopRepository;
  @Mock private PersonRepository personRepository;

  private InstructorTaskCreatedForWorkshopTrigger trigger;
  private final LocalDate today = LocalDate.now(ZoneOffset.UTC);

  @BeforeEach
  void setUp() {
    var properties =
        new EmailsProperties(Duration.ofHours(1), 100, Duration.ofDays(7), "Director");
    trigger =
        new InstructorTaskCreatedForWorkshopTrigger(
            taskRepository, workshopRepository, personRepository, properties);
  }

  @Test
  void shouldExist_forInstructorOfUpcomingCentralWorkshop() {
    mockTask(TaskRole.INSTRUCTOR);
    mockPerson("instructor@example.org");
    mockWorkshop("central-org", today.plusDays(1), List.of());

    assertThat(trigger.shouldExist(TASK_ID)).isTrue();
  }

  @Test
  void shouldExist_falseForHostRole() {
    mockTask(TaskRole.HOST);
    mockPerson("host@example.org");
    mockWorkshop("central-org", today.plusDays(1), List.of());

    assertThat(trigger.shouldExist(TASK_ID)).isFalse();
  }

  @Test
  void shouldExist_falseWhenPersonHasNoEmail() {
    mockTask(TaskRole.INSTRUCTOR);
    mockPerson(null);
    mockWorkshop("central-org", today.plusDays(1), List.of());

    assertThat(trigger.shouldExist(TASK_ID)).isFalse();
  }

  @Test
  void shouldExist_falseForSelfOrganisedWorkshop() {
    mockTask(TaskRole.INSTRUCTOR);
    mockPerson("instructor@example.org");
    mockWorkshop(Workshop.SELF_ORGANIZED_DOMAIN, today.plusDays(1), List.of());

    assertThat(trigger.shouldExist(TASK_ID)).isFalse();
  }

  @Test
  void shouldExist_falseForPastWorkshop() {
    mockTask(TaskRole.INSTRUCTOR);
    mockPerson("instructor@example.org");
    mockWorkshop("central-org", today.minusDays(1), List.of());

    assertThat(trigger.shouldExist(TASK_ID)).isFalse();
  }

  @Test
  void shouldExist_falseForCancelledWorkshop() {
    mockTask(TaskRole.INSTRUCTOR);
    mockPerson("instructor@example.org");
    mockWorkshop("central-org", today.plusDays(1), List.of("cancelled"));

    assertThat(trigger.shouldExist(TASK_ID)).isFalse();
  }

  @Test
  void shouldExist_falseForDeletedTask() {
    when(taskRepository.findById(TASK_ID)).thenReturn(Optional.empty());

    assertThat(trigger.shouldExist(TASK_ID)).isFalse();
  }

  @Test
  void buildAction_schedulesAnHourAheadForNewEmail() {
    mockTask(TaskRole.INSTRUCTOR);
    mockPerson("instructor@example.org");
    var before = Instant.now();

    var action = trigger.buildAction(TASK_ID, Optional.empty());

    assertThat(action.scheduledAt())
        .isBetween(before.plus(Duration.ofHours(1)), Instant.now().plus(Duration.ofHours(1)));
    assertThat(action.context())
        .containsEntry("person", "ref:person#" + PERSON_ID)
        .containsEntry("workshop", "ref:workshop#" + WORKSHOP_ID)
        .containsEntry("task", "ref:task#" + TASK_ID);
    assertThat(action.recipients()).containsExactly("instructor@example.org");
  }

  @Test
  void buildAction_keepsStoredScheduleWhenRevising() {
    mockTask(TaskRole.INSTRUCTOR);
    mockPerson("instructor@example.org");
    var stored = Instant.now().plus(Duration.ofMinutes(10)).truncatedTo(ChronoUnit.MILLIS);
    var existing =
        new ScheduledEmail(
            TriggerKind.INSTRUCTOR_TASK_CREATED_FOR_WORKSHOP,
            UUID.randomUUID(),
            SubjectRef.of(EntityKind.TASK, TASK_ID),
            stored,
            Map.of(),
            List.of("old@example.org"),
            List.of(),
            null);

    var action = trigger.buildAction(TASK_ID, Optional.of(existing));

    assertThat(action.scheduledAt()).isEqualTo(stored);
  }

  private void mockTask(TaskRole role) {
    var task = new WorkshopTask(WORKSHOP_ID, PERSON_ID, role);
    ReflectionTestUtils.setField(task, "id", TASK_ID);
    when(taskRepository.findById(TASK_ID)).thenReturn(Optional.of(task));
  }

  private void mockPerson(String email) {
    var person = new Person("Ada", "Lovelace", email);
    ReflectionTestUtils.setField(person, "id", PERSON_ID);
    when(personRepository.findById(PERSON_ID)).thenReturn(Optional.of(person));
  }

  private void mockWorkshop(String administrator, LocalDate startDate, List<String> tags) {
    var workshop =
        new Workshop(
            "ws-" + WORKSHOP_ID, "Library", startDate, startDate.plusDays(1), administrator, tags);
    ReflectionTestUtils.setField(workshop, "id", WORKSHOP_ID);
    when(workshopRepository.findById(WORKSHOP_ID)).thenReturn(Optional.of(workshop));
  }
}
