package io.volunteerhub.emails.trigger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.volunteerhub.emails.config.EmailsProperties;
import io.volunteerhub.emails.workshop.PersonRepository;
import io.volunteerhub.emails.workshop.TaskRole;
import io.volunteerhub.emails.workshop.Workshop;
import io.volunteerhub.emails.workshop.WorkshopRepository;
import io.volunteerhub.emails.workshop.WorkshopTask;
import io.volunteerhub.emails.workshop.WorkshopTaskRepository;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HostInstructorsIntroductionTriggerTest {

  private static final UUID WORKSHOP_ID = UUID.randomUUID();

  @Mock private WorkshopRepository workshopRepository;
  @Mock private WorkshopTaskRepository taskRepository;
  @Mock private PersonRepository personRepository;

  private HostInstructorsIntroductionTrigger trigger;
  private final LocalDate today = LocalDate.now(ZoneOffset.UTC);

  @BeforeEach
  void setUp() {
    var properties =
        new EmailsProperties(Duration.ofHours(1), 100, Duration.ofDays(7), "Director");
    trigger =
        new HostInstructorsIntroductionTrigger(
            workshopRepository, taskRepository, personRepository, properties);
  }

  @Test
  void shouldExist_exactlyOneWeekAhead() {
    mockWorkshop("central-org", today.plusDays(7), List.of());
    mockTasks(1, 2);

    assertThat(trigger.shouldExist(WORKSHOP_ID)).isTrue();
  }

  @Test
  void shouldExist_falseWhenStartingSooner() {
    mockWorkshop("central-org", today.plusDays(6), List.of());
    mockTasks(1, 2);

    assertThat(trigger.shouldExist(WORKSHOP_ID)).isFalse();
  }

  @Test
  void shouldExist_falseWithSingleInstructor() {
    mockWorkshop("central-org", today.plusDays(30), List.of());
    mockTasks(1, 1);

    assertThat(trigger.shouldExist(WORKSHOP_ID)).isFalse();
  }

  @Test
  void shouldExist_falseWithoutHost() {
    mockWorkshop("central-org", today.plusDays(30), List.of());
    mockTasks(0, 3);

    assertThat(trigger.shouldExist(WORKSHOP_ID)).isFalse();
  }

  @Test
  void shouldExist_falseForSelfOrganisedWorkshop() {
    mockWorkshop(Workshop.SELF_ORGANIZED_DOMAIN, today.plusDays(30), List.of());
    mockTasks(1, 2);

    assertThat(trigger.shouldExist(WORKSHOP_ID)).isFalse();
  }

  @Test
  void shouldExist_falseForUnresponsiveWorkshop() {
    mockWorkshop("central-org", today.plusDays(30), List.of("unresponsive"));
    mockTasks(1, 2);

    assertThat(trigger.shouldExist(WORKSHOP_ID)).isFalse();
  }

  private void mockWorkshop(String administrator, LocalDate startDate, List<String> tags) {
    var workshop =
        new Workshop(
            "ws-intro", "Town hall", startDate, startDate.plusDays(1), administrator, tags);
    when(workshopRepository.findById(WORKSHOP_ID)).thenReturn(Optional.of(workshop));
  }

  private void mockTasks(int hosts, int instructors) {
    when(taskRepository.findByWorkshopIdAndRole(WORKSHOP_ID, TaskRole.HOST))
        .thenReturn(tasks(hosts, TaskRole.HOST));
    when(taskRepository.findByWorkshopIdAndRole(WORKSHOP_ID, TaskRole.INSTRUCTOR))
        .thenReturn(tasks(instructors, TaskRole.INSTRUCTOR));
  }

  private static List<WorkshopTask> tasks(int count, TaskRole role) {
    return IntStream.range(0, count)
        .mapToObj(i -> new WorkshopTask(WORKSHOP_ID, UUID.randomUUID(), role))
        .toList();
  }
}
