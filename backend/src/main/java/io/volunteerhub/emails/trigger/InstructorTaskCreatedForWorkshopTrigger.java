package io.volunteerhub.emails.trigger;

import io.volunteerhub.emails.config.EmailsProperties;
import io.volunteerhub.emails.context.ContextBuilder;
import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.context.EntityRef;
import io.volunteerhub.emails.exception.ResourceNotFoundException;
import io.volunteerhub.emails.scheduledemail.ScheduledEmail;
import io.volunteerhub.emails.workshop.PersonRepository;
import io.volunteerhub.emails.workshop.TaskRole;
import io.volunteerhub.emails.workshop.WorkshopRepository;
import io.volunteerhub.emails.workshop.WorkshopTaskRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Confirms an instructor's assignment to an upcoming workshop. Subject: the task. */
@Component
public class InstructorTaskCreatedForWorkshopTrigger implements EmailTrigger {

  private static final Logger log =
      LoggerFactory.getLogger(InstructorTaskCreatedForWorkshopTrigger.class);

  private final WorkshopTaskRepository taskRepository;
  private final WorkshopRepository workshopRepository;
  private final PersonRepository personRepository;
  private final EmailsProperties properties;

  public InstructorTaskCreatedForWorkshopTrigger(
      WorkshopTaskRepository taskRepository,
      WorkshopRepository workshopRepository,
      PersonRepository personRepository,
      EmailsProperties properties) {
    this.taskRepository = taskRepository;
    this.workshopRepository = workshopRepository;
    this.personRepository = personRepository;
    this.properties = properties;
  }

  @Override
  public TriggerKind kind() {
    return TriggerKind.INSTRUCTOR_TASK_CREATED_FOR_WORKSHOP;
  }

  @Override
  public boolean shouldExist(UUID taskId) {
    var task = taskRepository.findById(taskId).orElse(null);
    if (task == null) {
      log.debug("Evaluating {}: task={} does not exist", kind().key(), taskId);
      return false;
    }
    var person = personRepository.findById(task.getPersonId()).orElse(null);
    var workshop = workshopRepository.findById(task.getWorkshopId()).orElse(null);
    var today = LocalDate.now(ZoneOffset.UTC);

    boolean instructorRole = task.getRole() == TaskRole.INSTRUCTOR;
    boolean personHasEmail = person != null && person.hasEmail();
    boolean centrallyOrganised = workshop != null && workshop.isCentrallyOrganised();
    boolean startsTodayOrLater =
        workshop != null
            && workshop.getStartDate() != null
            && !workshop.getStartDate().isBefore(today);
    boolean active = workshop != null && workshop.isActive();

    log.debug(
        "Evaluating {}: task={}, instructorRole={}, personHasEmail={}, centrallyOrganised={},"
            + " startsTodayOrLater={}, active={}",
        kind().key(),
        taskId,
        instructorRole,
        personHasEmail,
        centrallyOrganised,
        startsTodayOrLater,
        active);
    return instructorRole && personHasEmail && centrallyOrganised && startsTodayOrLater && active;
  }

  @Override
  public EmailAction buildAction(UUID taskId, Optional<ScheduledEmail> existing) {
    var task =
        taskRepository
            .findById(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("WorkshopTask", taskId));
    var person =
        personRepository
            .findById(task.getPersonId())
            .orElseThrow(() -> new ResourceNotFoundException("Person", task.getPersonId()));

    var context =
        ContextBuilder.create()
            .ref("person", Recipients.personRef(person))
            .ref("workshop", EntityRef.of(EntityKind.WORKSHOP, task.getWorkshopId()))
            .ref("task", EntityRef.of(EntityKind.TASK, task.getId()))
            .build();

    return new EmailAction(
        existing
            .map(ScheduledEmail::getScheduledAt)
            .orElseGet(() -> Instant.now().plus(properties.immediateDelay())),
        context,
        Recipients.addressesOf(List.of(person)),
        Recipients.linksOf(List.of(person)));
  }
}
