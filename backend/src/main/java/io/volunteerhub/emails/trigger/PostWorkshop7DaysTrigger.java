package io.volunteerhub.emails.trigger;

import io.volunteerhub.emails.context.ContextBuilder;
import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.context.EntityRef;
import io.volunteerhub.emails.exception.ResourceNotFoundException;
import io.volunteerhub.emails.scheduledemail.ScheduledEmail;
import io.volunteerhub.emails.workshop.Person;
import io.volunteerhub.emails.workshop.PersonRepository;
import io.volunteerhub.emails.workshop.TaskRole;
import io.volunteerhub.emails.workshop.WorkshopRepository;
import io.volunteerhub.emails.workshop.WorkshopTaskRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Follow-up to hosts and instructors a week after a workshop ends, sent at noon UTC. Subject: the
 * workshop. The email stays editable until the send date passes.
 */
@Component
public class PostWorkshop7DaysTrigger implements EmailTrigger {

  private static final Logger log = LoggerFactory.getLogger(PostWorkshop7DaysTrigger.class);
  private static final int DAYS_AFTER_END = 7;
  private static final LocalTime SEND_TIME = LocalTime.NOON;

  private final WorkshopRepository workshopRepository;
  private final WorkshopTaskRepository taskRepository;
  private final PersonRepository personRepository;

  public PostWorkshop7DaysTrigger(
      WorkshopRepository workshopRepository,
      WorkshopTaskRepository taskRepository,
      PersonRepository personRepository) {
    this.workshopRepository = workshopRepository;
    this.taskRepository = taskRepository;
    this.personRepository = personRepository;
  }

  @Override
  public TriggerKind kind() {
    return TriggerKind.POST_WORKSHOP_7DAYS;
  }

  @Override
  public boolean shouldExist(UUID workshopId) {
    var workshop = workshopRepository.findById(workshopId).orElse(null);
    if (workshop == null) {
      log.debug("Evaluating {}: workshop={} does not exist", kind().key(), workshopId);
      return false;
    }
    var today = LocalDate.now(ZoneOffset.UTC);
    boolean administered = workshop.hasAdministrator();
    boolean notCommunityLesson = !workshop.isCommunityLesson();
    boolean followUpNotPast =
        workshop.getEndDate() != null
            && !workshop.getEndDate().plusDays(DAYS_AFTER_END).isBefore(today);
    boolean active = workshop.isActive();
    boolean hasHost = !taskRepository.findByWorkshopIdAndRole(workshopId, TaskRole.HOST).isEmpty();
    boolean hasInstructor =
        !taskRepository.findByWorkshopIdAndRole(workshopId, TaskRole.INSTRUCTOR).isEmpty();

    log.debug(
        "Evaluating {}: workshop={}, administered={}, notCommunityLesson={}, followUpNotPast={},"
            + " active={}, hasHost={}, hasInstructor={}",
        kind().key(),
        workshopId,
        administered,
        notCommunityLesson,
        followUpNotPast,
        active,
        hasHost,
        hasInstructor);
    return administered
        && notCommunityLesson
        && followUpNotPast
        && active
        && hasHost
        && hasInstructor;
  }

  @Override
  public EmailAction buildAction(UUID workshopId, Optional<ScheduledEmail> existing) {
    var workshop =
        workshopRepository
            .findById(workshopId)
            .orElseThrow(() -> new ResourceNotFoundException("Workshop", workshopId));
    var hosts = peopleInRole(workshopId, TaskRole.HOST);
    var instructors = peopleInRole(workshopId, TaskRole.INSTRUCTOR);

    var context =
        ContextBuilder.create()
            .ref("workshop", EntityRef.of(EntityKind.WORKSHOP, workshop.getId()))
            .refs("hosts", hosts.stream().map(Recipients::personRef).toList())
            .refs("instructors", instructors.stream().map(Recipients::personRef).toList())
            .build();

    var recipients = new ArrayList<Person>(hosts);
    recipients.addAll(instructors);

    return new EmailAction(
        sendTimeFor(workshop.getEndDate()),
        context,
        Recipients.addressesOf(recipients),
        Recipients.linksOf(recipients));
  }

  static Instant sendTimeFor(LocalDate endDate) {
    return endDate.plusDays(DAYS_AFTER_END).atTime(SEND_TIME).toInstant(ZoneOffset.UTC);
  }

  private List<Person> peopleInRole(UUID workshopId, TaskRole role) {
    return taskRepository.findByWorkshopIdAndRole(workshopId, role).stream()
        .map(
            task ->
                personRepository
                    .findById(task.getPersonId())
                    .orElseThrow(
                        () -> new ResourceNotFoundException("Person", task.getPersonId())))
        .toList();
  }
}
