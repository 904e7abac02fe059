package io.volunteerhub.emails.trigger;

import io.volunteerhub.emails.config.EmailsProperties;
import io.volunteerhub.emails.context.ContextBuilder;
import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.context.EntityRef;
import io.volunteerhub.emails.exception.ResourceNotFoundException;
import io.volunteerhub.emails.scheduledemail.ScheduledEmail;
import io.volunteerhub.emails.workshop.Person;
import io.volunteerhub.emails.workshop.PersonRepository;
import io.volunteerhub.emails.workshop.TaskRole;
import io.volunteerhub.emails.workshop.Workshop;
import io.volunteerhub.emails.workshop.WorkshopRepository;
import io.volunteerhub.emails.workshop.WorkshopTaskRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Introduces the host of a centrally organised workshop to its instructors, at least a week before
 * the start. Subject: the workshop.
 */
@Component
public class HostInstructorsIntroductionTrigger implements EmailTrigger {

  private static final Logger log =
      LoggerFactory.getLogger(HostInstructorsIntroductionTrigger.class);
  private static final int MIN_DAYS_BEFORE_START = 7;
  private static final int MIN_INSTRUCTORS = 2;

  private final WorkshopRepository workshopRepository;
  private final WorkshopTaskRepository taskRepository;
  private final PersonRepository personRepository;
  private final EmailsProperties properties;

  public HostInstructorsIntroductionTrigger(
      WorkshopRepository workshopRepository,
      WorkshopTaskRepository taskRepository,
      PersonRepository personRepository,
      EmailsProperties properties) {
    this.workshopRepository = workshopRepository;
    this.taskRepository = taskRepository;
    this.personRepository = personRepository;
    this.properties = properties;
  }

  @Override
  public TriggerKind kind() {
    return TriggerKind.HOST_INSTRUCTORS_INTRODUCTION;
  }

  @Override
  public boolean shouldExist(UUID workshopId) {
    var workshop = workshopRepository.findById(workshopId).orElse(null);
    if (workshop == null) {
      log.debug("Evaluating {}: workshop={} does not exist", kind().key(), workshopId);
      return false;
    }
    var today = LocalDate.now(ZoneOffset.UTC);
    boolean centrallyOrganised = workshop.isCentrallyOrganised();
    boolean startsAtLeastWeekAhead =
        workshop.getStartDate() != null
            && !workshop.getStartDate().isBefore(today.plusDays(MIN_DAYS_BEFORE_START));
    boolean active = workshop.isActive();
    boolean hasHost = !taskRepository.findByWorkshopIdAndRole(workshopId, TaskRole.HOST).isEmpty();
    int instructors =
        taskRepository.findByWorkshopIdAndRole(workshopId, TaskRole.INSTRUCTOR).size();

    log.debug(
        "Evaluating {}: workshop={}, centrallyOrganised={}, startsAtLeastWeekAhead={}, active={},"
            + " hasHost={}, instructors={}",
        kind().key(),
        workshopId,
        centrallyOrganised,
        startsAtLeastWeekAhead,
        active,
        hasHost,
        instructors);
    return centrallyOrganised
        && startsAtLeastWeekAhead
        && active
        && hasHost
        && instructors >= MIN_INSTRUCTORS;
  }

  @Override
  public EmailAction buildAction(UUID workshopId, Optional<ScheduledEmail> existing) {
    var workshop =
        workshopRepository
            .findById(workshopId)
            .orElseThrow(() -> new ResourceNotFoundException("Workshop", workshopId));
    var host = peopleInRole(workshop, TaskRole.HOST).get(0);
    var instructors = peopleInRole(workshop, TaskRole.INSTRUCTOR);

    var context =
        ContextBuilder.create()
            .ref("workshop", EntityRef.of(EntityKind.WORKSHOP, workshop.getId()))
            .ref("host", Recipients.personRef(host))
            .refs("instructors", instructors.stream().map(Recipients::personRef).toList())
            .value("workshop_start", workshop.getStartDate())
            .build();

    var recipients = new ArrayList<Person>();
    recipients.add(host);
    recipients.addAll(instructors);

    return new EmailAction(
        existing
            .map(ScheduledEmail::getScheduledAt)
            .orElseGet(() -> Instant.now().plus(properties.immediateDelay())),
        context,
        Recipients.addressesOf(recipients),
        Recipients.linksOf(recipients));
  }

  private List<Person> peopleInRole(Workshop workshop, TaskRole role) {
    var personIds =
        taskRepository.findByWorkshopIdAndRole(workshop.getId(), role).stream()
            .map(task -> task.getPersonId())
            .toList();
    return personIds.stream()
        .map(
            id ->
                personRepository
                    .findById(id)
                    .orElseThrow(() -> new ResourceNotFoundException("Person", id)))
        .toList();
  }
}
