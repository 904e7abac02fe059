package io.volunteerhub.emails.workshop;

import io.volunteerhub.emails.event.WorkshopChangedEvent;
import io.volunteerhub.emails.event.WorkshopTaskChangedEvent;
import io.volunteerhub.emails.exception.ResourceNotFoundException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Mutations of workshops and their task assignments. Every change publishes a domain event. */
@Service
public class WorkshopService {

  private static final Logger log = LoggerFactory.getLogger(WorkshopService.class);

  private final WorkshopRepository workshopRepository;
  private final WorkshopTaskRepository taskRepository;
  private final PersonRepository personRepository;
  private final ApplicationEventPublisher eventPublisher;

  public WorkshopService(
      WorkshopRepository workshopRepository,
      WorkshopTaskRepository taskRepository,
      PersonRepository personRepository,
      ApplicationEventPublisher eventPublisher) {
    this.workshopRepository = workshopRepository;
    this.taskRepository = taskRepository;
    this.personRepository = personRepository;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public Workshop create(
      String slug,
      String venue,
      LocalDate startDate,
      LocalDate endDate,
      String administratorDomain,
      List<String> tags,
      UUID actorId) {
    var workshop =
        workshopRepository.save(
            new Workshop(slug, venue, startDate, endDate, administratorDomain, tags));

    log.info("Created workshop: id={}, slug={}", workshop.getId(), slug);

    publishWorkshopChanged(workshop.getId(), actorId);
    return workshop;
  }

  @Transactional
  public Workshop update(
      UUID workshopId,
      LocalDate startDate,
      LocalDate endDate,
      String administratorDomain,
      List<String> tags,
      UUID actorId) {
    var workshop = findWorkshop(workshopId);

    workshop.reschedule(startDate, endDate);
    workshop.changeAdministrator(administratorDomain);
    workshop.replaceTags(tags);
    workshop = workshopRepository.save(workshop);

    log.info(
        "Updated workshop: id={}, start={}, end={}, administrator={}, tags={}",
        workshop.getId(),
        startDate,
        endDate,
        administratorDomain,
        tags);

    publishWorkshopChanged(workshop.getId(), actorId);
    return workshop;
  }

  @Transactional
  public WorkshopTask assign(UUID workshopId, UUID personId, TaskRole role, UUID actorId) {
    findWorkshop(workshopId);
    if (!personRepository.existsById(personId)) {
      throw new ResourceNotFoundException("Person", personId);
    }
    var task = taskRepository.save(new WorkshopTask(workshopId, personId, role));

    log.info(
        "Assigned person to workshop: task={}, workshop={}, person={}, role={}",
        task.getId(),
        workshopId,
        personId,
        role.key());

    eventPublisher.publishEvent(
        new WorkshopTaskChangedEvent(
            task.getId(), workshopId, personId, false, actorId, Instant.now()));
    return task;
  }

  @Transactional
  public WorkshopTask changeRole(UUID taskId, TaskRole role, UUID actorId) {
    var task =
        taskRepository
            .findById(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("WorkshopTask", taskId));

    task.changeRole(role);
    task = taskRepository.save(task);

    log.info("Changed task role: task={}, role={}", task.getId(), role.key());

    eventPublisher.publishEvent(
        new WorkshopTaskChangedEvent(
            task.getId(), task.getWorkshopId(), task.getPersonId(), false, actorId, Instant.now()));
    return task;
  }

  @Transactional
  public void removeTask(UUID taskId, UUID actorId) {
    var task =
        taskRepository
            .findById(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("WorkshopTask", taskId));

    taskRepository.delete(task);

    log.info(
        "Removed person from workshop: task={}, workshop={}, person={}",
        task.getId(),
        task.getWorkshopId(),
        task.getPersonId());

    eventPublisher.publishEvent(
        new WorkshopTaskChangedEvent(
            task.getId(), task.getWorkshopId(), task.getPersonId(), true, actorId, Instant.now()));
  }

  private Workshop findWorkshop(UUID workshopId) {
    return workshopRepository
        .findById(workshopId)
        .orElseThrow(() -> new ResourceNotFoundException("Workshop", workshopId));
  }

  private void publishWorkshopChanged(UUID workshopId, UUID actorId) {
    eventPublisher.publishEvent(new WorkshopChangedEvent(workshopId, actorId, Instant.now()));
  }
}
