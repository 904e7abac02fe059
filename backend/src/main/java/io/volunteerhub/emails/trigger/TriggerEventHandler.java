package io.volunteerhub.emails.trigger;

import io.volunteerhub.emails.event.AwardGrantedEvent;
import io.volunteerhub.emails.event.AwardRevokedEvent;
import io.volunteerhub.emails.event.DomainEvent;
import io.volunteerhub.emails.event.PersonUpdatedEvent;
import io.volunteerhub.emails.event.WorkshopChangedEvent;
import io.volunteerhub.emails.event.WorkshopTaskChangedEvent;
import io.volunteerhub.emails.workshop.Award;
import io.volunteerhub.emails.workshop.AwardRepository;
import io.volunteerhub.emails.workshop.WorkshopTask;
import io.volunteerhub.emails.workshop.WorkshopTaskRepository;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Maps domain events to the triggers they can affect and runs each one. All handlers run
 * AFTER_COMMIT, each trigger in its own new transaction, so that:
 *
 * <ol>
 *   <li>Triggers only see committed domain changes.
 *   <li>A failing trigger neither affects the domain transaction nor the other triggers.
 * </ol>
 */
@Component
public class TriggerEventHandler {

  private static final Logger log = LoggerFactory.getLogger(TriggerEventHandler.class);

  private final EmailTriggerService triggerService;
  private final AwardRepository awardRepository;
  private final WorkshopTaskRepository taskRepository;
  private final TransactionTemplate transactionTemplate;

  public TriggerEventHandler(
      EmailTriggerService triggerService,
      AwardRepository awardRepository,
      WorkshopTaskRepository taskRepository,
      PlatformTransactionManager transactionManager) {
    this.triggerService = triggerService;
    this.awardRepository = awardRepository;
    this.taskRepository = taskRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onAwardGranted(AwardGrantedEvent event) {
    runTrigger(event, TriggerKind.INSTRUCTOR_BADGE_AWARDED, event.entityId());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onAwardRevoked(AwardRevokedEvent event) {
    runTrigger(event, TriggerKind.INSTRUCTOR_BADGE_AWARDED, event.entityId());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onWorkshopChanged(WorkshopChangedEvent event) {
    runWorkshopTriggers(event, event.entityId());
    for (var taskId : tasksOfWorkshop(event.entityId())) {
      runTrigger(event, TriggerKind.INSTRUCTOR_TASK_CREATED_FOR_WORKSHOP, taskId);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onWorkshopTaskChanged(WorkshopTaskChangedEvent event) {
    runTrigger(event, TriggerKind.INSTRUCTOR_TASK_CREATED_FOR_WORKSHOP, event.entityId());
    runWorkshopTriggers(event, event.workshopId());
  }

  /** A changed name or address alters recipients of every email the person takes part in. */
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onPersonUpdated(PersonUpdatedEvent event) {
    List<Award> awards =
        transactionTemplate.execute(status -> awardRepository.findByPersonId(event.entityId()));
    List<WorkshopTask> tasks =
        transactionTemplate.execute(status -> taskRepository.findByPersonId(event.entityId()));

    for (var award : awards) {
      runTrigger(event, TriggerKind.INSTRUCTOR_BADGE_AWARDED, award.getId());
    }
    for (var task : tasks) {
      runTrigger(event, TriggerKind.INSTRUCTOR_TASK_CREATED_FOR_WORKSHOP, task.getId());
    }
    tasks.stream()
        .map(WorkshopTask::getWorkshopId)
        .distinct()
        .forEach(workshopId -> runWorkshopTriggers(event, workshopId));
  }

  private void runWorkshopTriggers(DomainEvent event, UUID workshopId) {
    runTrigger(event, TriggerKind.HOST_INSTRUCTORS_INTRODUCTION, workshopId);
    runTrigger(event, TriggerKind.POST_WORKSHOP_7DAYS, workshopId);
  }

  private List<UUID> tasksOfWorkshop(UUID workshopId) {
    return transactionTemplate.execute(
        status ->
            taskRepository.findByWorkshopId(workshopId).stream().map(WorkshopTask::getId).toList());
  }

  private void runTrigger(DomainEvent event, TriggerKind kind, UUID subjectId) {
    try {
      var result =
          transactionTemplate.execute(
              status -> triggerService.run(kind, subjectId, event.actorId()));
      if (result != null && result.hasWarnings()) {
        log.warn(
            "Trigger {} for {} event={} finished with warnings: {}",
            kind.key(),
            event.eventType(),
            event.entityId(),
            result.messages());
      }
    } catch (Exception e) {
      log.warn(
          "Failed to run trigger {} for {} event={}, subject={}",
          kind.key(),
          event.eventType(),
          event.entityId(),
          subjectId,
          e);
    }
  }
}
