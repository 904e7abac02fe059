package io.volunteerhub.emails.scheduledemail;

import io.volunteerhub.emails.emailtemplate.EmailTemplate;
import io.volunteerhub.emails.emailtemplate.EmailTemplateRepository;
import io.volunteerhub.emails.trigger.EmailAction;
import io.volunteerhub.emails.trigger.TriggerKind;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Creates, revises and cancels scheduled emails on behalf of triggers. Every state change writes a
 * log entry in the same transaction.
 *
 * <p>A new email is inserted in its own transaction. When a concurrent trigger run already holds
 * the {@code active_key} for the same trigger and subject, only that inner insert rolls back and
 * the caller's transaction stays usable.
 */
@Service
public class ScheduledEmailService {

  private static final Logger log = LoggerFactory.getLogger(ScheduledEmailService.class);

  private final ScheduledEmailRepository scheduledEmailRepository;
  private final ScheduledEmailLogRepository logRepository;
  private final EmailTemplateRepository templateRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final TransactionTemplate insertTransaction;

  public ScheduledEmailService(
      ScheduledEmailRepository scheduledEmailRepository,
      ScheduledEmailLogRepository logRepository,
      EmailTemplateRepository templateRepository,
      ApplicationEventPublisher eventPublisher,
      PlatformTransactionManager transactionManager) {
    this.scheduledEmailRepository = scheduledEmailRepository;
    this.logRepository = logRepository;
    this.templateRepository = templateRepository;
    this.eventPublisher = eventPublisher;
    this.insertTransaction = new TransactionTemplate(transactionManager);
    this.insertTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /**
   * Stores a new SCHEDULED email.
   *
   * @throws MissingTemplateException when the trigger has no active template
   * @throws MissingRecipientsException when the action has no recipients
   * @throws InconsistentStateException when a scheduled email already exists for the subject
   */
  @Transactional(noRollbackFor = EmailActionException.class)
  public ScheduledEmail schedule(
      TriggerKind triggerKind, SubjectRef subject, EmailAction action, UUID authorId) {
    var template = findActiveTemplate(triggerKind);
    if (action.recipients().isEmpty()) {
      throw new MissingRecipientsException(triggerKind);
    }
    if (!findScheduled(triggerKind, subject).isEmpty()) {
      throw new InconsistentStateException(
          "Scheduled email for "
              + triggerKind.key()
              + " and "
              + subject
              + " already exists, refusing to create another.");
    }

    var pending =
        new ScheduledEmail(
            triggerKind,
            template.getId(),
            subject,
            action.scheduledAt(),
            action.context(),
            action.recipients(),
            action.recipientLinkMaps(),
            authorId);
    ScheduledEmail email;
    try {
      email = insertTransaction.execute(status -> insert(triggerKind, subject, pending, authorId));
    } catch (DataIntegrityViolationException e) {
      throw new InconsistentStateException(
          "Concurrent scheduling detected for " + triggerKind.key() + " and " + subject + ".", e);
    }

    log.info(
        "Scheduled email: id={}, trigger={}, subject={}, scheduledAt={}",
        email.getId(),
        triggerKind.key(),
        subject,
        email.getScheduledAt());
    return email;
  }

  /**
   * Replaces the content of the single SCHEDULED email for the trigger and subject.
   *
   * @throws InconsistentStateException when there is not exactly one scheduled email to update
   */
  @Transactional(noRollbackFor = EmailActionException.class)
  public ScheduledEmail update(
      TriggerKind triggerKind, SubjectRef subject, EmailAction action, UUID authorId) {
    var template = findActiveTemplate(triggerKind);
    var email = findSingleScheduled(triggerKind, subject, "update");
    if (action.recipients().isEmpty()) {
      throw new MissingRecipientsException(triggerKind);
    }

    email.revise(
        action.scheduledAt(),
        action.context(),
        action.recipients(),
        action.recipientLinkMaps(),
        template.getId());
    email = scheduledEmailRepository.save(email);

    appendLog(
        email,
        ScheduledEmailStatus.SCHEDULED,
        ScheduledEmailStatus.SCHEDULED,
        "Updated " + triggerKind.key() + ", now scheduled at " + email.getScheduledAt(),
        authorId);

    log.info(
        "Updated scheduled email: id={}, trigger={}, scheduledAt={}",
        email.getId(),
        triggerKind.key(),
        email.getScheduledAt());
    return email;
  }

  /**
   * Cancels every SCHEDULED email for the trigger and subject. Duplicates are cancelled too, and
   * logged as an anomaly.
   *
   * @throws InconsistentStateException when there is nothing to cancel
   */
  @Transactional(noRollbackFor = EmailActionException.class)
  public List<ScheduledEmail> cancel(TriggerKind triggerKind, SubjectRef subject, UUID authorId) {
    var emails = findScheduled(triggerKind, subject);
    if (emails.isEmpty()) {
      throw new InconsistentStateException(
          "No scheduled email found to cancel for " + triggerKind.key() + " and " + subject + ".");
    }
    if (emails.size() > 1) {
      log.warn(
          "Cancelling {} scheduled emails for trigger={}, subject={}; expected at most one",
          emails.size(),
          triggerKind.key(),
          subject);
    }

    for (var email : emails) {
      email.cancel();
      scheduledEmailRepository.save(email);
      appendLog(
          email,
          ScheduledEmailStatus.SCHEDULED,
          ScheduledEmailStatus.CANCELLED,
          "Cancelled " + triggerKind.key(),
          authorId);
      log.info("Cancelled scheduled email: id={}, trigger={}", email.getId(), triggerKind.key());
    }
    return emails;
  }

  @Transactional(readOnly = true)
  public List<ScheduledEmail> findScheduled(TriggerKind triggerKind, SubjectRef subject) {
    return scheduledEmailRepository.findByTriggerAndSubjectAndState(
        triggerKind, subject.getKind(), subject.getId(), ScheduledEmailStatus.SCHEDULED);
  }

  private ScheduledEmail insert(
      TriggerKind triggerKind, SubjectRef subject, ScheduledEmail pending, UUID authorId) {
    var email = scheduledEmailRepository.saveAndFlush(pending);
    appendLog(
        email,
        null,
        ScheduledEmailStatus.SCHEDULED,
        "Scheduled " + triggerKind.key() + " to run at " + email.getScheduledAt(),
        authorId);
    eventPublisher.publishEvent(
        new ScheduledEmailCreatedEvent(email.getId(), triggerKind, subject, Instant.now()));
    return email;
  }

  private void appendLog(
      ScheduledEmail email,
      ScheduledEmailStatus before,
      ScheduledEmailStatus after,
      String details,
      UUID authorId) {
    logRepository.save(new ScheduledEmailLog(email.getId(), before, after, details, authorId));
  }

  private ScheduledEmail findSingleScheduled(
      TriggerKind triggerKind, SubjectRef subject, String action) {
    var emails = findScheduled(triggerKind, subject);
    if (emails.isEmpty()) {
      throw new InconsistentStateException(
          "No scheduled email found to "
              + action
              + " for "
              + triggerKind.key()
              + " and "
              + subject
              + ".");
    }
    if (emails.size() > 1) {
      throw new InconsistentStateException(
          "Too many scheduled emails ("
              + emails.size()
              + ") for "
              + triggerKind.key()
              + " and "
              + subject
              + ", cannot "
              + action
              + ".");
    }
    return emails.get(0);
  }

  private EmailTemplate findActiveTemplate(TriggerKind triggerKind) {
    return templateRepository
        .findActiveByTriggerKind(triggerKind)
        .orElseThrow(() -> new MissingTemplateException(triggerKind));
  }
}
