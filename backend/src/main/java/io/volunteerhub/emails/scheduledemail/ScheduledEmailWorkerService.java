package io.volunteerhub.emails.scheduledemail;

import io.volunteerhub.emails.config.EmailsProperties;
import io.volunteerhub.emails.exception.LockConflictException;
import io.volunteerhub.emails.exception.ResourceNotFoundException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Operations used by delivery workers: list what is due, claim one email, report the outcome.
 * Operators use the same service to cancel or move a scheduled email by hand.
 *
 * <p>Claiming is a conditional update at the database. Of several workers racing for the same
 * email exactly one gets it; the others receive {@link LockConflictException}.
 */
@Service
public class ScheduledEmailWorkerService {

  private static final Logger log = LoggerFactory.getLogger(ScheduledEmailWorkerService.class);

  /** Upper bound for the stale-lock threshold, roughly ten years. */
  public static final Duration MAX_STALE_THRESHOLD = Duration.ofDays(3650);

  private final ScheduledEmailRepository scheduledEmailRepository;
  private final ScheduledEmailLogRepository logRepository;
  private final EmailsProperties properties;

  public ScheduledEmailWorkerService(
      ScheduledEmailRepository scheduledEmailRepository,
      ScheduledEmailLogRepository logRepository,
      EmailsProperties properties) {
    this.scheduledEmailRepository = scheduledEmailRepository;
    this.logRepository = logRepository;
    this.properties = properties;
  }

  /** SCHEDULED or FAILED emails that are due, oldest created first. */
  @Transactional(readOnly = true)
  public Page<ScheduledEmail> listEligible(int page, int size) {
    var pageable = PageRequest.of(page, clampSize(size));
    return scheduledEmailRepository.findEligible(
        ScheduledEmailStatus.ELIGIBLE, Instant.now(), pageable);
  }

  /** All emails newest first, optionally narrowed to one state. */
  @Transactional(readOnly = true)
  public Page<ScheduledEmail> list(ScheduledEmailStatus state, int page, int size) {
    var pageable =
        PageRequest.of(page, clampSize(size), Sort.by(Sort.Direction.DESC, "createdAt", "id"));
    if (state == null) {
      return scheduledEmailRepository.findAll(pageable);
    }
    return scheduledEmailRepository.findByState(state, pageable);
  }

  @Transactional(readOnly = true)
  public ScheduledEmail get(UUID id) {
    return scheduledEmailRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("ScheduledEmail", id));
  }

  @Transactional(readOnly = true)
  public List<ScheduledEmailLog> getLogs(UUID id) {
    if (!scheduledEmailRepository.existsById(id)) {
      throw new ResourceNotFoundException("ScheduledEmail", id);
    }
    return logRepository.findByScheduledEmailId(id);
  }

  /** LOCKED emails with no log activity for at least {@code olderThan}. Read-only. */
  @Transactional(readOnly = true)
  public List<ScheduledEmail> findStaleLocks(Duration olderThan) {
    if (olderThan.isNegative()) {
      throw new IllegalArgumentException("Stale lock threshold must not be negative");
    }
    if (olderThan.compareTo(MAX_STALE_THRESHOLD) > 0) {
      throw new IllegalArgumentException(
          "Stale lock threshold must not exceed " + MAX_STALE_THRESHOLD.toDays() + " days");
    }
    return scheduledEmailRepository.findStaleLocked(
        ScheduledEmailStatus.LOCKED, Instant.now().minus(olderThan));
  }

  /**
   * Claims an email for sending.
   *
   * @throws ResourceNotFoundException when no email has this id
   * @throws LockConflictException when the email is not claimable or another worker won the race
   */
  @Transactional
  public ScheduledEmail lock(UUID id, UUID workerId) {
    var current = get(id).getState();
    if (!current.isLockable()) {
      throw new LockConflictException(id, current.name());
    }

    int updated;
    try {
      updated =
          scheduledEmailRepository.compareAndLock(
              id, current, ScheduledEmailStatus.LOCKED, Instant.now());
    } catch (ConcurrencyFailureException e) {
      log.info("Lock contention on scheduled email: id={}, message={}", id, e.getMessage());
      throw new LockConflictException(id, current.name());
    }
    if (updated == 0) {
      log.info("Lost lock race for scheduled email: id={}, expectedState={}", id, current);
      throw new LockConflictException(id, ScheduledEmailStatus.LOCKED.name());
    }

    logRepository.save(
        new ScheduledEmailLog(
            id, current, ScheduledEmailStatus.LOCKED, "State changed by worker", workerId));

    log.info("Locked scheduled email: id={}, previousState={}", id, current);
    return get(id);
  }

  /**
   * Records a successful send.
   *
   * @throws io.volunteerhub.emails.exception.InvalidStateException unless the email is LOCKED
   */
  @Transactional
  public ScheduledEmail succeed(UUID id, String details, UUID workerId) {
    var email = get(id);
    email.markSucceeded();
    email = scheduledEmailRepository.save(email);

    logRepository.save(
        new ScheduledEmailLog(
            id,
            ScheduledEmailStatus.LOCKED,
            ScheduledEmailStatus.SUCCEEDED,
            details != null ? details : "Email sent",
            workerId));

    log.info("Scheduled email succeeded: id={}", id);
    return email;
  }

  /**
   * Records a failed send. The email becomes eligible again.
   *
   * @throws io.volunteerhub.emails.exception.InvalidStateException unless the email is LOCKED
   */
  @Transactional
  public ScheduledEmail fail(UUID id, String details, UUID workerId) {
    var email = get(id);
    email.markFailed();
    email = scheduledEmailRepository.save(email);

    logRepository.save(
        new ScheduledEmailLog(
            id,
            ScheduledEmailStatus.LOCKED,
            ScheduledEmailStatus.FAILED,
            details != null ? details : "Sending failed",
            workerId));

    log.warn("Scheduled email failed: id={}, details={}", id, details);
    return email;
  }

  /**
   * Cancels a SCHEDULED email on an operator's request.
   *
   * @throws io.volunteerhub.emails.exception.InvalidStateException unless the email is SCHEDULED
   */
  @Transactional
  public ScheduledEmail cancel(UUID id, String details, UUID authorId) {
    var email = get(id);
    email.cancel();
    email = scheduledEmailRepository.save(email);

    logRepository.save(
        new ScheduledEmailLog(
            id,
            ScheduledEmailStatus.SCHEDULED,
            ScheduledEmailStatus.CANCELLED,
            details != null ? details : "Cancelled by operator",
            authorId));

    log.info("Scheduled email cancelled by operator: id={}", id);
    return email;
  }

  /**
   * Moves a SCHEDULED email to a new send time. A later trigger update keeps the new time for
   * triggers that send shortly after scheduling.
   *
   * @throws io.volunteerhub.emails.exception.InvalidStateException unless the email is SCHEDULED
   */
  @Transactional
  public ScheduledEmail reschedule(UUID id, Instant scheduledAt, String details, UUID authorId) {
    var email = get(id);
    var previous = email.getScheduledAt();
    email.reschedule(scheduledAt);
    email = scheduledEmailRepository.save(email);

    var message = "Rescheduled from " + previous + " to " + scheduledAt;
    logRepository.save(
        new ScheduledEmailLog(
            id,
            ScheduledEmailStatus.SCHEDULED,
            ScheduledEmailStatus.SCHEDULED,
            details != null ? message + ": " + details : message,
            authorId));

    log.info("Scheduled email rescheduled: id={}, from={}, to={}", id, previous, scheduledAt);
    return email;
  }

  private int clampSize(int size) {
    return Math.max(1, Math.min(size, properties.maxPageSize()));
  }
}
