package io.volunteerhub.emails.scheduledemail;

import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.trigger.TriggerKind;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScheduledEmailRepository extends JpaRepository<ScheduledEmail, UUID> {

  @Query(
      """
      SELECT e FROM ScheduledEmail e
      WHERE e.triggerKind = :triggerKind
        AND e.subject.kind = :subjectKind
        AND e.subject.id = :subjectId
        AND e.state = :state
      ORDER BY e.createdAt ASC
      """)
  List<ScheduledEmail> findByTriggerAndSubjectAndState(
      @Param("triggerKind") TriggerKind triggerKind,
      @Param("subjectKind") EntityKind subjectKind,
      @Param("subjectId") UUID subjectId,
      @Param("state") ScheduledEmailStatus state);

  @Query(
      """
      SELECT e FROM ScheduledEmail e
      WHERE e.state IN :states AND e.scheduledAt <= :now
      ORDER BY e.createdAt ASC, e.id ASC
      """)
  Page<ScheduledEmail> findEligible(
      @Param("states") Collection<ScheduledEmailStatus> states,
      @Param("now") Instant now,
      Pageable pageable);

  @Query("SELECT e FROM ScheduledEmail e WHERE e.state = :state")
  Page<ScheduledEmail> findByState(@Param("state") ScheduledEmailStatus state, Pageable pageable);

  /**
   * Claims a row for one worker. Succeeds only if the row is still in {@code expected}; the
   * returned count is 1 for the winner and 0 for everyone else.
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE ScheduledEmail e
      SET e.state = :locked, e.activeKey = NULL, e.version = e.version + 1, e.updatedAt = :now
      WHERE e.id = :id AND e.state = :expected
      """)
  int compareAndLock(
      @Param("id") UUID id,
      @Param("expected") ScheduledEmailStatus expected,
      @Param("locked") ScheduledEmailStatus locked,
      @Param("now") Instant now);

  /** LOCKED rows whose latest log entry is older than {@code cutoff}. */
  @Query(
      """
      SELECT e FROM ScheduledEmail e
      WHERE e.state = :locked
        AND (SELECT MAX(l.createdAt) FROM ScheduledEmailLog l
             WHERE l.scheduledEmailId = e.id) < :cutoff
      ORDER BY e.updatedAt ASC
      """)
  List<ScheduledEmail> findStaleLocked(
      @Param("locked") ScheduledEmailStatus locked, @Param("cutoff") Instant cutoff);
}
