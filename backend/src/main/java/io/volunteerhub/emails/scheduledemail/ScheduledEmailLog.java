package io.volunteerhub.emails.scheduledemail;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Append-only history entry. Written once per transition, never updated or deleted. */
@Entity
@Table(name = "scheduled_email_logs")
public class ScheduledEmailLog {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "scheduled_email_id", nullable = false, updatable = false)
  private UUID scheduledEmailId;

  /** Null for the entry recording creation. */
  @Enumerated(EnumType.STRING)
  @Column(name = "state_before", length = 20, updatable = false)
  private ScheduledEmailStatus stateBefore;

  @Enumerated(EnumType.STRING)
  @Column(name = "state_after", nullable = false, length = 20, updatable = false)
  private ScheduledEmailStatus stateAfter;

  @Column(name = "details", nullable = false, length = 4000, updatable = false)
  private String details;

  @Column(name = "author_id", updatable = false)
  private UUID authorId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ScheduledEmailLog() {}

  public ScheduledEmailLog(
      UUID scheduledEmailId,
      ScheduledEmailStatus stateBefore,
      ScheduledEmailStatus stateAfter,
      String details,
      UUID authorId) {
    this.scheduledEmailId = scheduledEmailId;
    this.stateBefore = stateBefore;
    this.stateAfter = stateAfter;
    this.details = details != null ? details : "";
    this.authorId = authorId;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getScheduledEmailId() {
    return scheduledEmailId;
  }

  public ScheduledEmailStatus getStateBefore() {
    return stateBefore;
  }

  public ScheduledEmailStatus getStateAfter() {
    return stateAfter;
  }

  public String getDetails() {
    return details;
  }

  public UUID getAuthorId() {
    return authorId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
