package io.volunteerhub.emails.scheduledemail;

import io.volunteerhub.emails.exception.InvalidStateException;
import io.volunteerhub.emails.trigger.TriggerKind;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * An automated email waiting to be sent, or the record of one that was. The context and recipient
 * links hold deferred references only; values are resolved when a worker renders the email.
 *
 * <p>State changes go through {@link ScheduledEmailStatus#canTransitionTo}. Rows are never
 * deleted.
 */
@Entity
@Table(name = "scheduled_emails")
public class ScheduledEmail {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "trigger_kind", nullable = false, length = 60)
  private TriggerKind triggerKind;

  @Column(name = "template_id", nullable = false)
  private UUID templateId;

  @Enumerated(EnumType.STRING)
  @Column(name = "state", nullable = false, length = 20)
  private ScheduledEmailStatus state;

  @Column(name = "scheduled_at", nullable = false)
  private Instant scheduledAt;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "context", nullable = false)
  private Map<String, Object> context = new LinkedHashMap<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "to_header", nullable = false)
  private List<String> toHeader = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "to_header_context", nullable = false)
  private List<Map<String, String>> toHeaderContext = new ArrayList<>();

  @Embedded private SubjectRef subject;

  @Column(name = "author_id")
  private UUID authorId;

  /** {@code trigger|kind|id} while SCHEDULED, null otherwise. Unique across the table. */
  @Column(name = "active_key", unique = true, length = 200)
  private String activeKey;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ScheduledEmail() {}

  public ScheduledEmail(
      TriggerKind triggerKind,
      UUID templateId,
      SubjectRef subject,
      Instant scheduledAt,
      Map<String, Object> context,
      List<String> toHeader,
      List<Map<String, String>> toHeaderContext,
      UUID authorId) {
    this.triggerKind = triggerKind;
    this.templateId = templateId;
    this.subject = subject;
    this.scheduledAt = scheduledAt;
    this.context = new LinkedHashMap<>(context);
    this.toHeader = new ArrayList<>(toHeader);
    this.toHeaderContext = new ArrayList<>(toHeaderContext);
    this.authorId = authorId;
    this.state = ScheduledEmailStatus.SCHEDULED;
    this.activeKey = activeKeyFor(triggerKind, subject);
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public static String activeKeyFor(TriggerKind triggerKind, SubjectRef subject) {
    return triggerKind.key() + "|" + subject.getKind().key() + "|" + subject.getId();
  }

  /** Replaces the deferred content of a still-scheduled email. State stays SCHEDULED. */
  public void revise(
      Instant scheduledAt,
      Map<String, Object> context,
      List<String> toHeader,
      List<Map<String, String>> toHeaderContext,
      UUID templateId) {
    requireTransition(ScheduledEmailStatus.SCHEDULED, "update");
    this.scheduledAt = scheduledAt;
    this.context = new LinkedHashMap<>(context);
    this.toHeader = new ArrayList<>(toHeader);
    this.toHeaderContext = new ArrayList<>(toHeaderContext);
    this.templateId = templateId;
    this.updatedAt = Instant.now();
  }

  /** Moves a still-scheduled email to another send time. Content is left untouched. */
  public void reschedule(Instant scheduledAt) {
    requireTransition(ScheduledEmailStatus.SCHEDULED, "reschedule");
    this.scheduledAt = scheduledAt;
    this.updatedAt = Instant.now();
  }

  public void cancel() {
    requireTransition(ScheduledEmailStatus.CANCELLED, "cancel");
    moveTo(ScheduledEmailStatus.CANCELLED);
  }

  public void markSucceeded() {
    requireTransition(ScheduledEmailStatus.SUCCEEDED, "report success for");
    moveTo(ScheduledEmailStatus.SUCCEEDED);
  }

  public void markFailed() {
    requireTransition(ScheduledEmailStatus.FAILED, "report failure for");
    moveTo(ScheduledEmailStatus.FAILED);
  }

  /** True when the stored content already matches what a revision would write. */
  public boolean hasSameContent(
      Instant scheduledAt,
      Map<String, Object> context,
      List<String> toHeader,
      List<Map<String, String>> toHeaderContext) {
    return this.scheduledAt.equals(scheduledAt)
        && this.context.equals(context)
        && this.toHeader.equals(toHeader)
        && this.toHeaderContext.equals(toHeaderContext);
  }

  private void requireTransition(ScheduledEmailStatus target, String action) {
    if (!state.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid scheduled email state",
          "Cannot " + action + " scheduled email " + id + " in state " + state + ".");
    }
  }

  private void moveTo(ScheduledEmailStatus target) {
    this.state = target;
    this.activeKey =
        target == ScheduledEmailStatus.SCHEDULED ? activeKeyFor(triggerKind, subject) : null;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public TriggerKind getTriggerKind() {
    return triggerKind;
  }

  public UUID getTemplateId() {
    return templateId;
  }

  public ScheduledEmailStatus getState() {
    return state;
  }

  public Instant getScheduledAt() {
    return scheduledAt;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  public List<String> getToHeader() {
    return toHeader;
  }

  public List<Map<String, String>> getToHeaderContext() {
    return toHeaderContext;
  }

  public SubjectRef getSubject() {
    return subject;
  }

  public UUID getAuthorId() {
    return authorId;
  }

  public String getActiveKey() {
    return activeKey;
  }

  public long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
