package io.volunteerhub.emails.emailtemplate;

import io.volunteerhub.emails.trigger.TriggerKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Subject, body and header templates for one trigger. All fields are Thymeleaf TEXT-mode
 * templates rendered against the resolved context of a scheduled email.
 */
@Entity
@Table(name = "email_templates")
public class EmailTemplate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "trigger_kind", nullable = false, unique = true, length = 60)
  private TriggerKind triggerKind;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "from_header", nullable = false, length = 255)
  private String fromHeader;

  @Column(name = "reply_to_header", length = 255)
  private String replyToHeader;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "cc_header")
  private List<String> ccHeader = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "bcc_header")
  private List<String> bccHeader = new ArrayList<>();

  @Column(name = "subject", nullable = false, length = 500)
  private String subject;

  @Column(name = "body", nullable = false, columnDefinition = "TEXT")
  private String body;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected EmailTemplate() {}

  public EmailTemplate(
      String name,
      TriggerKind triggerKind,
      String fromHeader,
      String replyToHeader,
      List<String> ccHeader,
      List<String> bccHeader,
      String subject,
      String body) {
    this.name = name;
    this.triggerKind = triggerKind;
    this.active = true;
    this.fromHeader = fromHeader;
    this.replyToHeader = replyToHeader;
    this.ccHeader = ccHeader != null ? new ArrayList<>(ccHeader) : new ArrayList<>();
    this.bccHeader = bccHeader != null ? new ArrayList<>(bccHeader) : new ArrayList<>();
    this.subject = subject;
    this.body = body;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public void activate() {
    this.active = true;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public TriggerKind getTriggerKind() {
    return triggerKind;
  }

  public boolean isActive() {
    return active;
  }

  public String getFromHeader() {
    return fromHeader;
  }

  public String getReplyToHeader() {
    return replyToHeader;
  }

  public List<String> getCcHeader() {
    return ccHeader;
  }

  public List<String> getBccHeader() {
    return bccHeader;
  }

  public String getSubject() {
    return subject;
  }

  public String getBody() {
    return body;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
