package io.volunteerhub.emails.workshop;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** A badge granted to a person, e.g. {@code instructor}. */
@Entity
@Table(name = "awards")
public class Award {

  public static final String INSTRUCTOR_BADGE = "instructor";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "person_id", nullable = false)
  private UUID personId;

  @Column(name = "badge", nullable = false, length = 100)
  private String badge;

  @Column(name = "awarded_on", nullable = false)
  private LocalDate awardedOn;

  @Column(name = "awarded_by")
  private UUID awardedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Award() {}

  public Award(UUID personId, String badge, LocalDate awardedOn, UUID awardedBy) {
    this.personId = personId;
    this.badge = badge;
    this.awardedOn = awardedOn;
    this.awardedBy = awardedBy;
    this.createdAt = Instant.now();
  }

  public boolean isInstructorBadge() {
    return INSTRUCTOR_BADGE.equals(badge);
  }

  public UUID getId() {
    return id;
  }

  public UUID getPersonId() {
    return personId;
  }

  public String getBadge() {
    return badge;
  }

  public LocalDate getAwardedOn() {
    return awardedOn;
  }

  public UUID getAwardedBy() {
    return awardedBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
