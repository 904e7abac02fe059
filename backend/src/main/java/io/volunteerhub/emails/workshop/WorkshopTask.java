package io.volunteerhub.emails.workshop;

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

/** Assignment of a person to a workshop in a given role. */
@Entity
@Table(name = "workshop_tasks")
public class WorkshopTask {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "workshop_id", nullable = false)
  private UUID workshopId;

  @Column(name = "person_id", nullable = false)
  private UUID personId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 30)
  private TaskRole role;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected WorkshopTask() {}

  public WorkshopTask(UUID workshopId, UUID personId, TaskRole role) {
    this.workshopId = workshopId;
    this.personId = personId;
    this.role = role;
    this.createdAt = Instant.now();
  }

  public void changeRole(TaskRole role) {
    this.role = role;
  }

  public UUID getId() {
    return id;
  }

  public UUID getWorkshopId() {
    return workshopId;
  }

  public UUID getPersonId() {
    return personId;
  }

  public TaskRole getRole() {
    return role;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
