package io.volunteerhub.emails.workshop;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "people")
public class Person {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "personal_name", nullable = false, length = 255)
  private String personalName;

  @Column(name = "family_name", length = 255)
  private String familyName;

  @Column(name = "email", length = 320)
  private String email;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Person() {}

  public Person(String personalName, String familyName, String email) {
    this.personalName = personalName;
    this.familyName = familyName;
    this.email = email;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateContact(String personalName, String familyName, String email) {
    this.personalName = personalName;
    this.familyName = familyName;
    this.email = email;
    this.updatedAt = Instant.now();
  }

  public String getFullName() {
    if (familyName == null || familyName.isBlank()) {
      return personalName;
    }
    return personalName + " " + familyName;
  }

  public boolean hasEmail() {
    return email != null && !email.isBlank();
  }

  public UUID getId() {
    return id;
  }

  public String getPersonalName() {
    return personalName;
  }

  public String getFamilyName() {
    return familyName;
  }

  public String getEmail() {
    return email;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
