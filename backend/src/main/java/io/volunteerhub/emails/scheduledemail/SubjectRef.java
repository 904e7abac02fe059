package io.volunteerhub.emails.scheduledemail;

import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.context.EntityRef;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.util.Objects;
import java.util.UUID;

/** The entity a scheduled email is about, stored as a kind discriminant plus id. */
@Embeddable
public class SubjectRef {

  @Enumerated(EnumType.STRING)
  @Column(name = "subject_kind", nullable = false, length = 20)
  private EntityKind kind;

  @Column(name = "subject_id", nullable = false)
  private UUID id;

  protected SubjectRef() {}

  public SubjectRef(EntityKind kind, UUID id) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.id = Objects.requireNonNull(id, "id");
  }

  public static SubjectRef of(EntityKind kind, UUID id) {
    return new SubjectRef(kind, id);
  }

  public EntityRef toEntityRef() {
    return EntityRef.of(kind, id);
  }

  public EntityKind getKind() {
    return kind;
  }

  public UUID getId() {
    return id;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SubjectRef other)) {
      return false;
    }
    return kind == other.kind && Objects.equals(id, other.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, id);
  }

  @Override
  public String toString() {
    return kind.key() + "#" + id;
  }
}
