package io.volunteerhub.emails.event;

import io.volunteerhub.emails.context.EntityKind;
import java.time.Instant;
import java.util.UUID;

/**
 * A person was assigned to, reassigned within, or removed from a workshop. When {@code removed} is
 * true the task row is already gone.
 */
public record WorkshopTaskChangedEvent(
    UUID entityId,
    UUID workshopId,
    UUID personId,
    boolean removed,
    UUID actorId,
    Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return removed ? "task.removed" : "task.changed";
  }

  @Override
  public EntityKind entityKind() {
    return EntityKind.TASK;
  }
}
