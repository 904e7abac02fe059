package io.volunteerhub.emails.event;

import io.volunteerhub.emails.context.EntityKind;
import java.time.Instant;
import java.util.UUID;

/** Workshop dates, administrator or tags changed. */
public record WorkshopChangedEvent(UUID entityId, UUID actorId, Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "workshop.changed";
  }

  @Override
  public EntityKind entityKind() {
    return EntityKind.WORKSHOP;
  }
}
