package io.volunteerhub.emails.event;

import io.volunteerhub.emails.context.EntityKind;
import java.time.Instant;
import java.util.UUID;

public record PersonUpdatedEvent(UUID entityId, UUID actorId, Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "person.updated";
  }

  @Override
  public EntityKind entityKind() {
    return EntityKind.PERSON;
  }
}
