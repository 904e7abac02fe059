package io.volunteerhub.emails.event;

import io.volunteerhub.emails.context.EntityKind;
import java.time.Instant;
import java.util.UUID;

public record AwardGrantedEvent(
    UUID entityId, UUID personId, String badge, UUID actorId, Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "award.granted";
  }

  @Override
  public EntityKind entityKind() {
    return EntityKind.AWARD;
  }
}
