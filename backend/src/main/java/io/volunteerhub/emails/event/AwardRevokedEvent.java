package io.volunteerhub.emails.event;

import io.volunteerhub.emails.context.EntityKind;
import java.time.Instant;
import java.util.UUID;

/** Published after an award row was deleted. {@code entityId} no longer resolves. */
public record AwardRevokedEvent(
    UUID entityId, UUID personId, String badge, UUID actorId, Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "award.revoked";
  }

  @Override
  public EntityKind entityKind() {
    return EntityKind.AWARD;
  }
}
