package io.volunteerhub.emails.event;

import io.volunteerhub.emails.context.EntityKind;
import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for domain events published via Spring ApplicationEventPublisher. Implementations
 * are records carrying ids only, never JPA entities, so they stay valid after the publishing
 * transaction commits.
 */
public sealed interface DomainEvent
    permits AwardGrantedEvent,
        AwardRevokedEvent,
        PersonUpdatedEvent,
        WorkshopChangedEvent,
        WorkshopTaskChangedEvent {

  String eventType();

  EntityKind entityKind();

  UUID entityId();

  /** Person who caused the change. May be null for system changes. */
  UUID actorId();

  Instant occurredAt();
}
