package io.volunteerhub.emails.scheduledemail;

import io.volunteerhub.emails.trigger.TriggerKind;
import java.time.Instant;
import java.util.UUID;

/**
 * Published once a new scheduled email has been stored. Listeners that attach derived artifacts
 * subscribe to this rather than to the domain event that caused the email.
 */
public record ScheduledEmailCreatedEvent(
    UUID scheduledEmailId, TriggerKind triggerKind, SubjectRef subject, Instant occurredAt) {}
