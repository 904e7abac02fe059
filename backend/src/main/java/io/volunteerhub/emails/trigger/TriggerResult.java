package io.volunteerhub.emails.trigger;

import io.volunteerhub.emails.scheduledemail.SubjectRef;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one trigger run.
 *
 * @param scheduledEmailId the created, updated or cancelled email; null for NOOP and on warnings
 */
public record TriggerResult(
    TriggerKind trigger,
    SubjectRef subject,
    Strategy strategy,
    UUID scheduledEmailId,
    List<TriggerMessage> messages) {

  public TriggerResult {
    messages = List.copyOf(messages);
  }

  public boolean hasWarnings() {
    return messages.stream().anyMatch(m -> m.level() == TriggerMessage.Level.WARNING);
  }
}
