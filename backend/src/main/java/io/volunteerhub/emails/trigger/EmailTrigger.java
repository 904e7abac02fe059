package io.volunteerhub.emails.trigger;

import io.volunteerhub.emails.scheduledemail.ScheduledEmail;
import io.volunteerhub.emails.scheduledemail.SubjectRef;
import java.util.Optional;
import java.util.UUID;

/**
 * Business rules of one automated email: whether it should exist for a subject, and what it
 * should contain. Implementations only read domain state.
 */
public interface EmailTrigger {

  TriggerKind kind();

  default SubjectRef subject(UUID subjectId) {
    return SubjectRef.of(kind().subjectKind(), subjectId);
  }

  boolean shouldExist(UUID subjectId);

  /**
   * Computes the email's content. Only called when {@link #shouldExist} holds.
   *
   * @param existing the stored SCHEDULED email when revising, empty when creating
   */
  EmailAction buildAction(UUID subjectId, Optional<ScheduledEmail> existing);
}
