package io.volunteerhub.emails.trigger;

import io.volunteerhub.emails.scheduledemail.SubjectRef;

/**
 * Result of comparing a trigger's business rules against stored scheduled emails.
 *
 * @param action content to store; present for CREATE and UPDATE, null otherwise
 */
public record Evaluation(
    TriggerKind trigger,
    SubjectRef subject,
    boolean exists,
    boolean shouldExist,
    Strategy strategy,
    EmailAction action) {}
