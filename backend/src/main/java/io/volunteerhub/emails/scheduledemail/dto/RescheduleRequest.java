package io.volunteerhub.emails.scheduledemail.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/** New send time for a scheduled email, with an optional note for its log. */
public record RescheduleRequest(@NotNull Instant scheduledAt, @Size(max = 3000) String details) {}
