package io.volunteerhub.emails.scheduledemail.dto;

import jakarta.validation.constraints.Size;

/** Free-text outcome reported by a worker, stored in the email's log. */
public record WorkerReportRequest(@Size(max = 4000) String details) {}
