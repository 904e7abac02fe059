package io.volunteerhub.emails.emailtemplate;

import java.util.List;
import java.util.UUID;

/** A scheduled email with every header and the body resolved against current data. */
public record RenderedEmail(
    UUID scheduledEmailId,
    String from,
    String replyTo,
    List<String> to,
    List<String> cc,
    List<String> bcc,
    String subject,
    String body) {}
