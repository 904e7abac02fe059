package io.volunteerhub.emails.integration.storage;

import java.time.Instant;

/** A download link for a stored attachment and the instant it stops working. */
public record PresignedUrl(String url, Instant expiresAt) {}
