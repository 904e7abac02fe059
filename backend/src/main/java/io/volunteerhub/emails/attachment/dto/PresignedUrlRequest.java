package io.volunteerhub.emails.attachment.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record PresignedUrlRequest(@NotNull @Positive Long expirationSeconds) {}
