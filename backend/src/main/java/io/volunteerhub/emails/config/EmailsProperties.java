package io.volunteerhub.emails.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables for scheduling and the worker API.
 *
 * @param immediateDelay how far in the future "immediate" actions are scheduled
 * @param maxPageSize upper bound for worker list pages
 * @param maxPresignedUrlExpiry longest expiry a worker may request for an attachment URL
 * @param certificateSignature signature printed on generated instructor certificates
 */
@ConfigurationProperties(prefix = "emails")
public record EmailsProperties(
    @DefaultValue("PT1H") Duration immediateDelay,
    @DefaultValue("100") int maxPageSize,
    @DefaultValue("P7D") Duration maxPresignedUrlExpiry,
    @DefaultValue("Executive Director") String certificateSignature) {}
