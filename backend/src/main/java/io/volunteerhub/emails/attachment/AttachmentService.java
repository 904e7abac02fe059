package io.volunteerhub.emails.attachment;

import io.volunteerhub.emails.config.EmailsProperties;
import io.volunteerhub.emails.exception.ResourceNotFoundException;
import io.volunteerhub.emails.integration.storage.PresignedUrl;
import io.volunteerhub.emails.integration.storage.StorageService;
import io.volunteerhub.emails.scheduledemail.ScheduledEmailRepository;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AttachmentService {

  private static final Logger log = LoggerFactory.getLogger(AttachmentService.class);

  private final AttachmentRepository attachmentRepository;
  private final ScheduledEmailRepository scheduledEmailRepository;
  private final StorageService storageService;
  private final EmailsProperties properties;

  public AttachmentService(
      AttachmentRepository attachmentRepository,
      ScheduledEmailRepository scheduledEmailRepository,
      StorageService storageService,
      EmailsProperties properties) {
    this.attachmentRepository = attachmentRepository;
    this.scheduledEmailRepository = scheduledEmailRepository;
    this.storageService = storageService;
    this.properties = properties;
  }

  /** Uploads the content and records it as an attachment of the scheduled email. */
  @Transactional
  public Attachment attach(
      UUID scheduledEmailId, String filename, byte[] content, String contentType) {
    if (!scheduledEmailRepository.existsById(scheduledEmailId)) {
      throw new ResourceNotFoundException("ScheduledEmail", scheduledEmailId);
    }
    String key = "scheduled-emails/" + scheduledEmailId + "/" + UUID.randomUUID() + "/" + filename;
    storageService.upload(key, content, contentType);

    Attachment attachment;
    try {
      attachment =
          attachmentRepository.saveAndFlush(
              new Attachment(
                  scheduledEmailId,
                  filename,
                  contentType,
                  content.length,
                  storageService.bucket(),
                  key));
    } catch (DataAccessException e) {
      storageService.delete(key);
      throw e;
    }

    log.info(
        "Attached file to scheduled email: email={}, attachment={}, key={}, size={}bytes",
        scheduledEmailId,
        attachment.getId(),
        key,
        content.length);
    return attachment;
  }

  @Transactional(readOnly = true)
  public List<Attachment> listForEmail(UUID scheduledEmailId) {
    return attachmentRepository.findByScheduledEmailId(scheduledEmailId);
  }

  /**
   * Generates a fresh download URL valid for the requested number of seconds and remembers it on
   * the attachment.
   *
   * @throws IllegalArgumentException when the expiration is not positive or exceeds the configured
   *     maximum
   */
  @Transactional
  public PresignedUrl generatePresignedUrl(UUID attachmentId, long expirationSeconds) {
    var maxExpiry = properties.maxPresignedUrlExpiry();
    if (expirationSeconds <= 0 || expirationSeconds > maxExpiry.toSeconds()) {
      throw new IllegalArgumentException(
          "expirationSeconds must be between 1 and " + maxExpiry.toSeconds());
    }
    var attachment =
        attachmentRepository
            .findById(attachmentId)
            .orElseThrow(() -> new ResourceNotFoundException("Attachment", attachmentId));

    var presigned =
        storageService.generateDownloadUrl(
            attachment.getStorageKey(), Duration.ofSeconds(expirationSeconds));
    attachment.recordPresignedUrl(presigned.url(), presigned.expiresAt());
    attachmentRepository.save(attachment);

    log.info(
        "Generated presigned URL: attachment={}, expiresAt={}",
        attachmentId,
        presigned.expiresAt());
    return presigned;
  }
}
