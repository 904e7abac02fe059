package io.volunteerhub.emails.attachment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A file sent along with a scheduled email. Content lives in object storage. */
@Entity
@Table(name = "scheduled_email_attachments")
public class Attachment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "scheduled_email_id", nullable = false, updatable = false)
  private UUID scheduledEmailId;

  @Column(name = "filename", nullable = false, length = 255)
  private String filename;

  @Column(name = "content_type", nullable = false, length = 100)
  private String contentType;

  @Column(name = "size_bytes", nullable = false)
  private long sizeBytes;

  @Column(name = "bucket", nullable = false, length = 255)
  private String bucket;

  @Column(name = "storage_key", nullable = false, length = 1000)
  private String storageKey;

  @Column(name = "presigned_url", length = 4000)
  private String presignedUrl;

  @Column(name = "presigned_url_expires_at")
  private Instant presignedUrlExpiresAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Attachment() {}

  public Attachment(
      UUID scheduledEmailId,
      String filename,
      String contentType,
      long sizeBytes,
      String bucket,
      String storageKey) {
    this.scheduledEmailId = scheduledEmailId;
    this.filename = filename;
    this.contentType = contentType;
    this.sizeBytes = sizeBytes;
    this.bucket = bucket;
    this.storageKey = storageKey;
    this.createdAt = Instant.now();
  }

  public void recordPresignedUrl(String url, Instant expiresAt) {
    this.presignedUrl = url;
    this.presignedUrlExpiresAt = expiresAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getScheduledEmailId() {
    return scheduledEmailId;
  }

  public String getFilename() {
    return filename;
  }

  public String getContentType() {
    return contentType;
  }

  public long getSizeBytes() {
    return sizeBytes;
  }

  public String getBucket() {
    return bucket;
  }

  public String getStorageKey() {
    return storageKey;
  }

  public String getPresignedUrl() {
    return presignedUrl;
  }

  public Instant getPresignedUrlExpiresAt() {
    return presignedUrlExpiresAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
