package io.volunteerhub.emails.integration.storage;

import java.time.Duration;

/**
 * Object storage holding the files attached to scheduled emails. Callers never see the vendor
 * client; the implementation is picked by the {@code storage.provider} property.
 */
public interface StorageService {

  /**
   * Stores the content under {@code key}.
   *
   * @return the key the content was stored under
   * @throws StorageException when the store rejects the upload
   */
  String upload(String key, byte[] content, String contentType);

  /** Removes the object. Failures are logged, not thrown. */
  void delete(String key);

  /** Creates a time-limited link a mail worker can hand to its transport. */
  PresignedUrl generateDownloadUrl(String key, Duration expiry);

  String bucket();
}
