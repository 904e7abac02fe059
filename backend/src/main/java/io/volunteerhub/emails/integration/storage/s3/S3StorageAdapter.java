package io.volunteerhub.emails.integration.storage.s3;

import io.volunteerhub.emails.config.S3Config.S3Properties;
import io.volunteerhub.emails.integration.storage.PresignedUrl;
import io.volunteerhub.emails.integration.storage.StorageException;
import io.volunteerhub.emails.integration.storage.StorageService;
import java.time.Duration;
import java.time.Instant;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/** S3 implementation of {@link StorageService}. All AWS SDK types are confined to this class. */
@Component
@ConditionalOnProperty(name = "storage.provider", havingValue = "s3", matchIfMissing = true)
public class S3StorageAdapter implements StorageService {

  private static final Logger log = LoggerFactory.getLogger(S3StorageAdapter.class);

  /** {@code scheduled-emails/<email id>/<object id>/<filename>} */
  private static final Pattern S3_KEY_PATTERN =
      Pattern.compile("^scheduled-emails/[^/]+/[^/]+/[^/]+$");

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;
  private final String bucketName;

  public S3StorageAdapter(S3Client s3Client, S3Presigner s3Presigner, S3Properties s3Properties) {
    this.s3Client = s3Client;
    this.s3Presigner = s3Presigner;
    this.bucketName = s3Properties.bucketName();
  }

  @Override
  public String upload(String key, byte[] content, String contentType) {
    validateKey(key);
    var putRequest =
        PutObjectRequest.builder().bucket(bucketName).key(key).contentType(contentType).build();
    try {
      s3Client.putObject(putRequest, RequestBody.fromBytes(content));
    } catch (SdkException e) {
      throw new StorageException(
          "Failed to upload attachment to bucket " + bucketName + ": " + key, e);
    }
    log.debug("Uploaded attachment object: bucket={}, key={}", bucketName, key);
    return key;
  }

  @Override
  public void delete(String key) {
    validateKey(key);
    try {
      var deleteRequest = DeleteObjectRequest.builder().bucket(bucketName).key(key).build();
      s3Client.deleteObject(deleteRequest);
    } catch (SdkException e) {
      log.warn("Failed to delete attachment object: key={}, message={}", key, e.getMessage());
    }
  }

  @Override
  public PresignedUrl generateDownloadUrl(String key, Duration expiry) {
    validateKey(key);
    var getRequest = GetObjectRequest.builder().bucket(bucketName).key(key).build();

    var presignRequest =
        GetObjectPresignRequest.builder()
            .signatureDuration(expiry)
            .getObjectRequest(getRequest)
            .build();

    try {
      var presigned = s3Presigner.presignGetObject(presignRequest);
      return new PresignedUrl(presigned.url().toExternalForm(), Instant.now().plus(expiry));
    } catch (SdkException e) {
      throw new StorageException("Failed to presign attachment: " + key, e);
    }
  }

  @Override
  public String bucket() {
    return bucketName;
  }

  private static void validateKey(String key) {
    if (key == null || !S3_KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("Invalid attachment storage key: " + key);
    }
  }
}
