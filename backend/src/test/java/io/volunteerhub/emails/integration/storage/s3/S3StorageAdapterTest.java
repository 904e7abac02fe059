package io.volunteerhub.emails.integration.storage.s3;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.volunteerhub.emails.config.S3Config.S3Properties;
import io.volunteerhub.emails.integration.storage.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

@ExtendWith(MockitoExtension.class)
class S3StorageAdapterTest {

  private static final String KEY = "scheduled-emails/email-1/object-1/certificate.pdf";

  @Mock private S3Client s3Client;
  @Mock private S3Presigner s3Presigner;

  private S3StorageAdapter adapter;

  @BeforeEach
  void setUp() {
    adapter =
        new S3StorageAdapter(
            s3Client, s3Presigner, new S3Properties(null, "us-east-1", "attachments"));
  }

  @Test
  void upload_putsObjectIntoConfiguredBucket() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenReturn(PutObjectResponse.builder().build());

    var key = adapter.upload(KEY, new byte[] {1, 2, 3}, "application/pdf");

    var request = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3Client).putObject(request.capture(), any(RequestBody.class));
    assertThat(key).isEqualTo(KEY);
    assertThat(request.getValue().bucket()).isEqualTo("attachments");
    assertThat(request.getValue().contentType()).isEqualTo("application/pdf");
    assertThat(adapter.bucket()).isEqualTo("attachments");
  }

  @Test
  void upload_wrapsSdkFailures() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenThrow(SdkClientException.create("connection refused"));

    assertThatThrownBy(() -> adapter.upload(KEY, new byte[] {1}, "application/pdf"))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining(KEY);
  }

  @Test
  void rejectsKeysOutsideAttachmentLayout() {
    assertThatThrownBy(() -> adapter.upload("../etc/passwd", new byte[] {1}, "text/plain"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> adapter.delete("scheduled-emails/only-one-level"))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(s3Client, s3Presigner);
  }

  @Test
  void delete_swallowsSdkFailures() {
    when(s3Client.deleteObject(any(DeleteObjectRequest.class)))
        .thenThrow(SdkClientException.create("timeout"));

    adapter.delete(KEY);

    verify(s3Client).deleteObject(any(DeleteObjectRequest.class));
  }
}
