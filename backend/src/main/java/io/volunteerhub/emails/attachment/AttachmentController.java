package io.volunteerhub.emails.attachment;

import io.volunteerhub.emails.attachment.dto.PresignedUrlRequest;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AttachmentController {

  private final AttachmentService attachmentService;

  public AttachmentController(AttachmentService attachmentService) {
    this.attachmentService = attachmentService;
  }

  @PostMapping("/api/attachments/{id}/presigned-url")
  public ResponseEntity<PresignedUrlResponse> generatePresignedUrl(
      @PathVariable UUID id, @Valid @RequestBody PresignedUrlRequest request) {
    var presigned = attachmentService.generatePresignedUrl(id, request.expirationSeconds());
    return ResponseEntity.ok(new PresignedUrlResponse(id, presigned.url(), presigned.expiresAt()));
  }

  public record PresignedUrlResponse(UUID attachmentId, String url, Instant expiresAt) {}
}
