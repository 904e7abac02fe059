package io.volunteerhub.emails.scheduledemail;

import io.volunteerhub.emails.attachment.Attachment;
import io.volunteerhub.emails.attachment.AttachmentService;
import io.volunteerhub.emails.emailtemplate.RenderedEmail;
import io.volunteerhub.emails.emailtemplate.ScheduledEmailRenderer;
import io.volunteerhub.emails.scheduledemail.dto.RescheduleRequest;
import io.volunteerhub.emails.scheduledemail.dto.WorkerReportRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Pull API for delivery workers: list due emails, claim one, render it, report the outcome. Also
 * exposes manual cancel and reschedule for operators.
 */
@RestController
@RequestMapping("/api/jobs")
public class ScheduledEmailWorkerController {

  private static final String WORKER_ID_HEADER = "X-WORKER-ID";
  private static final long MAX_STALE_MINUTES = 5_256_000L;

  private final ScheduledEmailWorkerService workerService;
  private final ScheduledEmailRenderer renderer;
  private final AttachmentService attachmentService;

  public ScheduledEmailWorkerController(
      ScheduledEmailWorkerService workerService,
      ScheduledEmailRenderer renderer,
      AttachmentService attachmentService) {
    this.workerService = workerService;
    this.renderer = renderer;
    this.attachmentService = attachmentService;
  }

  @GetMapping
  public ResponseEntity<Page<ScheduledEmailResponse>> list(
      @RequestParam(defaultValue = "false") boolean eligible,
      @RequestParam(required = false) ScheduledEmailStatus state,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    var emails =
        eligible ? workerService.listEligible(page, size) : workerService.list(state, page, size);
    return ResponseEntity.ok(emails.map(ScheduledEmailResponse::from));
  }

  @GetMapping("/stale-locks")
  public ResponseEntity<List<ScheduledEmailResponse>> staleLocks(
      @RequestParam(defaultValue = "60") @Min(0) @Max(MAX_STALE_MINUTES) long olderThanMinutes) {
    var emails = workerService.findStaleLocks(Duration.ofMinutes(olderThanMinutes));
    return ResponseEntity.ok(emails.stream().map(ScheduledEmailResponse::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<ScheduledEmailResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(ScheduledEmailResponse.from(workerService.get(id)));
  }

  @GetMapping("/{id}/logs")
  public ResponseEntity<List<LogEntryResponse>> logs(@PathVariable UUID id) {
    return ResponseEntity.ok(
        workerService.getLogs(id).stream().map(LogEntryResponse::from).toList());
  }

  @GetMapping("/{id}/rendered")
  public ResponseEntity<RenderedEmailResponse> rendered(@PathVariable UUID id) {
    var email = workerService.get(id);
    var rendered = renderer.render(email);
    var attachments =
        attachmentService.listForEmail(id).stream().map(AttachmentResponse::from).toList();
    return ResponseEntity.ok(RenderedEmailResponse.from(rendered, attachments));
  }

  @PostMapping("/{id}/lock")
  public ResponseEntity<ScheduledEmailResponse> lock(
      @PathVariable UUID id,
      @RequestHeader(name = WORKER_ID_HEADER, required = false) UUID workerId) {
    return ResponseEntity.ok(ScheduledEmailResponse.from(workerService.lock(id, workerId)));
  }

  @PostMapping("/{id}/succeed")
  public ResponseEntity<ScheduledEmailResponse> succeed(
      @PathVariable UUID id,
      @Valid @RequestBody(required = false) WorkerReportRequest request,
      @RequestHeader(name = WORKER_ID_HEADER, required = false) UUID workerId) {
    var details = request != null ? request.details() : null;
    return ResponseEntity.ok(
        ScheduledEmailResponse.from(workerService.succeed(id, details, workerId)));
  }

  @PostMapping("/{id}/fail")
  public ResponseEntity<ScheduledEmailResponse> fail(
      @PathVariable UUID id,
      @Valid @RequestBody(required = false) WorkerReportRequest request,
      @RequestHeader(name = WORKER_ID_HEADER, required = false) UUID workerId) {
    var details = request != null ? request.details() : null;
    return ResponseEntity.ok(
        ScheduledEmailResponse.from(workerService.fail(id, details, workerId)));
  }

  @PostMapping("/{id}/cancel")
  public ResponseEntity<ScheduledEmailResponse> cancel(
      @PathVariable UUID id,
      @Valid @RequestBody(required = false) WorkerReportRequest request,
      @RequestHeader(name = WORKER_ID_HEADER, required = false) UUID authorId) {
    var details = request != null ? request.details() : null;
    return ResponseEntity.ok(
        ScheduledEmailResponse.from(workerService.cancel(id, details, authorId)));
  }

  @PostMapping("/{id}/reschedule")
  public ResponseEntity<ScheduledEmailResponse> reschedule(
      @PathVariable UUID id,
      @Valid @RequestBody RescheduleRequest request,
      @RequestHeader(name = WORKER_ID_HEADER, required = false) UUID authorId) {
    var email = workerService.reschedule(id, request.scheduledAt(), request.details(), authorId);
    return ResponseEntity.ok(ScheduledEmailResponse.from(email));
  }

  // --- DTOs ---

  public record ScheduledEmailResponse(
      UUID id,
      String trigger,
      String state,
      Instant scheduledAt,
      String subjectKind,
      UUID subjectId,
      UUID templateId,
      Map<String, Object> context,
      List<String> toHeader,
      List<Map<String, String>> toHeaderContext,
      UUID authorId,
      long version,
      Instant createdAt,
      Instant updatedAt) {

    public static ScheduledEmailResponse from(ScheduledEmail email) {
      return new ScheduledEmailResponse(
          email.getId(),
          email.getTriggerKind().key(),
          email.getState().name(),
          email.getScheduledAt(),
          email.getSubject().getKind().key(),
          email.getSubject().getId(),
          email.getTemplateId(),
          email.getContext(),
          email.getToHeader(),
          email.getToHeaderContext(),
          email.getAuthorId(),
          email.getVersion(),
          email.getCreatedAt(),
          email.getUpdatedAt());
    }
  }

  public record LogEntryResponse(
      UUID id,
      String stateBefore,
      String stateAfter,
      String details,
      UUID authorId,
      Instant createdAt) {

    public static LogEntryResponse from(ScheduledEmailLog entry) {
      return new LogEntryResponse(
          entry.getId(),
          entry.getStateBefore() != null ? entry.getStateBefore().name() : null,
          entry.getStateAfter().name(),
          entry.getDetails(),
          entry.getAuthorId(),
          entry.getCreatedAt());
    }
  }

  public record AttachmentResponse(
      UUID id, String filename, String contentType, long sizeBytes, Instant createdAt) {

    public static AttachmentResponse from(Attachment attachment) {
      return new AttachmentResponse(
          attachment.getId(),
          attachment.getFilename(),
          attachment.getContentType(),
          attachment.getSizeBytes(),
          attachment.getCreatedAt());
    }
  }

  public record RenderedEmailResponse(
      UUID scheduledEmailId,
      String from,
      String replyTo,
      List<String> to,
      List<String> cc,
      List<String> bcc,
      String subject,
      String body,
      List<AttachmentResponse> attachments) {

    public static RenderedEmailResponse from(
        RenderedEmail rendered, List<AttachmentResponse> attachments) {
      return new RenderedEmailResponse(
          rendered.scheduledEmailId(),
          rendered.from(),
          rendered.replyTo(),
          rendered.to(),
          rendered.cc(),
          rendered.bcc(),
          rendered.subject(),
          rendered.body(),
          attachments);
    }
  }
}
