package io.volunteerhub.emails.attachment;

import io.volunteerhub.emails.config.EmailsProperties;
import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.scheduledemail.ScheduledEmailCreatedEvent;
import io.volunteerhub.emails.trigger.TriggerKind;
import io.volunteerhub.emails.workshop.AwardRepository;
import io.volunteerhub.emails.workshop.PersonRepository;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;
import org.thymeleaf.context.Context;

/**
 * Attaches an instructor certificate PDF to every newly scheduled instructor-badge email. Runs
 * after the email's transaction commits. Failures are logged and leave the email untouched; the
 * email is then sent without a certificate.
 */
@Component
public class InstructorCertificateGenerator {

  private static final Logger log = LoggerFactory.getLogger(InstructorCertificateGenerator.class);
  static final String TEMPLATE_NAME = "certificates/instructor-certificate";
  static final String FILENAME = "certificate.pdf";
  private static final DateTimeFormatter AWARD_DATE_FORMAT =
      DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH);

  private final AwardRepository awardRepository;
  private final PersonRepository personRepository;
  private final AttachmentService attachmentService;
  private final CertificatePdfRenderer pdfRenderer;
  private final EmailsProperties properties;
  private final TransactionTemplate transactionTemplate;

  public InstructorCertificateGenerator(
      AwardRepository awardRepository,
      PersonRepository personRepository,
      AttachmentService attachmentService,
      CertificatePdfRenderer pdfRenderer,
      EmailsProperties properties,
      PlatformTransactionManager transactionManager) {
    this.awardRepository = awardRepository;
    this.personRepository = personRepository;
    this.attachmentService = attachmentService;
    this.pdfRenderer = pdfRenderer;
    this.properties = properties;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onScheduledEmailCreated(ScheduledEmailCreatedEvent event) {
    if (event.triggerKind() != TriggerKind.INSTRUCTOR_BADGE_AWARDED) {
      return;
    }
    try {
      transactionTemplate.executeWithoutResult(status -> generate(event));
    } catch (Exception e) {
      log.error(
          "Failed to generate and attach certificate for scheduled email={}, subject={}",
          event.scheduledEmailId(),
          event.subject(),
          e);
    }
  }

  void generate(ScheduledEmailCreatedEvent event) {
    if (event.subject().getKind() != EntityKind.AWARD) {
      throw new IllegalStateException(
          "Certificate subject must be an award, got " + event.subject());
    }
    var awardId = event.subject().getId();
    var award =
        awardRepository
            .findById(awardId)
            .orElseThrow(() -> new IllegalStateException("Award " + awardId + " not found"));
    var person =
        personRepository
            .findById(award.getPersonId())
            .orElseThrow(
                () -> new IllegalStateException("Person " + award.getPersonId() + " not found"));

    var ctx = new Context();
    ctx.setVariable("fullName", person.getFullName());
    ctx.setVariable("awardDate", award.getAwardedOn().format(AWARD_DATE_FORMAT));
    ctx.setVariable("signature", properties.certificateSignature());

    byte[] pdf = pdfRenderer.render(TEMPLATE_NAME, ctx);
    var attachment =
        attachmentService.attach(event.scheduledEmailId(), FILENAME, pdf, "application/pdf");

    log.info(
        "Generated certificate for scheduled email={}, attachment={}, size={}bytes",
        event.scheduledEmailId(),
        attachment.getId(),
        pdf.length);
  }
}
