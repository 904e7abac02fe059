package io.volunteerhub.emails.emailtemplate;

import io.volunteerhub.emails.context.ContextSerializer;
import io.volunteerhub.emails.scheduledemail.ScheduledEmail;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateProcessingException;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

/**
 * Resolves a scheduled email's stored context and renders its template. Runs at send time, so the
 * output reflects the referenced entities as they are now, not as they were when the email was
 * scheduled.
 *
 * <p>Uses a dedicated Thymeleaf engine in TEXT mode with a StringTemplateResolver, separate from
 * Spring's autoconfigured engine that serves classpath templates.
 */
@Service
public class ScheduledEmailRenderer {

  private static final Logger log = LoggerFactory.getLogger(ScheduledEmailRenderer.class);

  private final EmailTemplateRepository templateRepository;
  private final ContextSerializer contextSerializer;
  private final TemplateEngine textTemplateEngine;

  public ScheduledEmailRenderer(
      EmailTemplateRepository templateRepository, ContextSerializer contextSerializer) {
    this.templateRepository = templateRepository;
    this.contextSerializer = contextSerializer;
    this.textTemplateEngine = createTextTemplateEngine();
  }

  /**
   * @throws io.volunteerhub.emails.context.DanglingReferenceException when a reference no longer
   *     resolves
   * @throws TemplateRenderingException when the template is gone or fails to render
   */
  @Transactional(readOnly = true)
  public RenderedEmail render(ScheduledEmail email) {
    var template =
        templateRepository
            .findById(email.getTemplateId())
            .orElseThrow(
                () ->
                    new TemplateRenderingException(
                        "Template "
                            + email.getTemplateId()
                            + " of scheduled email "
                            + email.getId()
                            + " no longer exists",
                        null));

    var context = contextSerializer.resolveContext(email.getContext());
    var to = contextSerializer.resolveRecipients(email.getToHeaderContext());

    var rendered =
        new RenderedEmail(
            email.getId(),
            renderText(template.getFromHeader(), context),
            renderText(template.getReplyToHeader(), context),
            to,
            renderAll(template.getCcHeader(), context),
            renderAll(template.getBccHeader(), context),
            renderText(template.getSubject(), context),
            renderText(template.getBody(), context));

    log.debug(
        "Rendered scheduled email: id={}, template={}, recipients={}",
        email.getId(),
        template.getName(),
        to.size());
    return rendered;
  }

  public String renderText(String templateContent, Map<String, Object> context) {
    if (templateContent == null) {
      return null;
    }
    var ctx = new Context();
    context.forEach(ctx::setVariable);
    try {
      return textTemplateEngine.process(templateContent, ctx);
    } catch (TemplateProcessingException e) {
      throw new TemplateRenderingException("Failed to render email template: " + e.getMessage(), e);
    }
  }

  private List<String> renderAll(List<String> templates, Map<String, Object> context) {
    if (templates == null) {
      return List.of();
    }
    return templates.stream()
        .map(t -> renderText(t, context))
        .filter(value -> value != null && !value.isBlank())
        .toList();
  }

  private static TemplateEngine createTextTemplateEngine() {
    var engine = new TemplateEngine();
    var resolver = new StringTemplateResolver();
    resolver.setTemplateMode(TemplateMode.TEXT);
    resolver.setCacheable(false);
    engine.setTemplateResolver(resolver);
    return engine;
  }
}
