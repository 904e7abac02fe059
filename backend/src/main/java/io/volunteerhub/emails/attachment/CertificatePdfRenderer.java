package io.volunteerhub.emails.attachment;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateProcessingException;

/**
 * Renders classpath certificate templates with Spring's Thymeleaf engine and converts the XHTML
 * output to PDF with OpenHTMLToPDF.
 */
@Component
public class CertificatePdfRenderer {

  private final TemplateEngine templateEngine;

  public CertificatePdfRenderer(TemplateEngine templateEngine) {
    this.templateEngine = templateEngine;
  }

  public byte[] render(String templateName, Context context) {
    String html;
    try {
      html = templateEngine.process(templateName, context);
    } catch (TemplateProcessingException e) {
      throw new PdfGenerationException("Failed to render certificate template " + templateName, e);
    }
    return htmlToPdf(html);
  }

  public byte[] htmlToPdf(String html) {
    try (var outputStream = new ByteArrayOutputStream()) {
      var builder = new PdfRendererBuilder();
      builder.withHtmlContent(html, null);
      builder.toStream(outputStream);
      builder.run();
      return outputStream.toByteArray();
    } catch (IOException e) {
      throw new PdfGenerationException("Failed to generate PDF from rendered HTML", e);
    }
  }
}
