package io.volunteerhub.emails.attachment;

/** Thrown when PDF generation fails due to rendering or I/O errors. */
public class PdfGenerationException extends RuntimeException {

  public PdfGenerationException(String detail, Throwable cause) {
    super(detail, cause);
  }
}
