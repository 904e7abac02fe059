package io.volunteerhub.emails.scheduledemail;

/**
 * Base for anomalies met while creating, updating or cancelling a scheduled email. These abort the
 * single action and are reported to the caller as a warning; they never roll back the caller's
 * transaction.
 */
public abstract class EmailActionException extends RuntimeException {

  protected EmailActionException(String message) {
    super(message);
  }

  protected EmailActionException(String message, Throwable cause) {
    super(message, cause);
  }
}
