package io.volunteerhub.emails.scheduledemail;

/**
 * The stored scheduled emails contradict what the evaluator saw: none left to update or cancel, or
 * more than one scheduled for the same trigger and subject.
 */
public class InconsistentStateException extends EmailActionException {

  public InconsistentStateException(String message) {
    super(message);
  }

  public InconsistentStateException(String message, Throwable cause) {
    super(message, cause);
  }
}
