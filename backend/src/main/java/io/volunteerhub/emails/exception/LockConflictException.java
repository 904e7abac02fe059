package io.volunteerhub.emails.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Another worker claimed the scheduled email first, or it is no longer claimable. Workers should
 * move on to the next eligible email instead of retrying this one.
 */
public class LockConflictException extends ErrorResponseException {

  private final UUID scheduledEmailId;

  public LockConflictException(UUID scheduledEmailId, String currentState) {
    super(HttpStatus.CONFLICT, createProblem(scheduledEmailId, currentState), null);
    this.scheduledEmailId = scheduledEmailId;
  }

  public UUID getScheduledEmailId() {
    return scheduledEmailId;
  }

  private static ProblemDetail createProblem(UUID id, String currentState) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Lock conflict");
    problem.setDetail(
        "Scheduled email " + id + " cannot be locked, its state is " + currentState);
    problem.setProperty("reason", "lock_conflict");
    problem.setProperty("state", currentState);
    return problem;
  }
}
