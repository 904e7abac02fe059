package io.volunteerhub.emails.scheduledemail;

import java.util.List;

/**
 * Lifecycle of a scheduled email.
 *
 * <ul>
 *   <li>SCHEDULED → SCHEDULED (content revised in place)
 *   <li>SCHEDULED → LOCKED (claimed by a worker)
 *   <li>SCHEDULED → CANCELLED
 *   <li>FAILED → LOCKED (retry by a worker)
 *   <li>LOCKED → SUCCEEDED or FAILED (reported by the worker holding the lock)
 * </ul>
 *
 * SUCCEEDED and CANCELLED are terminal. FAILED is not.
 */
public enum ScheduledEmailStatus {
  SCHEDULED,
  LOCKED,
  SUCCEEDED,
  FAILED,
  CANCELLED;

  /** States a worker may pick up once {@code scheduledAt} has passed. */
  public static final List<ScheduledEmailStatus> ELIGIBLE = List.of(SCHEDULED, FAILED);

  public boolean canTransitionTo(ScheduledEmailStatus target) {
    return switch (this) {
      case SCHEDULED -> target == SCHEDULED || target == LOCKED || target == CANCELLED;
      case FAILED -> target == LOCKED;
      case LOCKED -> target == SUCCEEDED || target == FAILED;
      case SUCCEEDED, CANCELLED -> false;
    };
  }

  public boolean isTerminal() {
    return this == SUCCEEDED || this == CANCELLED;
  }

  public boolean isLockable() {
    return canTransitionTo(LOCKED);
  }
}
