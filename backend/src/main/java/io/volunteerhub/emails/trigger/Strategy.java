package io.volunteerhub.emails.trigger;

/** What to do with a trigger's scheduled email after comparing domain state with storage. */
public enum Strategy {
  CREATE,
  UPDATE,
  CANCEL,
  NOOP;

  /**
   * @param exists whether a SCHEDULED email is stored for the trigger and subject
   * @param shouldExist whether the trigger's business rules call for one
   */
  public static Strategy decide(boolean exists, boolean shouldExist) {
    if (!exists && shouldExist) {
      return CREATE;
    }
    if (exists && !shouldExist) {
      return CANCEL;
    }
    if (exists) {
      return UPDATE;
    }
    return NOOP;
  }
}
