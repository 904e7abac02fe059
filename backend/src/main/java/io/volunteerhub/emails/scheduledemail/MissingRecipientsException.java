package io.volunteerhub.emails.scheduledemail;

import io.volunteerhub.emails.trigger.TriggerKind;

public class MissingRecipientsException extends EmailActionException {

  public MissingRecipientsException(TriggerKind triggerKind) {
    super("Action for " + triggerKind.key() + " not scheduled due to missing recipients.");
  }
}
