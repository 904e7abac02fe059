package io.volunteerhub.emails.scheduledemail;

import io.volunteerhub.emails.trigger.TriggerKind;

public class MissingTemplateException extends EmailActionException {

  public MissingTemplateException(TriggerKind triggerKind) {
    super(
        "Action for "
            + triggerKind.key()
            + " not scheduled due to missing template. Add an active email template for this"
            + " trigger.");
  }
}
