package io.volunteerhub.emails.trigger;

import io.volunteerhub.emails.scheduledemail.ScheduledEmailService;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Decides CREATE, UPDATE, CANCEL or NOOP for a trigger and subject. Read-only and safe to call any
 * number of times: when a stored email already carries exactly the content the trigger would write
 * now, the result is NOOP rather than UPDATE.
 */
@Service
public class StrategyEvaluator {

  private static final Logger log = LoggerFactory.getLogger(StrategyEvaluator.class);

  private final Map<TriggerKind, EmailTrigger> triggers = new EnumMap<>(TriggerKind.class);
  private final ScheduledEmailService scheduledEmailService;

  public StrategyEvaluator(
      List<EmailTrigger> triggers, ScheduledEmailService scheduledEmailService) {
    for (var trigger : triggers) {
      if (this.triggers.put(trigger.kind(), trigger) != null) {
        throw new IllegalStateException("Two triggers registered for " + trigger.kind().key());
      }
    }
    this.scheduledEmailService = scheduledEmailService;
  }

  @Transactional(readOnly = true)
  public Evaluation evaluate(TriggerKind kind, UUID subjectId) {
    var trigger = triggers.get(kind);
    if (trigger == null) {
      throw new IllegalStateException("No trigger registered for " + kind.key());
    }
    var subject = trigger.subject(subjectId);
    var existing = scheduledEmailService.findScheduled(kind, subject);
    boolean exists = !existing.isEmpty();
    boolean shouldExist = trigger.shouldExist(subjectId);
    var strategy = Strategy.decide(exists, shouldExist);

    EmailAction action = null;
    if (strategy == Strategy.CREATE) {
      action = trigger.buildAction(subjectId, Optional.empty());
    } else if (strategy == Strategy.UPDATE) {
      var current = existing.get(0);
      action = trigger.buildAction(subjectId, Optional.of(current));
      boolean unchanged =
          current.hasSameContent(
              action.scheduledAt(),
              action.context(),
              action.recipients(),
              action.recipientLinkMaps());
      if (existing.size() == 1 && unchanged) {
        strategy = Strategy.NOOP;
        action = null;
      }
    }

    log.debug(
        "Evaluated trigger={}, subject={}: exists={}, shouldExist={}, strategy={}",
        kind.key(),
        subject,
        exists,
        shouldExist,
        strategy);
    return new Evaluation(kind, subject, exists, shouldExist, strategy, action);
  }
}
