package io.volunteerhub.emails.trigger;

import io.volunteerhub.emails.scheduledemail.EmailActionException;
import io.volunteerhub.emails.scheduledemail.ScheduledEmailService;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point for running a trigger against one subject: evaluate, then dispatch the strategy to
 * its handler. Anomalies are returned as warnings instead of thrown.
 */
@Service
public class EmailTriggerService {

  private static final Logger log = LoggerFactory.getLogger(EmailTriggerService.class);

  private final StrategyEvaluator evaluator;
  private final ScheduledEmailService scheduledEmailService;
  private final Map<Strategy, BiFunction<Evaluation, UUID, TriggerResult>> handlers =
      new EnumMap<>(Strategy.class);

  public EmailTriggerService(
      StrategyEvaluator evaluator, ScheduledEmailService scheduledEmailService) {
    this.evaluator = evaluator;
    this.scheduledEmailService = scheduledEmailService;
    handlers.put(Strategy.CREATE, this::create);
    handlers.put(Strategy.UPDATE, this::update);
    handlers.put(Strategy.CANCEL, this::cancel);
    handlers.put(Strategy.NOOP, (evaluation, actorId) -> result(evaluation, null, List.of()));
  }

  @Transactional(noRollbackFor = EmailActionException.class)
  public TriggerResult run(TriggerKind kind, UUID subjectId, UUID actorId) {
    var evaluation = evaluator.evaluate(kind, subjectId);
    try {
      return handlers.get(evaluation.strategy()).apply(evaluation, actorId);
    } catch (EmailActionException e) {
      log.warn(
          "Trigger {} for subject {} aborted ({}): {}",
          kind.key(),
          evaluation.subject(),
          evaluation.strategy(),
          e.getMessage());
      return result(evaluation, null, List.of(TriggerMessage.warning(e.getMessage())));
    }
  }

  private TriggerResult create(Evaluation evaluation, UUID actorId) {
    var email =
        scheduledEmailService.schedule(
            evaluation.trigger(), evaluation.subject(), evaluation.action(), actorId);
    return result(
        evaluation,
        email.getId(),
        List.of(
            TriggerMessage.info(
                "Action for "
                    + evaluation.trigger().key()
                    + " scheduled to run at "
                    + email.getScheduledAt()
                    + ".")));
  }

  private TriggerResult update(Evaluation evaluation, UUID actorId) {
    var email =
        scheduledEmailService.update(
            evaluation.trigger(), evaluation.subject(), evaluation.action(), actorId);
    return result(
        evaluation,
        email.getId(),
        List.of(
            TriggerMessage.info(
                "Existing action for "
                    + evaluation.trigger().key()
                    + " was updated, now scheduled at "
                    + email.getScheduledAt()
                    + ".")));
  }

  private TriggerResult cancel(Evaluation evaluation, UUID actorId) {
    var cancelled =
        scheduledEmailService.cancel(evaluation.trigger(), evaluation.subject(), actorId);
    var messages =
        cancelled.stream()
            .map(
                email ->
                    TriggerMessage.info(
                        "Existing action for "
                            + evaluation.trigger().key()
                            + " scheduled at "
                            + email.getScheduledAt()
                            + " was cancelled."))
            .toList();
    return result(evaluation, cancelled.get(0).getId(), messages);
  }

  private TriggerResult result(
      Evaluation evaluation, UUID scheduledEmailId, List<TriggerMessage> messages) {
    return new TriggerResult(
        evaluation.trigger(),
        evaluation.subject(),
        evaluation.strategy(),
        scheduledEmailId,
        messages);
  }
}
