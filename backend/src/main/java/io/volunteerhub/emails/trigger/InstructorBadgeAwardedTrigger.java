package io.volunteerhub.emails.trigger;

import io.volunteerhub.emails.config.EmailsProperties;
import io.volunteerhub.emails.context.ContextBuilder;
import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.context.EntityRef;
import io.volunteerhub.emails.exception.ResourceNotFoundException;
import io.volunteerhub.emails.scheduledemail.ScheduledEmail;
import io.volunteerhub.emails.workshop.AwardRepository;
import io.volunteerhub.emails.workshop.PersonRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Congratulates a person on receiving the instructor badge. Subject: the award. */
@Component
public class InstructorBadgeAwardedTrigger implements EmailTrigger {

  private static final Logger log = LoggerFactory.getLogger(InstructorBadgeAwardedTrigger.class);

  private final AwardRepository awardRepository;
  private final PersonRepository personRepository;
  private final EmailsProperties properties;

  public InstructorBadgeAwardedTrigger(
      AwardRepository awardRepository,
      PersonRepository personRepository,
      EmailsProperties properties) {
    this.awardRepository = awardRepository;
    this.personRepository = personRepository;
    this.properties = properties;
  }

  @Override
  public TriggerKind kind() {
    return TriggerKind.INSTRUCTOR_BADGE_AWARDED;
  }

  @Override
  public boolean shouldExist(UUID awardId) {
    var award = awardRepository.findById(awardId);
    boolean awardExists = award.isPresent();
    boolean instructorAward = award.map(a -> a.isInstructorBadge()).orElse(false);

    log.debug(
        "Evaluating {}: award={}, awardExists={}, instructorAward={}",
        kind().key(),
        awardId,
        awardExists,
        instructorAward);
    return awardExists && instructorAward;
  }

  @Override
  public EmailAction buildAction(UUID awardId, Optional<ScheduledEmail> existing) {
    var award =
        awardRepository
            .findById(awardId)
            .orElseThrow(() -> new ResourceNotFoundException("Award", awardId));
    var person =
        personRepository
            .findById(award.getPersonId())
            .orElseThrow(() -> new ResourceNotFoundException("Person", award.getPersonId()));

    var context =
        ContextBuilder.create()
            .ref("person", Recipients.personRef(person))
            .ref("award", EntityRef.of(EntityKind.AWARD, award.getId()))
            .value("award_id", award.getId().toString())
            .build();

    return new EmailAction(
        existing
            .map(ScheduledEmail::getScheduledAt)
            .orElseGet(() -> Instant.now().plus(properties.immediateDelay())),
        context,
        Recipients.addressesOf(List.of(person)),
        Recipients.linksOf(List.of(person)));
  }
}
