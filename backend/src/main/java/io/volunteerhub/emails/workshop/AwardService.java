package io.volunteerhub.emails.workshop;

import io.volunteerhub.emails.event.AwardGrantedEvent;
import io.volunteerhub.emails.event.AwardRevokedEvent;
import io.volunteerhub.emails.exception.ResourceNotFoundException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AwardService {

  private static final Logger log = LoggerFactory.getLogger(AwardService.class);

  private final AwardRepository awardRepository;
  private final PersonRepository personRepository;
  private final ApplicationEventPublisher eventPublisher;

  public AwardService(
      AwardRepository awardRepository,
      PersonRepository personRepository,
      ApplicationEventPublisher eventPublisher) {
    this.awardRepository = awardRepository;
    this.personRepository = personRepository;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public Award grant(UUID personId, String badge, LocalDate awardedOn, UUID actorId) {
    if (!personRepository.existsById(personId)) {
      throw new ResourceNotFoundException("Person", personId);
    }
    var award = awardRepository.save(new Award(personId, badge, awardedOn, actorId));

    log.info("Granted award: id={}, person={}, badge={}", award.getId(), personId, badge);

    eventPublisher.publishEvent(
        new AwardGrantedEvent(award.getId(), personId, badge, actorId, Instant.now()));
    return award;
  }

  @Transactional
  public void revoke(UUID awardId, UUID actorId) {
    var award =
        awardRepository
            .findById(awardId)
            .orElseThrow(() -> new ResourceNotFoundException("Award", awardId));

    awardRepository.delete(award);

    log.info(
        "Revoked award: id={}, person={}, badge={}",
        award.getId(),
        award.getPersonId(),
        award.getBadge());

    eventPublisher.publishEvent(
        new AwardRevokedEvent(
            award.getId(), award.getPersonId(), award.getBadge(), actorId, Instant.now()));
  }
}
