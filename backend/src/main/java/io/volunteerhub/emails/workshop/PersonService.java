package io.volunteerhub.emails.workshop;

import io.volunteerhub.emails.event.PersonUpdatedEvent;
import io.volunteerhub.emails.exception.ResourceNotFoundException;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PersonService {

  private static final Logger log = LoggerFactory.getLogger(PersonService.class);

  private final PersonRepository personRepository;
  private final ApplicationEventPublisher eventPublisher;

  public PersonService(
      PersonRepository personRepository, ApplicationEventPublisher eventPublisher) {
    this.personRepository = personRepository;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public Person create(String personalName, String familyName, String email) {
    var person = personRepository.save(new Person(personalName, familyName, email));
    log.info("Created person: id={}", person.getId());
    return person;
  }

  @Transactional
  public Person updateContact(
      UUID personId, String personalName, String familyName, String email, UUID actorId) {
    var person =
        personRepository
            .findById(personId)
            .orElseThrow(() -> new ResourceNotFoundException("Person", personId));

    person.updateContact(personalName, familyName, email);
    person = personRepository.save(person);

    log.info("Updated person contact details: id={}", person.getId());

    eventPublisher.publishEvent(new PersonUpdatedEvent(person.getId(), actorId, Instant.now()));
    return person;
  }
}
