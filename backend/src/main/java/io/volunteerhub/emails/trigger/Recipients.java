package io.volunteerhub.emails.trigger;

import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.context.EntityRef;
import io.volunteerhub.emails.context.RecipientLink;
import io.volunteerhub.emails.workshop.Person;
import java.util.Collection;
import java.util.List;

/** Recipient helpers shared by triggers. People without an email are skipped. */
final class Recipients {

  static final String EMAIL_PROPERTY = "email";

  private Recipients() {}

  static List<String> addressesOf(Collection<Person> people) {
    return people.stream().filter(Person::hasEmail).map(Person::getEmail).distinct().toList();
  }

  static List<RecipientLink> linksOf(Collection<Person> people) {
    return people.stream()
        .filter(Person::hasEmail)
        .map(Person::getId)
        .distinct()
        .map(id -> RecipientLink.ofProperty(EntityRef.of(EntityKind.PERSON, id), EMAIL_PROPERTY))
        .toList();
  }

  static EntityRef personRef(Person person) {
    return EntityRef.of(EntityKind.PERSON, person.getId());
  }
}
