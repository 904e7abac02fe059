package io.volunteerhub.emails.workshop;

import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.context.EntityResolver;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class PersonResolver implements EntityResolver {

  private final PersonRepository personRepository;

  public PersonResolver(PersonRepository personRepository) {
    this.personRepository = personRepository;
  }

  @Override
  public EntityKind kind() {
    return EntityKind.PERSON;
  }

  @Override
  public Optional<Map<String, Object>> load(UUID id) {
    return personRepository.findById(id).map(PersonResolver::toMap);
  }

  static Map<String, Object> toMap(Person person) {
    var map = new LinkedHashMap<String, Object>();
    map.put("id", person.getId());
    map.put("personalName", person.getPersonalName());
    map.put("familyName", person.getFamilyName());
    map.put("fullName", person.getFullName());
    map.put("email", person.getEmail());
    return map;
  }
}
