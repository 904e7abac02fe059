package io.volunteerhub.emails.workshop;

import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.context.EntityResolver;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Exposes an award together with the awarded person under {@code person}. */
@Component
public class AwardResolver implements EntityResolver {

  private final AwardRepository awardRepository;
  private final PersonRepository personRepository;

  public AwardResolver(AwardRepository awardRepository, PersonRepository personRepository) {
    this.awardRepository = awardRepository;
    this.personRepository = personRepository;
  }

  @Override
  public EntityKind kind() {
    return EntityKind.AWARD;
  }

  @Override
  public Optional<Map<String, Object>> load(UUID id) {
    return awardRepository
        .findById(id)
        .map(
            award -> {
              Map<String, Object> map = new LinkedHashMap<>();
              map.put("id", award.getId());
              map.put("badge", award.getBadge());
              map.put("awardedOn", award.getAwardedOn());
              map.put("personId", award.getPersonId());
              map.put(
                  "person",
                  personRepository
                      .findById(award.getPersonId())
                      .map(PersonResolver::toMap)
                      .orElse(null));
              return map;
            });
  }
}
