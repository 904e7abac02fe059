package io.volunteerhub.emails.workshop;

import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.context.EntityResolver;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class WorkshopResolver implements EntityResolver {

  private final WorkshopRepository workshopRepository;

  public WorkshopResolver(WorkshopRepository workshopRepository) {
    this.workshopRepository = workshopRepository;
  }

  @Override
  public EntityKind kind() {
    return EntityKind.WORKSHOP;
  }

  @Override
  public Optional<Map<String, Object>> load(UUID id) {
    return workshopRepository.findById(id).map(WorkshopResolver::toMap);
  }

  static Map<String, Object> toMap(Workshop workshop) {
    var map = new LinkedHashMap<String, Object>();
    map.put("id", workshop.getId());
    map.put("slug", workshop.getSlug());
    map.put("venue", workshop.getVenue());
    map.put("startDate", workshop.getStartDate());
    map.put("endDate", workshop.getEndDate());
    map.put("administratorDomain", workshop.getAdministratorDomain());
    map.put("tags", workshop.getTags() != null ? List.copyOf(workshop.getTags()) : List.of());
    return map;
  }
}
