package io.volunteerhub.emails.workshop;

import io.volunteerhub.emails.context.EntityKind;
import io.volunteerhub.emails.context.EntityResolver;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Exposes a task with its {@code person} and {@code workshop} nested. */
@Component
public class WorkshopTaskResolver implements EntityResolver {

  private final WorkshopTaskRepository taskRepository;
  private final PersonRepository personRepository;
  private final WorkshopRepository workshopRepository;

  public WorkshopTaskResolver(
      WorkshopTaskRepository taskRepository,
      PersonRepository personRepository,
      WorkshopRepository workshopRepository) {
    this.taskRepository = taskRepository;
    this.personRepository = personRepository;
    this.workshopRepository = workshopRepository;
  }

  @Override
  public EntityKind kind() {
    return EntityKind.TASK;
  }

  @Override
  public Optional<Map<String, Object>> load(UUID id) {
    return taskRepository
        .findById(id)
        .map(
            task -> {
              Map<String, Object> map = new LinkedHashMap<>();
              map.put("id", task.getId());
              map.put("role", task.getRole().key());
              map.put(
                  "person",
                  personRepository
                      .findById(task.getPersonId())
                      .map(PersonResolver::toMap)
                      .orElse(null));
              map.put(
                  "workshop",
                  workshopRepository
                      .findById(task.getWorkshopId())
                      .map(WorkshopResolver::toMap)
                      .orElse(null));
              return map;
            });
  }
}
