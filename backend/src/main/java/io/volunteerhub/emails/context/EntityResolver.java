package io.volunteerhub.emails.context;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Loads the current state of one kind of entity as a flat map of template variables. Resolvers
 * are Spring beans collected into the {@link ResolverRegistry}.
 */
public interface EntityResolver {

  EntityKind kind();

  /**
   * @return the entity's exposed fields keyed by camelCase name, or empty when it no longer exists
   */
  Optional<Map<String, Object>> load(UUID id);
}
