package io.volunteerhub.emails.context;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Maps each {@link EntityKind} to the resolver able to load it. */
@Component
public class ResolverRegistry {

  private final Map<EntityKind, EntityResolver> resolvers = new EnumMap<>(EntityKind.class);

  public ResolverRegistry(List<EntityResolver> resolvers) {
    for (var resolver : resolvers) {
      var previous = this.resolvers.put(resolver.kind(), resolver);
      if (previous != null) {
        throw new IllegalStateException(
            "Two resolvers registered for entity kind " + resolver.kind().key());
      }
    }
  }

  public boolean supports(EntityKind kind) {
    return resolvers.containsKey(kind);
  }

  public Map<String, Object> resolve(EntityRef ref) {
    var resolver = resolvers.get(ref.kind());
    if (resolver == null) {
      throw new DanglingReferenceException(
          ref.uri(), "No resolver registered for entity kind " + ref.kind().key());
    }
    return resolver
        .load(ref.id())
        .orElseThrow(
            () ->
                new DanglingReferenceException(
                    ref.uri(), ref.kind().key() + " " + ref.id() + " no longer exists"));
  }
}
