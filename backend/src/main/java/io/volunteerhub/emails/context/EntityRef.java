package io.volunteerhub.emails.context;

import java.util.UUID;

/** Reference to a persisted entity, resolved to its current field values at render time. */
public record EntityRef(EntityKind kind, UUID id) implements ContextUri {

  public static EntityRef of(EntityKind kind, UUID id) {
    return new EntityRef(kind, id);
  }

  @Override
  public String uri() {
    return REF_SCHEME + ":" + kind.key() + "#" + id;
  }

  static EntityRef parse(String kindKey, String id, String uri) {
    var kind = EntityKind.fromKey(kindKey);
    try {
      return new EntityRef(kind, UUID.fromString(id));
    } catch (IllegalArgumentException e) {
      throw new InvalidContextUriException("Invalid entity id in context URI: " + uri);
    }
  }
}
