package io.volunteerhub.emails.context;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles a serialized context: a map from template variable name to either one URI string or a
 * list of URI strings. Nothing is resolved here.
 */
public final class ContextBuilder {

  private final Map<String, Object> context = new LinkedHashMap<>();

  private ContextBuilder() {}

  public static ContextBuilder create() {
    return new ContextBuilder();
  }

  public ContextBuilder ref(String name, EntityRef ref) {
    context.put(name, ref.uri());
    return this;
  }

  public ContextBuilder refs(String name, Collection<EntityRef> refs) {
    context.put(name, refs.stream().map(EntityRef::uri).toList());
    return this;
  }

  public ContextBuilder value(String name, Object value) {
    context.put(name, ScalarValue.of(value).uri());
    return this;
  }

  public ContextBuilder values(String name, Collection<?> values) {
    context.put(name, values.stream().map(v -> ScalarValue.of(v).uri()).toList());
    return this;
  }

  public Map<String, Object> build() {
    var copy = new LinkedHashMap<String, Object>();
    context.forEach((k, v) -> copy.put(k, v instanceof List<?> list ? List.copyOf(list) : v));
    return copy;
  }
}
