package io.volunteerhub.emails.context;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns a serialized context back into template variables. References are resolved against the
 * current database state on every call, so a rendered email always reflects the latest values.
 */
@Component
public class ContextSerializer {

  private final ResolverRegistry resolverRegistry;

  public ContextSerializer(ResolverRegistry resolverRegistry) {
    this.resolverRegistry = resolverRegistry;
  }

  /**
   * Resolves every entry of a stored context. Single URIs become a map (entity) or a scalar; lists
   * become lists of the same.
   *
   * @throws DanglingReferenceException when a referenced entity cannot be loaded
   * @throws InvalidContextUriException when an entry is not a valid URI or list of URIs
   */
  public Map<String, Object> resolveContext(Map<String, Object> context) {
    var resolved = new LinkedHashMap<String, Object>();
    if (context == null) {
      return resolved;
    }
    context.forEach((name, raw) -> resolved.put(name, resolveEntry(name, raw)));
    return resolved;
  }

  /**
   * Resolves recipient links into concrete addresses, in stored order.
   *
   * @throws DanglingReferenceException when a referenced entity or its property is missing
   */
  public List<String> resolveRecipients(List<Map<String, String>> links) {
    var addresses = new ArrayList<String>();
    if (links == null) {
      return addresses;
    }
    for (var raw : links) {
      var link = RecipientLink.fromMap(raw);
      if (link.isReference()) {
        var parsed = ContextUri.parse(link.ref());
        if (!(parsed instanceof EntityRef ref)) {
          throw new InvalidContextUriException(
              "Recipient link must reference an entity: " + link.ref());
        }
        var entity = resolverRegistry.resolve(ref);
        var address = entity.get(link.property());
        if (address == null || address.toString().isBlank()) {
          throw new DanglingReferenceException(
              link.ref(), "Property '" + link.property() + "' is missing on " + link.ref());
        }
        addresses.add(address.toString());
      } else {
        addresses.add(String.valueOf(decodeScalar(link.value())));
      }
    }
    return addresses;
  }

  /** Decodes a {@code val:} URI into its Java value. */
  public Object decodeScalar(String uri) {
    if (!(ContextUri.parse(uri) instanceof ScalarValue scalar)) {
      throw new InvalidContextUriException("Expected a scalar value URI: " + uri);
    }
    return scalar.value();
  }

  /** Encodes a Java value as a {@code val:} URI. */
  public String encodeScalar(Object value) {
    return ScalarValue.of(value).uri();
  }

  private Object resolveEntry(String name, Object raw) {
    if (raw instanceof String uri) {
      return resolveSingle(uri);
    }
    if (raw instanceof List<?> list) {
      var values = new ArrayList<>(list.size());
      for (var item : list) {
        if (!(item instanceof String uri)) {
          throw new InvalidContextUriException(
              "Context entry '" + name + "' contains a non-string element");
        }
        values.add(resolveSingle(uri));
      }
      return values;
    }
    throw new InvalidContextUriException(
        "Context entry '" + name + "' must be a URI or a list of URIs");
  }

  private Object resolveSingle(String uri) {
    var parsed = ContextUri.parse(uri);
    if (parsed instanceof EntityRef ref) {
      return resolverRegistry.resolve(ref);
    }
    return ((ScalarValue) parsed).value();
  }
}
