package io.volunteerhub.emails.context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a scheduled email's recipient list. Either points at a property of a referenced
 * entity ({@code ref} + {@code property}), read when the email is rendered, or carries a literal
 * address as a scalar URI ({@code value}).
 */
public record RecipientLink(String ref, String property, String value) {

  private static final String REF_KEY = "ref";
  private static final String PROPERTY_KEY = "property";
  private static final String VALUE_KEY = "value";

  public RecipientLink {
    boolean isRef = ref != null && property != null && value == null;
    boolean isValue = ref == null && property == null && value != null;
    if (!isRef && !isValue) {
      throw new InvalidContextUriException(
          "Recipient link needs either ref and property, or a value");
    }
  }

  public static RecipientLink ofProperty(EntityRef ref, String property) {
    return new RecipientLink(ref.uri(), property, null);
  }

  public static RecipientLink ofAddress(String address) {
    return new RecipientLink(null, null, ScalarValue.of(address).uri());
  }

  public boolean isReference() {
    return ref != null;
  }

  public Map<String, String> toMap() {
    var map = new LinkedHashMap<String, String>();
    if (isReference()) {
      map.put(REF_KEY, ref);
      map.put(PROPERTY_KEY, property);
    } else {
      map.put(VALUE_KEY, value);
    }
    return map;
  }

  public static RecipientLink fromMap(Map<String, String> map) {
    return new RecipientLink(map.get(REF_KEY), map.get(PROPERTY_KEY), map.get(VALUE_KEY));
  }
}
