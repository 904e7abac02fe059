package io.volunteerhub.emails.context;

import java.util.Arrays;

/** Kinds of persisted entities that scheduled emails can reference or be about. */
public enum EntityKind {
  PERSON("person"),
  AWARD("award"),
  WORKSHOP("workshop"),
  TASK("task");

  private final String key;

  EntityKind(String key) {
    this.key = key;
  }

  /** Stable identifier used inside reference URIs and the persisted subject column. */
  public String key() {
    return key;
  }

  public static EntityKind fromKey(String key) {
    return Arrays.stream(values())
        .filter(kind -> kind.key.equals(key))
        .findFirst()
        .orElseThrow(() -> new InvalidContextUriException("Unknown entity kind: " + key));
  }
}
