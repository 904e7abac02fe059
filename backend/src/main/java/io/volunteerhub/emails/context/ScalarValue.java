package io.volunteerhub.emails.context;

/** A literal scalar stored verbatim in the context. */
public record ScalarValue(ScalarType type, String literal) implements ContextUri {

  public static ScalarValue of(Object value) {
    var type = ScalarType.of(value);
    return new ScalarValue(type, type.format(value));
  }

  public static ScalarValue none() {
    return new ScalarValue(ScalarType.NONE, "");
  }

  @Override
  public String uri() {
    return VALUE_SCHEME + ":" + type.key() + "#" + literal;
  }

  public Object value() {
    return type.parse(literal);
  }
}
