package io.volunteerhub.emails.context;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;

/**
 * Scalar types that can be stored verbatim inside a context. Each type knows how to write a Java
 * value as a literal and how to read it back.
 */
public enum ScalarType {
  STR("str"),
  INT("int"),
  FLOAT("float"),
  BOOL("bool"),
  DATE("date"),
  NONE("none");

  private final String key;

  ScalarType(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  public static ScalarType fromKey(String key) {
    return Arrays.stream(values())
        .filter(type -> type.key.equals(key))
        .findFirst()
        .orElseThrow(() -> new InvalidContextUriException("Unsupported scalar type: " + key));
  }

  /**
   * Picks the scalar type for a Java value. Numbers must be {@link Long} (INT) or {@link Double}
   * (FLOAT), the types {@link #parse} reads back, so a stored value always decodes to an equal
   * object. Other numeric types are rejected.
   */
  public static ScalarType of(Object value) {
    if (value == null) {
      return NONE;
    }
    if (value instanceof String) {
      return STR;
    }
    if (value instanceof Long) {
      return INT;
    }
    if (value instanceof Double) {
      return FLOAT;
    }
    if (value instanceof Boolean) {
      return BOOL;
    }
    if (value instanceof LocalDate) {
      return DATE;
    }
    throw new IllegalArgumentException(
        "Value of type " + value.getClass().getName() + " cannot be stored as a scalar");
  }

  String format(Object value) {
    return switch (this) {
      case NONE -> "";
      case DATE -> ((LocalDate) value).toString();
      default -> String.valueOf(value);
    };
  }

  /**
   * Reads a literal back. INT yields a {@link Long}, FLOAT a {@link Double}, DATE a {@link
   * LocalDate}. BOOL accepts {@code true}, {@code t} and {@code 1} (case-insensitive) as true and
   * anything else as false.
   */
  Object parse(String literal) {
    try {
      return switch (this) {
        case STR -> literal;
        case INT -> Long.parseLong(literal);
        case FLOAT -> Double.parseDouble(literal);
        case BOOL -> switch (literal.toLowerCase(Locale.ROOT)) {
          case "true", "t", "1" -> true;
          default -> false;
        };
        case DATE -> LocalDate.parse(literal);
        case NONE -> null;
      };
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new InvalidContextUriException(
          "Failed to parse '" + literal + "' as " + key + ": " + e.getMessage());
    }
  }
}
