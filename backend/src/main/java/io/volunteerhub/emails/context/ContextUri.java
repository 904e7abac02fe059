package io.volunteerhub.emails.context;

/**
 * A single serialized context value. Either a deferred reference to a persisted entity ({@code
 * ref:<kind>#<id>}) or a literal scalar ({@code val:<type>#<literal>}).
 */
public sealed interface ContextUri permits EntityRef, ScalarValue {

  String REF_SCHEME = "ref";
  String VALUE_SCHEME = "val";

  String uri();

  /**
   * Parses a serialized URI. Everything after the first {@code #} is the id or literal, so
   * literals may themselves contain {@code #}.
   *
   * @throws InvalidContextUriException when the scheme, kind, type or id is not recognised
   */
  static ContextUri parse(String uri) {
    if (uri == null) {
      throw new InvalidContextUriException("Context URI must not be null");
    }
    int colon = uri.indexOf(':');
    int hash = uri.indexOf('#');
    if (colon < 0 || hash < colon) {
      throw new InvalidContextUriException("Malformed context URI: " + uri);
    }
    String scheme = uri.substring(0, colon);
    String path = uri.substring(colon + 1, hash);
    String fragment = uri.substring(hash + 1);

    if (REF_SCHEME.equals(scheme)) {
      return EntityRef.parse(path, fragment, uri);
    }
    if (VALUE_SCHEME.equals(scheme)) {
      var type = ScalarType.fromKey(path);
      if (type != ScalarType.NONE && type != ScalarType.STR && fragment.isEmpty()) {
        throw new InvalidContextUriException("Missing literal in context URI: " + uri);
      }
      return new ScalarValue(type, fragment);
    }
    throw new InvalidContextUriException("Unsupported context URI scheme: " + uri);
  }
}
