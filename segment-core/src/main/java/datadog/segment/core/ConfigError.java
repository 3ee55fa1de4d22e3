package datadog.segment.core;

/** A configuration problem found while building the tracer, before any span is created. */
public final class ConfigError {
  public enum Code {
    URL_MISSING_SEPARATOR,
    URL_UNSUPPORTED_SCHEME,
    URL_UNIX_DOMAIN_SOCKET_PATH_NOT_ABSOLUTE,
    NULL_COLLECTOR,
    INVALID_FLUSH_INTERVAL,
    INVALID_TAGS_HEADER_MAX_SIZE
  }

  private final Code code;
  private final String message;

  public ConfigError(Code code, String message) {
    this.code = code;
    this.message = message;
  }

  public Code getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return "[" + code + "] " + message;
  }
}
