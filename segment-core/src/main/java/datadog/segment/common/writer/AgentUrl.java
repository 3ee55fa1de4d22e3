package datadog.segment.common.writer;

import datadog.segment.core.ConfigError;
import java.util.Objects;

/**
 * Location of the trace agent: an HTTP(S) URL or a unix domain socket path. Supported schemes are
 * <code>http</code>, <code>https</code>, <code>unix</code>, <code>http+unix</code> and <code>
 * https+unix</code>.
 */
public final class AgentUrl {
  private static final String SEPARATOR = "://";

  private final String scheme;
  private final String authority;
  private final String path;

  private AgentUrl(String scheme, String authority, String path) {
    this.scheme = scheme;
    this.authority = authority;
    this.path = path;
  }

  /**
   * Parses an agent URL.
   *
   * @throws IllegalArgumentException carrying the {@link ConfigError} describing why the URL is
   *     invalid, see {@link #validate(String)} for the non throwing variant
   */
  public static AgentUrl parse(String url) {
    ConfigError error = validate(url);
    if (error != null) {
      throw new IllegalArgumentException(error.toString());
    }
    return doParse(url);
  }

  /** Returns why the URL is invalid, or {@code null} if it is valid. */
  public static ConfigError validate(String url) {
    if (url == null) {
      return new ConfigError(ConfigError.Code.URL_MISSING_SEPARATOR, "The agent URL is missing");
    }
    int separator = url.indexOf(SEPARATOR);
    if (separator < 0) {
      return new ConfigError(
          ConfigError.Code.URL_MISSING_SEPARATOR,
          "Datadog Agent URL is missing the \"://\" separator: \"" + url + "\"");
    }
    String scheme = url.substring(0, separator);
    switch (scheme) {
      case "http":
      case "https":
        return null;
      case "unix":
      case "http+unix":
      case "https+unix":
        String socketPath = url.substring(separator + SEPARATOR.length());
        if (!socketPath.startsWith("/")) {
          return new ConfigError(
              ConfigError.Code.URL_UNIX_DOMAIN_SOCKET_PATH_NOT_ABSOLUTE,
              "Unix domain socket paths for Datadog Agent must be absolute. The path \""
                  + socketPath
                  + "\" is not absolute.");
        }
        return null;
      default:
        return new ConfigError(
            ConfigError.Code.URL_UNSUPPORTED_SCHEME,
            "Unsupported URI scheme \""
                + scheme
                + "\" in Datadog Agent URL \""
                + url
                + "\". The following are supported: http https unix http+unix https+unix");
    }
  }

  private static AgentUrl doParse(String url) {
    int separator = url.indexOf(SEPARATOR);
    String scheme = url.substring(0, separator);
    String rest = url.substring(separator + SEPARATOR.length());
    if (isUnixDomainSocket(scheme)) {
      return new AgentUrl(scheme, rest, "");
    }
    int slash = rest.indexOf('/');
    if (slash < 0) {
      return new AgentUrl(scheme, rest, "");
    }
    return new AgentUrl(scheme, rest.substring(0, slash), rest.substring(slash));
  }

  private static boolean isUnixDomainSocket(String scheme) {
    return scheme.endsWith("unix");
  }

  public String getScheme() {
    return scheme;
  }

  /** The host and port, or the socket path for a unix domain socket. */
  public String getAuthority() {
    return authority;
  }

  public String getPath() {
    return path;
  }

  public boolean isUnixDomainSocket() {
    return isUnixDomainSocket(scheme);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof AgentUrl)) return false;
    AgentUrl agentUrl = (AgentUrl) o;
    return scheme.equals(agentUrl.scheme)
        && authority.equals(agentUrl.authority)
        && path.equals(agentUrl.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(scheme, authority, path);
  }

  @Override
  public String toString() {
    return scheme + SEPARATOR + authority + path;
  }
}
