package datadog.segment.api.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads settings from an ordered list of {@link Source}s, the first one with a value wins. */
public final class ConfigProvider {
  private static final Logger log = LoggerFactory.getLogger(ConfigProvider.class);

  private final Source[] sources;

  private ConfigProvider(Source... sources) {
    this.sources = sources;
  }

  // Read order: System Properties -> Env Variables
  public static ConfigProvider createDefault() {
    return new ConfigProvider(new SystemPropertiesConfigSource(), new EnvironmentConfigSource());
  }

  // Read order: Properties -> System Properties -> Env Variables
  public static ConfigProvider withPropertiesOverride(Properties properties) {
    return new ConfigProvider(
        new PropertiesConfigSource(properties),
        new SystemPropertiesConfigSource(),
        new EnvironmentConfigSource());
  }

  public static ConfigProvider of(Source... sources) {
    return new ConfigProvider(sources);
  }

  public String getString(String key) {
    return getString(key, null);
  }

  public String getString(String key, String defaultValue, String... aliases) {
    for (Source source : sources) {
      String value = source.get(key, aliases);
      if (value != null) {
        return value;
      }
    }
    return defaultValue;
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    // "1" and "true" are both accepted, anything else is false
    return "1".equals(value.trim()) || Boolean.parseBoolean(value.trim());
  }

  public int getInteger(String key, int defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid configuration for {}: '{}' is not an integer", key, value);
      return defaultValue;
    }
  }

  public Double getDouble(String key, Double defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid configuration for {}: '{}' is not a number", key, value);
      return defaultValue;
    }
  }

  /** Returns the comma or space separated values of the setting, empty if unset. */
  @Nonnull
  public List<String> getList(String key) {
    String value = getString(key);
    if (value == null || value.trim().isEmpty()) {
      return Collections.emptyList();
    }
    List<String> result = new ArrayList<>();
    for (String item : value.split("[,\\s]+")) {
      if (!item.isEmpty()) {
        result.add(item);
      }
    }
    return result;
  }

  /** A place settings are read from. */
  public abstract static class Source {
    protected abstract String get(String key);

    final String get(String key, String... aliases) {
      String value = get(key);
      if (value != null) {
        return value;
      }
      for (String alias : aliases) {
        value = get(alias);
        if (value != null) {
          return value;
        }
      }
      return null;
    }
  }

  /**
   * Converts the property name, e.g. 'service.name' into a public system property name, e.g.
   * `dd.service.name`.
   */
  @Nonnull
  static String propertyNameToSystemPropertyName(String setting) {
    return "dd." + setting;
  }

  /**
   * Converts the property name, e.g. 'service.name' into a public environment variable name, e.g.
   * `DD_SERVICE_NAME`.
   */
  @Nonnull
  static String propertyNameToEnvironmentVariableName(String setting) {
    return "DD_" + setting.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }

  static final class SystemPropertiesConfigSource extends Source {
    @Override
    protected String get(String key) {
      return System.getProperty(propertyNameToSystemPropertyName(key));
    }
  }

  static final class EnvironmentConfigSource extends Source {
    @Override
    protected String get(String key) {
      return System.getenv(propertyNameToEnvironmentVariableName(key));
    }
  }

  /** Properties use the bare setting names, without the <code>dd.</code> prefix. */
  public static final class PropertiesConfigSource extends Source {
    private final Properties properties;

    public PropertiesConfigSource(Properties properties) {
      this.properties = properties;
    }

    @Override
    protected String get(String key) {
      return properties.getProperty(key);
    }
  }

  @Override
  public String toString() {
    return "ConfigProvider{sources=" + Arrays.toString(sources) + '}';
  }
}
