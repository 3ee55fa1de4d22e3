package datadog.segment.core;

/** Thrown by {@link CoreTracer.CoreTracerBuilder#build()} when the configuration is invalid. */
public class ConfigurationException extends RuntimeException {
  private final ConfigError error;

  public ConfigurationException(ConfigError error) {
    super(error.toString());
    this.error = error;
  }

  public ConfigError getError() {
    return error;
  }
}
