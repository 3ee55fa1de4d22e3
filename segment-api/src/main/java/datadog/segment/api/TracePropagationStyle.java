package datadog.segment.api;

import java.util.Locale;

/** Trace propagation styles for injecting and extracting trace propagation headers. */
public enum TracePropagationStyle {
  // Datadog context propagation style
  DATADOG,
  // B3 multi header context propagation style
  // https://github.com/openzipkin/b3-propagation/tree/master#multiple-headers
  B3MULTI,
  // W3C trace context propagation style
  // https://www.w3.org/TR/trace-context-1/
  TRACECONTEXT,
  // None does not extract or inject
  NONE;

  public static TracePropagationStyle valueOfDisplayName(String displayName) {
    String convertedName = displayName.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
    // Other names for cross tracer compatibility
    switch (convertedName) {
      case "B3":
      case "B3_MULTI":
        return B3MULTI;
      case "W3C":
        return TRACECONTEXT;
      default:
        return TracePropagationStyle.valueOf(convertedName);
    }
  }

  private String displayName;

  @Override
  public String toString() {
    String string = displayName;
    if (displayName == null) {
      string = displayName = name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
    return string;
  }
}
