package datadog.segment.api;

import static datadog.segment.api.ConfigDefaults.DEFAULT_AGENT_URL;
import static datadog.segment.api.ConfigDefaults.DEFAULT_ID_GENERATION_STRATEGY;
import static datadog.segment.api.ConfigDefaults.DEFAULT_SERVICE_NAME;
import static datadog.segment.api.ConfigDefaults.DEFAULT_TRACE_128_BIT_TRACEID_GENERATION_ENABLED;
import static datadog.segment.api.ConfigDefaults.DEFAULT_TRACE_FLUSH_INTERVAL;
import static datadog.segment.api.ConfigDefaults.DEFAULT_TRACE_PROPAGATION_STYLE;
import static datadog.segment.api.ConfigDefaults.DEFAULT_TRACE_RATE_LIMIT;
import static datadog.segment.api.ConfigDefaults.DEFAULT_TRACE_REPORT_HOSTNAME;
import static datadog.segment.api.ConfigDefaults.DEFAULT_TRACE_X_DATADOG_TAGS_MAX_LENGTH;
import static datadog.segment.api.config.TracerConfig.ENV;
import static datadog.segment.api.config.TracerConfig.ID_GENERATION_STRATEGY;
import static datadog.segment.api.config.TracerConfig.SERVICE_NAME;
import static datadog.segment.api.config.TracerConfig.SPAN_SAMPLING_RULES;
import static datadog.segment.api.config.TracerConfig.SPAN_SAMPLING_RULES_FILE;
import static datadog.segment.api.config.TracerConfig.TRACE_128_BIT_TRACEID_GENERATION_ENABLED;
import static datadog.segment.api.config.TracerConfig.TRACE_AGENT_URL;
import static datadog.segment.api.config.TracerConfig.TRACE_FLUSH_INTERVAL;
import static datadog.segment.api.config.TracerConfig.TRACE_PROPAGATION_STYLE;
import static datadog.segment.api.config.TracerConfig.TRACE_PROPAGATION_STYLE_EXTRACT;
import static datadog.segment.api.config.TracerConfig.TRACE_PROPAGATION_STYLE_INJECT;
import static datadog.segment.api.config.TracerConfig.TRACE_RATE_LIMIT;
import static datadog.segment.api.config.TracerConfig.TRACE_REPORT_HOSTNAME;
import static datadog.segment.api.config.TracerConfig.TRACE_SAMPLE_RATE;
import static datadog.segment.api.config.TracerConfig.TRACE_SAMPLING_RULES;
import static datadog.segment.api.config.TracerConfig.TRACE_X_DATADOG_TAGS_MAX_LENGTH;
import static datadog.segment.api.config.TracerConfig.VERSION;

import datadog.segment.api.config.ConfigProvider;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Config reads values with the following priority:
 *
 * <ol>
 *   <li>Properties passed to {@link #get(Properties)}
 *   <li>System properties, prefixed with <code>dd.</code>
 *   <li>Environment variables, prefixed with <code>DD_</code>
 *   <li>Defaults from {@link ConfigDefaults}
 * </ol>
 *
 * <p>Keys are listed in {@link datadog.segment.api.config.TracerConfig}.
 */
public class Config {
  private static final Logger log = LoggerFactory.getLogger(Config.class);

  private static final Config INSTANCE = new Config(ConfigProvider.createDefault());

  private final String serviceName;
  private final String env;
  private final String version;
  private final String hostName;
  private final IdGenerationStrategy idGenerationStrategy;
  private final String agentUrl;
  private final double traceFlushIntervalSeconds;
  private final List<TracePropagationStyle> tracePropagationStylesToExtract;
  private final List<TracePropagationStyle> tracePropagationStylesToInject;
  private final int xDatadogTagsMaxLength;
  private final Double traceSampleRate;
  private final int traceRateLimit;
  private final String traceSamplingRules;
  private final String spanSamplingRules;
  private final String spanSamplingRulesFile;

  // Read order: System Properties -> Env Variables -> default value
  Config(final ConfigProvider configProvider) {
    serviceName = configProvider.getString(SERVICE_NAME, DEFAULT_SERVICE_NAME, "service.name");
    env = configProvider.getString(ENV);
    version = configProvider.getString(VERSION);

    boolean reportHostName =
        configProvider.getBoolean(TRACE_REPORT_HOSTNAME, DEFAULT_TRACE_REPORT_HOSTNAME);
    hostName = reportHostName ? initHostName() : null;

    String strategyName =
        configProvider.getString(ID_GENERATION_STRATEGY, DEFAULT_ID_GENERATION_STRATEGY);
    boolean trace128bitTraceIdGenerationEnabled =
        configProvider.getBoolean(
            TRACE_128_BIT_TRACEID_GENERATION_ENABLED,
            DEFAULT_TRACE_128_BIT_TRACEID_GENERATION_ENABLED);
    IdGenerationStrategy strategy =
        IdGenerationStrategy.fromName(strategyName, trace128bitTraceIdGenerationEnabled);
    if (strategy == null) {
      log.warn(
          "*** you are trying to use an unknown id generation strategy {} - falling back to RANDOM",
          strategyName);
      strategy =
          IdGenerationStrategy.fromName(
              DEFAULT_ID_GENERATION_STRATEGY, trace128bitTraceIdGenerationEnabled);
    }
    idGenerationStrategy = strategy;

    agentUrl = configProvider.getString(TRACE_AGENT_URL, DEFAULT_AGENT_URL);
    traceFlushIntervalSeconds =
        configProvider.getDouble(TRACE_FLUSH_INTERVAL, DEFAULT_TRACE_FLUSH_INTERVAL);

    List<TracePropagationStyle> common =
        parseStyles(
            configProvider.getList(TRACE_PROPAGATION_STYLE), DEFAULT_TRACE_PROPAGATION_STYLE);
    tracePropagationStylesToExtract =
        parseStyles(configProvider.getList(TRACE_PROPAGATION_STYLE_EXTRACT), common);
    tracePropagationStylesToInject =
        parseStyles(configProvider.getList(TRACE_PROPAGATION_STYLE_INJECT), common);

    xDatadogTagsMaxLength =
        configProvider.getInteger(
            TRACE_X_DATADOG_TAGS_MAX_LENGTH, DEFAULT_TRACE_X_DATADOG_TAGS_MAX_LENGTH);

    traceSampleRate = configProvider.getDouble(TRACE_SAMPLE_RATE, null);
    traceRateLimit = configProvider.getInteger(TRACE_RATE_LIMIT, DEFAULT_TRACE_RATE_LIMIT);
    traceSamplingRules = configProvider.getString(TRACE_SAMPLING_RULES);
    spanSamplingRules = configProvider.getString(SPAN_SAMPLING_RULES);
    spanSamplingRulesFile = configProvider.getString(SPAN_SAMPLING_RULES_FILE);
    if (spanSamplingRules != null && spanSamplingRulesFile != null) {
      log.warn(
          "Both {} and {} are set, {} will be ignored",
          SPAN_SAMPLING_RULES,
          SPAN_SAMPLING_RULES_FILE,
          SPAN_SAMPLING_RULES_FILE);
    }
  }

  private static List<TracePropagationStyle> parseStyles(
      List<String> names, List<TracePropagationStyle> defaultStyles) {
    if (names.isEmpty()) {
      return defaultStyles;
    }
    List<TracePropagationStyle> styles = new ArrayList<>(names.size());
    for (String name : names) {
      try {
        TracePropagationStyle style = TracePropagationStyle.valueOfDisplayName(name);
        if (!styles.contains(style)) {
          styles.add(style);
        }
      } catch (IllegalArgumentException e) {
        log.warn("Unrecognized propagation style {}, ignoring", name);
      }
    }
    return styles.isEmpty() ? defaultStyles : Collections.unmodifiableList(styles);
  }

  private static String initHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      log.debug("Unable to resolve the local host name", e);
      return null;
    }
  }

  public String getServiceName() {
    return serviceName;
  }

  public String getEnv() {
    return env;
  }

  public String getVersion() {
    return version;
  }

  /** The host name to report on root spans, {@code null} if host name reporting is disabled. */
  public String getHostName() {
    return hostName;
  }

  public IdGenerationStrategy getIdGenerationStrategy() {
    return idGenerationStrategy;
  }

  public String getAgentUrl() {
    return agentUrl;
  }

  public double getTraceFlushIntervalSeconds() {
    return traceFlushIntervalSeconds;
  }

  public List<TracePropagationStyle> getTracePropagationStylesToExtract() {
    return tracePropagationStylesToExtract;
  }

  public List<TracePropagationStyle> getTracePropagationStylesToInject() {
    return tracePropagationStylesToInject;
  }

  public int getxDatadogTagsMaxLength() {
    return xDatadogTagsMaxLength;
  }

  public Double getTraceSampleRate() {
    return traceSampleRate;
  }

  public int getTraceRateLimit() {
    return traceRateLimit;
  }

  public String getTraceSamplingRules() {
    return traceSamplingRules;
  }

  public String getSpanSamplingRules() {
    return spanSamplingRules;
  }

  public String getSpanSamplingRulesFile() {
    return spanSamplingRulesFile;
  }

  public static Config get() {
    return INSTANCE;
  }

  /**
   * Returns a config where the given properties, keyed by the names in {@link
   * datadog.segment.api.config.TracerConfig}, take precedence.
   */
  public static Config get(final Properties properties) {
    if (properties == null || properties.isEmpty()) {
      return INSTANCE;
    } else {
      return new Config(ConfigProvider.withPropertiesOverride(properties));
    }
  }

  @Override
  public String toString() {
    return "Config{"
        + "serviceName='"
        + serviceName
        + '\''
        + ", env='"
        + env
        + '\''
        + ", version='"
        + version
        + '\''
        + ", hostName='"
        + hostName
        + '\''
        + ", agentUrl='"
        + agentUrl
        + '\''
        + ", traceFlushIntervalSeconds="
        + traceFlushIntervalSeconds
        + ", tracePropagationStylesToExtract="
        + tracePropagationStylesToExtract
        + ", tracePropagationStylesToInject="
        + tracePropagationStylesToInject
        + ", xDatadogTagsMaxLength="
        + xDatadogTagsMaxLength
        + ", traceSampleRate="
        + traceSampleRate
        + ", traceRateLimit="
        + traceRateLimit
        + '}';
  }
}
