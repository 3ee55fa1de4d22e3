package datadog.segment.core;

import datadog.segment.api.sampling.SamplingMechanism;
import java.util.Objects;

/**
 * The keep or drop verdict for a trace, or for a single span, along with what produced it. A
 * priority above 0 means keep.
 */
public final class SamplingDecision {
  public enum Origin {
    /** Decided by this process. */
    LOCAL,
    /** Received from an upstream service through propagation headers. */
    EXTRACTED
  }

  private final int priority;
  private final Integer mechanism;
  private final Origin origin;
  private final Double configuredRate;
  private final Double limiterEffectiveRate;
  private final Double limiterMaxPerSecond;

  public SamplingDecision(
      int priority,
      Integer mechanism,
      Origin origin,
      Double configuredRate,
      Double limiterEffectiveRate,
      Double limiterMaxPerSecond) {
    this.priority = priority;
    this.mechanism = mechanism;
    this.origin = origin;
    this.configuredRate = configuredRate;
    this.limiterEffectiveRate = limiterEffectiveRate;
    this.limiterMaxPerSecond = limiterMaxPerSecond;
  }

  public static SamplingDecision local(int priority, int mechanism, Double configuredRate) {
    return new SamplingDecision(priority, mechanism, Origin.LOCAL, configuredRate, null, null);
  }

  /** The decision forced through {@link TraceSegment#overrideSamplingPriority(int)}. */
  public static SamplingDecision manual(int priority) {
    return new SamplingDecision(
        priority, (int) SamplingMechanism.MANUAL, Origin.LOCAL, null, null, null);
  }

  public static SamplingDecision extracted(int priority, Integer mechanism) {
    return new SamplingDecision(priority, mechanism, Origin.EXTRACTED, null, null, null);
  }

  public int getPriority() {
    return priority;
  }

  public boolean isKeep() {
    return priority > 0;
  }

  /** The {@link SamplingMechanism} value, {@code null} when unknown. */
  public Integer getMechanism() {
    return mechanism;
  }

  public Origin getOrigin() {
    return origin;
  }

  public Double getConfiguredRate() {
    return configuredRate;
  }

  public Double getLimiterEffectiveRate() {
    return limiterEffectiveRate;
  }

  public Double getLimiterMaxPerSecond() {
    return limiterMaxPerSecond;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SamplingDecision)) return false;
    SamplingDecision that = (SamplingDecision) o;
    return priority == that.priority
        && Objects.equals(mechanism, that.mechanism)
        && origin == that.origin
        && Objects.equals(configuredRate, that.configuredRate)
        && Objects.equals(limiterEffectiveRate, that.limiterEffectiveRate)
        && Objects.equals(limiterMaxPerSecond, that.limiterMaxPerSecond);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        priority, mechanism, origin, configuredRate, limiterEffectiveRate, limiterMaxPerSecond);
  }

  @Override
  public String toString() {
    return "SamplingDecision{"
        + "priority="
        + priority
        + ", mechanism="
        + mechanism
        + ", origin="
        + origin
        + ", configuredRate="
        + configuredRate
        + ", limiterEffectiveRate="
        + limiterEffectiveRate
        + ", limiterMaxPerSecond="
        + limiterMaxPerSecond
        + '}';
  }
}
