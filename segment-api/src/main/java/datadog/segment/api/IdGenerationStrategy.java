package datadog.segment.api;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/**
 * Generates trace and span ids from a source of random bits. Ids are positive 63 bit values. The
 * high half of a 128 bit trace id holds the creation time in epoch seconds followed by 32 zero
 * bits.
 */
public final class IdGenerationStrategy {
  private final String name;
  private final LongSupplier randomBits;
  private final boolean traceId128BitGenerationEnabled;

  private IdGenerationStrategy(
      String name, LongSupplier randomBits, boolean traceId128BitGenerationEnabled) {
    this.name = name;
    this.randomBits = randomBits;
    this.traceId128BitGenerationEnabled = traceId128BitGenerationEnabled;
  }

  /**
   * Returns the strategy with the given name, {@code RANDOM} or {@code SECURE_RANDOM} in any case,
   * or {@code null} if the name is unknown.
   */
  public static IdGenerationStrategy fromName(String name, boolean traceId128BitGenerationEnabled) {
    switch (name.toUpperCase(Locale.ROOT)) {
      case "RANDOM":
        return new IdGenerationStrategy(
            "RANDOM", () -> ThreadLocalRandom.current().nextLong(), traceId128BitGenerationEnabled);
      case "SECURE_RANDOM":
        return new IdGenerationStrategy(
            "SECURE_RANDOM", new SecureRandom()::nextLong, traceId128BitGenerationEnabled);
      default:
        return null;
    }
  }

  public DDTraceId generateTraceId() {
    long lowOrderBits = nextId();
    if (!traceId128BitGenerationEnabled) {
      return DDTraceId.from(lowOrderBits);
    }
    long epochSeconds = MILLISECONDS.toSeconds(System.currentTimeMillis());
    return DDTraceId.from(epochSeconds << 32, lowOrderBits);
  }

  public long generateSpanId() {
    return nextId();
  }

  private long nextId() {
    long id;
    do {
      id = randomBits.getAsLong() & Long.MAX_VALUE;
    } while (id == 0);
    return id;
  }

  public String getName() {
    return name;
  }

  public boolean isTraceId128BitGenerationEnabled() {
    return traceId128BitGenerationEnabled;
  }

  @Override
  public String toString() {
    return name + (traceId128BitGenerationEnabled ? " (128-bit trace ids)" : "");
  }
}
