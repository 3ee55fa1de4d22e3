package datadog.segment.api.time;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SystemTimeSourceTest {

  @Test
  void followsTheWallClock() throws InterruptedException {
    SystemTimeSource timeSource = new SystemTimeSource(0);

    for (int i = 0; i < 5; i++) {
      long before = MILLISECONDS.toNanos(System.currentTimeMillis());
      long nanos = timeSource.getCurrentTimeNanos();
      long after = MILLISECONDS.toNanos(System.currentTimeMillis() + 1);

      assertTrue(nanos >= before - MILLISECONDS.toNanos(2), "too early: " + nanos);
      assertTrue(nanos <= after + MILLISECONDS.toNanos(2), "too late: " + nanos);
      Thread.sleep(3);
    }
  }

  @Test
  void ticksMoveForward() {
    long first = SystemTimeSource.INSTANCE.getNanoTicks();

    assertTrue(SystemTimeSource.INSTANCE.getNanoTicks() >= first);
  }
}
