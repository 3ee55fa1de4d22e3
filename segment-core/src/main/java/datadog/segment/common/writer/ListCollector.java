package datadog.segment.common.writer;

import datadog.segment.core.SpanData;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** List collector used by tests mostly */
public class ListCollector extends CopyOnWriteArrayList<List<SpanData>> implements Collector {
  private final List<CountDownLatch> latches = new LinkedList<>();

  public List<SpanData> firstTrace() {
    return get(0);
  }

  @Override
  public void send(List<SpanData> trace, RemoteResponseListener responseListener) {
    synchronized (latches) {
      add(trace);
      for (final CountDownLatch latch : latches) {
        if (size() >= latch.getCount()) {
          while (latch.getCount() > 0) {
            latch.countDown();
          }
        }
      }
    }
  }

  public void waitForTraces(final int number) throws InterruptedException, TimeoutException {
    final CountDownLatch latch = new CountDownLatch(number);
    synchronized (latches) {
      if (size() >= number) {
        return;
      }
      latches.add(latch);
    }
    if (!latch.await(5, TimeUnit.SECONDS)) {
      throw new TimeoutException("Timeout waiting for " + number + " trace(s).");
    }
  }

  @Override
  public String toString() {
    return "ListCollector { size=" + this.size() + " }";
  }
}
