package datadog.segment.common.writer;

import datadog.segment.core.SpanData;
import java.util.List;

/**
 * Destination of finished traces. A trace segment calls {@link #send} exactly once, from the thread
 * that finished its last span, and doesn't touch the spans afterwards.
 */
public interface Collector {
  /**
   * Sends the spans of one finished trace segment.
   *
   * @param trace every span of the segment, local root first
   * @param responseListener receives the remote service response, like updated sampling rates
   * @throws CollectorException if the trace couldn't be accepted
   */
  void send(List<SpanData> trace, RemoteResponseListener responseListener)
      throws CollectorException;
}
