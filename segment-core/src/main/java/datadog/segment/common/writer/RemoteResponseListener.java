package datadog.segment.common.writer;

import java.util.Map;

public interface RemoteResponseListener {
  RemoteResponseListener NOOP = (endpoint, responseJson) -> {};

  /** Invoked after the collector receives a response from the remote service. */
  void onResponse(String endpoint, Map<String, Map<String, Number>> responseJson);
}
