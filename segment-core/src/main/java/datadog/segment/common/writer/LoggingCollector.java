package datadog.segment.common.writer;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.Moshi;
import com.squareup.moshi.Types;
import datadog.segment.core.SpanData;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes every finished trace as a JSON array of spans to the log, at info level. */
public class LoggingCollector implements Collector {

  private static final Logger log = LoggerFactory.getLogger(LoggingCollector.class);

  private final JsonAdapter<List<SpanData>> traceAdapter;

  public LoggingCollector() {
    this(false);
  }

  public LoggingCollector(boolean hexIds) {
    this.traceAdapter =
        new Moshi.Builder()
            .add(SpanDataJsonAdapter.buildFactory(hexIds))
            .build()
            .adapter(Types.newParameterizedType(List.class, SpanData.class));
  }

  String toJson(List<SpanData> trace) {
    return traceAdapter.toJson(trace);
  }

  @Override
  public void send(List<SpanData> trace, RemoteResponseListener responseListener)
      throws CollectorException {
    try {
      log.info("send(trace): {}", toJson(trace));
    } catch (final RuntimeException e) {
      throw new CollectorException("Unable to serialize trace of " + trace.size() + " spans", e);
    }
  }

  @Override
  public String toString() {
    return "LoggingCollector { }";
  }
}
