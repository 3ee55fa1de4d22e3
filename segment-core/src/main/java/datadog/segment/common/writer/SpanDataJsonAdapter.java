package datadog.segment.common.writer;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonReader;
import com.squareup.moshi.JsonWriter;
import com.squareup.moshi.Moshi;
import com.squareup.moshi.Types;
import datadog.segment.api.DDSpanId;
import datadog.segment.api.DDTraceId;
import datadog.segment.core.SpanData;
import java.io.IOException;
import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.Set;

class SpanDataJsonAdapter extends JsonAdapter<SpanData> {
  private final boolean hexIds;

  SpanDataJsonAdapter(final boolean hexIds) {
    this.hexIds = hexIds;
  }

  public static Factory buildFactory(final boolean hexIds) {
    return new Factory() {
      @Override
      public JsonAdapter<?> create(
          final Type type, final Set<? extends Annotation> annotations, final Moshi moshi) {
        final Class<?> rawType = Types.getRawType(type);
        if (SpanData.class.isAssignableFrom(rawType)) {
          return new SpanDataJsonAdapter(hexIds);
        }
        return null;
      }
    };
  }

  @Override
  public SpanData fromJson(final JsonReader reader) {
    throw new UnsupportedOperationException();
  }

  @Override
  public void toJson(final JsonWriter writer, final SpanData span) throws IOException {
    writer.beginObject();
    writer.name("service");
    writer.value(span.getServiceName());
    writer.name("name");
    writer.value(span.getOperationName());
    writer.name("resource");
    writer.value(span.getResourceName());
    writer.name("trace_id");
    writeTraceId(writer, span.getTraceId());
    writer.name("span_id");
    writeSpanId(writer, span.getSpanId());
    writer.name("parent_id");
    writeSpanId(writer, span.getParentId());
    writer.name("start");
    writer.value(span.getStartTimeNano());
    writer.name("duration");
    writer.value(span.getDurationNano());
    writer.name("type");
    writer.value(span.getSpanType());
    writer.name("error");
    writer.value(span.isError() ? 1 : 0);
    writer.name("metrics");
    writer.beginObject();
    for (final Map.Entry<String, Double> entry : span.getMetrics().entrySet()) {
      writer.name(entry.getKey());
      writer.value(entry.getValue());
    }
    writer.endObject();
    writer.name("meta");
    writer.beginObject();
    for (final Map.Entry<String, String> entry : span.getTags().entrySet()) {
      writer.name(entry.getKey());
      writer.value(entry.getValue());
    }
    writer.endObject();
    writer.endObject();
  }

  private void writeTraceId(final JsonWriter writer, final DDTraceId id) throws IOException {
    if (hexIds) {
      writer.value(id.toHexStringPadded(32));
    } else {
      writer.value(Long.toUnsignedString(id.toLong()));
    }
  }

  private void writeSpanId(final JsonWriter writer, final long id) throws IOException {
    if (hexIds) {
      writer.value(DDSpanId.toHexStringPadded(id));
    } else {
      writer.value(DDSpanId.toString(id));
    }
  }
}
