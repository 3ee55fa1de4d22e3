package datadog.segment.core.propagation;

import datadog.segment.api.DDTags;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encoding of trace tags used by the <code>x-datadog-tags</code> header, following the eBNF:
 *
 * <pre>
 *   tagset = ( tag, { ",", tag } ) | "";
 *   tag = ( identifier - space or equal ), "=", [ identifier ];
 *   identifier = allowed characters, { allowed characters };
 *   allowed characters = ( ? ASCII characters 32-126 ? - comma );
 * </pre>
 */
public final class DatadogTags {
  private static final char TAGS_SEPARATOR = ',';
  private static final char TAG_KEY_SEPARATOR = '=';

  private static final int MIN_ALLOWED_CHAR = 32;
  private static final int MAX_ALLOWED_CHAR = 126;

  private DatadogTags() {}

  /** Encodes the tags in iteration order. An empty map gives an empty string. */
  public static String encode(Map<String, String> tags) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> entry : tags.entrySet()) {
      if (sb.length() > 0) {
        sb.append(TAGS_SEPARATOR);
      }
      sb.append(entry.getKey()).append(TAG_KEY_SEPARATOR).append(entry.getValue());
    }
    return sb.toString();
  }

  /**
   * Decodes every tag of the header value, whatever its prefix, in header order.
   *
   * @throws IllegalArgumentException if the value doesn't follow the grammar
   */
  public static Map<String, String> decode(String value) {
    Map<String, String> tags = new LinkedHashMap<>();
    int len = value.length();
    int tagPos = 0;
    while (tagPos < len) {
      int tagValueEndsAt = value.indexOf(TAGS_SEPARATOR, tagPos);
      if (tagValueEndsAt < 0) {
        tagValueEndsAt = len;
      }
      int tagKeyEndsAt = value.indexOf(TAG_KEY_SEPARATOR, tagPos);
      if (tagKeyEndsAt < 0 || tagKeyEndsAt > tagValueEndsAt) {
        throw new IllegalArgumentException(
            "Invalid x-datadog-tags value '" + value + "': tag without a value at " + tagPos);
      }
      String tagKey = value.substring(tagPos, tagKeyEndsAt);
      String tagValue = value.substring(tagKeyEndsAt + 1, tagValueEndsAt);
      if (!isValidKey(tagKey)) {
        throw new IllegalArgumentException(
            "Invalid x-datadog-tags value '" + value + "': invalid tag key at " + tagPos);
      }
      if (!isValidValue(tagValue)) {
        throw new IllegalArgumentException(
            "Invalid x-datadog-tags value '"
                + value
                + "': invalid tag value at "
                + (tagKeyEndsAt + 1));
      }
      tags.put(tagKey, tagValue);
      tagPos = tagValueEndsAt + 1;
    }
    return tags;
  }

  public static boolean isPropagated(String tagKey) {
    return tagKey.startsWith(DDTags.PROPAGATED_TAG_PREFIX);
  }

  private static boolean isValidKey(String tagKey) {
    if (tagKey.isEmpty()) {
      return false;
    }
    for (int i = 0; i < tagKey.length(); i++) {
      char c = tagKey.charAt(i);
      // space (MIN_ALLOWED_CHAR) is not allowed
      if (c <= MIN_ALLOWED_CHAR || c > MAX_ALLOWED_CHAR || c == TAGS_SEPARATOR) {
        return false;
      }
    }
    return true;
  }

  private static boolean isValidValue(String tagValue) {
    for (int i = 0; i < tagValue.length(); i++) {
      char c = tagValue.charAt(i);
      if (c < MIN_ALLOWED_CHAR || c > MAX_ALLOWED_CHAR || c == TAGS_SEPARATOR) {
        return false;
      }
    }
    return true;
  }
}
