package datadog.segment.core.propagation;

/** A propagation header holds a value that can't be decoded. */
public class ExtractionException extends Exception {
  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
