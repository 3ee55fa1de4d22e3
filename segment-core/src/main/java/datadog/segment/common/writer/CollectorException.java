package datadog.segment.common.writer;

/** Failure to hand a finished trace over to its destination. */
public class CollectorException extends Exception {
  public CollectorException(String message) {
    super(message);
  }

  public CollectorException(String message, Throwable cause) {
    super(message, cause);
  }
}
