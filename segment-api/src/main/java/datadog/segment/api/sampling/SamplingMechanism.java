package datadog.segment.api.sampling;

public class SamplingMechanism {
  /** Used before the tracer receives any rates from agent and there are no rules configured */
  public static final byte DEFAULT = 0;

  /** The sampling rate received in the agent's http response */
  public static final byte AGENT_RATE = 1;

  /** Auto; reserved for future use */
  public static final byte REMOTE_AUTO_RATE = 2;

  /** Sampling rule or sampling rate based on tracer config */
  public static final byte LOCAL_USER_RULE = 3;

  /** User directly sets sampling priority via code */
  public static final byte MANUAL = 4;

  /** AppSec */
  public static final byte APPSEC = 5;

  /** User-defined target; reserved for future use */
  public static final byte REMOTE_USER_RATE = 6;

  /** Span Sampling Rate (single span sampled on account of a span sampling rule) */
  public static final byte SPAN_SAMPLING_RATE = 8;

  /**
   * Parses the mechanism out of a decision maker trace tag value, like <code>-4</code>.
   *
   * @return the mechanism or {@code null} if the value is malformed.
   */
  public static Integer fromDecisionMaker(String decisionMaker) {
    if (decisionMaker == null
        || decisionMaker.length() < 2
        || decisionMaker.charAt(0) != '-'
        || decisionMaker.charAt(1) == '-') {
      return null;
    }
    try {
      return Integer.parseInt(decisionMaker.substring(1));
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Formats the mechanism as a decision maker trace tag value. */
  public static String toDecisionMaker(int mechanism) {
    return "-" + mechanism;
  }

  private SamplingMechanism() {}
}
