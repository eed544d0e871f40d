package io.github.panghy.pcg;

/**
 * Thrown when a bound passed to a {@link PcgRandom} draw is out of range.
 * Carries the name of the offending parameter and its value so callers can report it
 * without parsing the message.
 */
public class InvalidArgumentException extends IllegalArgumentException {

  private final String parameterName;
  private final long value;

  /**
   * Creates a new exception.
   *
   * @param parameterName The name of the offending parameter
   * @param value         The value that was passed
   * @param reason        Why the value was rejected
   */
  public InvalidArgumentException(String parameterName, long value, String reason) {
    super(parameterName + " = " + value + ": " + reason);
    this.parameterName = parameterName;
    this.value = value;
  }

  /**
   * Gets the name of the offending parameter.
   *
   * @return The parameter name
   */
  public String getParameterName() {
    return parameterName;
  }

  /**
   * Gets the value that was rejected.
   *
   * @return The offending value
   */
  public long getValue() {
    return value;
  }
}
