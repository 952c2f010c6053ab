package net.larse.tsprep.exception;

/**
 * Input values cannot be converted to floating point numbers.
 */
public class NonNumericDataException extends TransformException {

  public NonNumericDataException(String message) {
    super(message);
  }

  public NonNumericDataException(String transformerName, String message, Throwable cause) {
    super(transformerName, message, cause);
  }
}
