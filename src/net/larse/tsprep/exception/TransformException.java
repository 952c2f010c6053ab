package net.larse.tsprep.exception;

/**
 * Base exception for failures inside a transformation pipeline.
 */
public class TransformException extends RuntimeException {

  private final String transformerName;

  public TransformException(String message) {
    this(null, message);
  }

  /**
   * Constructor with the transformer name and a message.
   *
   * @param transformerName name of the failing transformer, may be null
   * @param message message of the exception
   */
  public TransformException(String transformerName, String message) {
    super(message);
    this.transformerName = transformerName;
  }

  public TransformException(String transformerName, String message, Throwable cause) {
    super(message, cause);
    this.transformerName = transformerName;
  }

  /**
   * Returns the name of the transformer that failed.
   *
   * @return transformer name, null if unknown
   */
  public String getTransformerName() {
    return transformerName;
  }
}
