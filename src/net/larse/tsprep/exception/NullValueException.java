package net.larse.tsprep.exception;

/**
 * NaN values reached a transformer that cannot handle them.
 */
public class NullValueException extends TransformException {

  public NullValueException(String transformerName) {
    super(transformerName, transformerName + " does not support NaN values, fill them first");
  }
}
