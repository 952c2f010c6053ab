package net.larse.tsprep.exception;

/**
 * Cumulative inverse reconstruction produced undefined values.
 */
public class ReconstructionException extends TransformException {

  public ReconstructionException(String transformerName, String message) {
    super(transformerName, message);
  }
}
