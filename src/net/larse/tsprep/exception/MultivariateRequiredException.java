package net.larse.tsprep.exception;

/**
 * A transformer that fits jointly across series was given fewer than two series.
 */
public class MultivariateRequiredException extends TransformException {

  public MultivariateRequiredException(String transformerName, int numSeries) {
    super(transformerName, transformerName + " requires at least 2 series, got " + numSeries);
  }
}
