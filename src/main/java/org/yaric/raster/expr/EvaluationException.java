package org.yaric.raster.expr;

/**
 * A formula could not be parsed or could not be bound to the bands of a raster.
 */
public class EvaluationException extends Exception {

    public EvaluationException(final String message) {
        super(message);
    }

    public EvaluationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
