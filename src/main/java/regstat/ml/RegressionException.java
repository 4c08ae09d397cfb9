package regstat.ml;

/**
 * Base of the fatal failures a fit can raise. Every subclass aborts {@code fit()}
 * and reaches the caller unmodified.
 */
public class RegressionException extends RuntimeException {

    public RegressionException(String message) {
        super(message);
    }

    public RegressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
