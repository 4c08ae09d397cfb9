package regstat.ml;

/** Aligned result vectors (names, coefficients, errors, statistics, p-values) differ in length. */
public class ShapeMismatchException extends RegressionException {

    public ShapeMismatchException(String message) {
        super(message);
    }
}
