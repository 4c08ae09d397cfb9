package regstat.ml;

/** The minimizer returned a point with non-finite coordinates. */
public class OptimizationFailedException extends RegressionException {

    public OptimizationFailedException(String message) {
        super(message);
    }
}
