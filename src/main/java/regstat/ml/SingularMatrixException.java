package regstat.ml;

/** Raised when a matrix that must be inverted (usually X'X) is singular. */
public class SingularMatrixException extends RegressionException {

    public SingularMatrixException(String message) {
        super(message);
    }
}
