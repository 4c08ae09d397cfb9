package regstat.ml;

/** Not enough information in the data to estimate: non-positive degrees of freedom or a response without variation. */
public class InsufficientDataException extends RegressionException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
