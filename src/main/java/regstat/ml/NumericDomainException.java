package regstat.ml;

/** Likelihood evaluation left the real domain (non-finite linear predictor or log of a non-positive probability). */
public class NumericDomainException extends RegressionException {

    public NumericDomainException(String message) {
        super(message);
    }
}
