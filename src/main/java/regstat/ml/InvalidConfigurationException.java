package regstat.ml;

/** Unrecognized model configuration, e.g. a regression type other than ols/logit. */
public class InvalidConfigurationException extends RegressionException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
