package regstat.ml;

/** How the logit coefficient covariance is estimated after the likelihood is maximized. */
public enum CovarianceType {

    /**
     * Approximation scaling (X'X)⁻¹ by the aggregate response variance n·ȳ·(1 − ȳ).
     * It does not use the curvature of the likelihood at the optimum.
     */
    RESPONSE_VARIANCE,

    /** Inverse Fisher information (X'WX)⁻¹ at the optimum. */
    OBSERVED_INFORMATION
}
