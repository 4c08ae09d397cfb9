package regstat.ml;

import org.apache.commons.math3.linear.RealMatrix;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one {@link Estimator#fit} call: aligned per-coefficient vectors in
 * design-matrix column order, the coefficient covariance, family-specific
 * goodness-of-fit statistics and any convergence warnings.
 */
public class Estimate {

    private final RegressionType type;
    private final double[] coefficients;
    private final double[] standardErrors;
    private final double[] statistics;
    private final double[] pValues;
    private final RealMatrix covariance;
    private final Map<String, Double> fitStatistics;
    private final List<ConvergenceWarning> warnings;

    public Estimate(RegressionType type,
                    double[] coefficients,
                    double[] standardErrors,
                    double[] statistics,
                    double[] pValues,
                    RealMatrix covariance,
                    Map<String, Double> fitStatistics,
                    List<ConvergenceWarning> warnings) {
        this.type = type;
        this.coefficients = coefficients.clone();
        this.standardErrors = standardErrors.clone();
        this.statistics = statistics.clone();
        this.pValues = pValues.clone();
        this.covariance = covariance.copy();
        this.fitStatistics = Collections.unmodifiableMap(new LinkedHashMap<>(fitStatistics));
        this.warnings = List.copyOf(warnings);
    }

    public RegressionType getType() { return type; }

    public double[] getCoefficients() { return coefficients.clone(); }
    public double[] getStandardErrors() { return standardErrors.clone(); }
    public double[] getStatistics() { return statistics.clone(); }
    public double[] getPValues() { return pValues.clone(); }
    public RealMatrix getCovariance() { return covariance.copy(); }

    /** e.g. r_squared for OLS, log_likelihood for Logit; insertion ordered. */
    public Map<String, Double> getFitStatistics() { return fitStatistics; }

    public List<ConvergenceWarning> getWarnings() { return warnings; }

    public boolean isConverged() { return warnings.isEmpty(); }
}
