package regstat.ml;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Regression of a response on named regressors, OLS or Logit.
 * <p>
 * The design matrix is built once at construction; {@link #fit()} must be called
 * explicitly and each call replaces the previous results. Not thread-safe.
 */
public class RegressionModel {

    private final RegressionType type;
    private final DesignMatrix design;
    private final double[] response;
    private final Map<RegressionType, Supplier<Estimator>> estimators = new EnumMap<>(RegressionType.class);

    private Estimate estimate;
    private RegressionResults results;

    /**
     * @param columns regressors by name, in the order they should be reported
     * @param response y, same length as every column; 0/1 for {@link RegressionType#LOGIT}
     * @param createIntercept append a constant column named {@value DesignMatrix#INTERCEPT}
     */
    public RegressionModel(Map<String, double[]> columns, double[] response,
                           boolean createIntercept, RegressionType type) {
        this(columns, response, createIntercept, type, new LogitOptions());
    }

    public RegressionModel(Map<String, double[]> columns, double[] response,
                           boolean createIntercept, RegressionType type, LogitOptions logitOptions) {
        if (type == null) {
            throw new InvalidConfigurationException("Regression type is required");
        }
        this.type = type;
        this.design = DesignMatrix.of(columns, createIntercept);
        if (response == null || response.length != design.rows()) {
            throw new IllegalArgumentException("Response must have " + design.rows() + " values, got "
                + (response == null ? "null" : String.valueOf(response.length)));
        }
        if (type == RegressionType.LOGIT) {
            LogitEstimator.checkBinary(response, design.rows());
        }
        this.response = response.clone();
        estimators.put(RegressionType.OLS, OlsEstimator::new);
        estimators.put(RegressionType.LOGIT, () -> new LogitEstimator(logitOptions));
    }

    /**
     * @param regressionType "ols" or "logit"
     * @throws InvalidConfigurationException for any other value
     */
    public RegressionModel(Map<String, double[]> columns, double[] response,
                           boolean createIntercept, String regressionType) {
        this(columns, response, createIntercept, RegressionType.parse(regressionType));
    }

    /** Intercept included by default. */
    public RegressionModel(Map<String, double[]> columns, double[] response, RegressionType type) {
        this(columns, response, true, type);
    }

    /** Estimate the coefficients and their inference, replacing any earlier fit. */
    public RegressionResults fit() {
        Estimate e = estimators.get(type).get().fit(design, response);
        RegressionResults r = RegressionResults.assemble(design.names(), e);
        this.estimate = e;
        this.results = r;
        return r;
    }

    public RegressionType getType() { return type; }

    public DesignMatrix getDesign() { return design; }

    public boolean isFitted() { return estimate != null; }

    public Estimate getEstimate() {
        checkFitted();
        return estimate;
    }

    public RegressionResults getResults() {
        checkFitted();
        return results;
    }

    /** Coefficients in design-matrix column order. */
    public double[] getCoefficients() {
        checkFitted();
        return estimate.getCoefficients();
    }

    public String summary() {
        return getResults().summary();
    }

    /**
     * Fitted values for OLS, P(y=1) for Logit.
     *
     * @param rows regressor values without the intercept column
     */
    public double[] predict(double[][] rows) {
        checkFitted();
        RealMatrix X = MatrixUtils.createRealMatrix(design.align(rows));
        RealVector eta = X.operate(MatrixUtils.createRealVector(estimate.getCoefficients()));
        double[] out = eta.toArray();
        if (type == RegressionType.LOGIT) {
            for (int i = 0; i < out.length; i++) out[i] = LogLikelihood.sigmoid(out[i]);
        }
        return out;
    }

    private void checkFitted() {
        if (estimate == null) throw new IllegalStateException("Call fit() first");
    }
}
