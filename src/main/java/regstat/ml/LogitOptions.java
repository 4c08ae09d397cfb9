package regstat.ml;

import java.util.Locale;
import java.util.Map;

/**
 * Tuning of the logistic fit. Defaults: every coefficient starts at 0.1, conjugate
 * gradient search with at most 1000 iterations and 100000 objective evaluations,
 * covariance from the aggregate response variance.
 */
public class LogitOptions {

    private double initialValue = 0.1;
    private int maxIterations = 1000;
    private int maxEvaluations = 100_000;
    private double relativeTolerance = 1e-12;
    private double absoluteTolerance = 1e-14;
    private CovarianceType covariance = CovarianceType.RESPONSE_VARIANCE;
    private MinimizerType minimizer = MinimizerType.CONJUGATE_GRADIENT;

    public LogitOptions() { }

    /**
     * Read options from string-keyed values (e.g. parsed JSON). Recognized keys:
     * {@code initialValue, maxIterations, maxEvaluations, relativeTolerance,
     * absoluteTolerance, covariance, minimizer}.
     *
     * @throws InvalidConfigurationException for unknown keys or unparseable values
     */
    public static LogitOptions fromMap(Map<String, ?> values) {
        LogitOptions o = new LogitOptions();
        if (values == null) return o;
        for (Map.Entry<String, ?> e : values.entrySet()) {
            String v = String.valueOf(e.getValue()).trim();
            try {
                switch (e.getKey()) {
                    case "initialValue": o.setInitialValue(Double.parseDouble(v)); break;
                    case "maxIterations": o.setMaxIterations((int) Double.parseDouble(v)); break;
                    case "maxEvaluations": o.setMaxEvaluations((int) Double.parseDouble(v)); break;
                    case "relativeTolerance": o.setRelativeTolerance(Double.parseDouble(v)); break;
                    case "absoluteTolerance": o.setAbsoluteTolerance(Double.parseDouble(v)); break;
                    case "covariance": o.setCovariance(CovarianceType.valueOf(v.toUpperCase(Locale.ROOT))); break;
                    case "minimizer": o.setMinimizer(MinimizerType.valueOf(v.toUpperCase(Locale.ROOT))); break;
                    default:
                        throw new InvalidConfigurationException("Unknown logit option '" + e.getKey() + "'");
                }
            } catch (IllegalArgumentException ex) {
                // NumberFormatException and enum valueOf failures both land here
                throw new InvalidConfigurationException("Invalid value '" + v + "' for logit option '"
                    + e.getKey() + "': " + ex.getMessage());
            }
        }
        return o;
    }

    public double getInitialValue() { return initialValue; }

    /** Starting value of every coefficient; any finite value is accepted. */
    public LogitOptions setInitialValue(double initialValue) {
        if (!Double.isFinite(initialValue)) {
            throw new IllegalArgumentException("Initial value must be finite: " + initialValue);
        }
        this.initialValue = initialValue;
        return this;
    }

    public int getMaxIterations() { return maxIterations; }

    public LogitOptions setMaxIterations(int maxIterations) {
        if (maxIterations <= 0) throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        this.maxIterations = maxIterations;
        return this;
    }

    public int getMaxEvaluations() { return maxEvaluations; }

    public LogitOptions setMaxEvaluations(int maxEvaluations) {
        if (maxEvaluations <= 0) throw new IllegalArgumentException("maxEvaluations must be positive: " + maxEvaluations);
        this.maxEvaluations = maxEvaluations;
        return this;
    }

    public double getRelativeTolerance() { return relativeTolerance; }

    public LogitOptions setRelativeTolerance(double relativeTolerance) {
        if (!(relativeTolerance > 0)) throw new IllegalArgumentException("relativeTolerance must be positive");
        this.relativeTolerance = relativeTolerance;
        return this;
    }

    public double getAbsoluteTolerance() { return absoluteTolerance; }

    public LogitOptions setAbsoluteTolerance(double absoluteTolerance) {
        if (!(absoluteTolerance > 0)) throw new IllegalArgumentException("absoluteTolerance must be positive");
        this.absoluteTolerance = absoluteTolerance;
        return this;
    }

    public CovarianceType getCovariance() { return covariance; }

    public LogitOptions setCovariance(CovarianceType covariance) {
        if (covariance == null) throw new IllegalArgumentException("covariance must be non-null");
        this.covariance = covariance;
        return this;
    }

    public MinimizerType getMinimizer() { return minimizer; }

    public LogitOptions setMinimizer(MinimizerType minimizer) {
        if (minimizer == null) throw new IllegalArgumentException("minimizer must be non-null");
        this.minimizer = minimizer;
        return this;
    }

    @Override
    public String toString() {
        return "LogitOptions{initialValue=" + initialValue + ", maxIterations=" + maxIterations
            + ", maxEvaluations=" + maxEvaluations + ", relativeTolerance=" + relativeTolerance
            + ", absoluteTolerance=" + absoluteTolerance + ", covariance=" + covariance
            + ", minimizer=" + minimizer + "}";
    }
}
