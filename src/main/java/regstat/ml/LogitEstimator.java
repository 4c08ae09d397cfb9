package regstat.ml;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary logistic regression by maximum likelihood.
 * <p>
 * There is no closed form: β is found by minimizing the {@link LogLikelihood negative
 * log-likelihood} from a fixed starting vector with a {@link Minimizer}. Inference is
 * asymptotic: z = β / se, two-sided p = 2·(1 − Φ(|z|)), with the covariance chosen by
 * {@link CovarianceType}. The default {@link CovarianceType#RESPONSE_VARIANCE} is an
 * approximation, σ² = n·ȳ·(1 − ȳ) and Cov ≈ σ²(X'X)⁻¹, and not the inverse information
 * matrix.
 */
public class LogitEstimator implements Estimator {

    private static final Logger logger = LogManager.getLogger(LogitEstimator.class);

    private final LogitOptions options;

    public LogitEstimator() {
        this(new LogitOptions());
    }

    public LogitEstimator(LogitOptions options) {
        this.options = options;
    }

    public LogitOptions getOptions() { return options; }

    @Override
    public Estimate fit(DesignMatrix design, double[] response) {
        int n = design.rows();
        int k = design.columns();
        checkBinary(response, n);
        if (n <= k) {
            throw new InsufficientDataException("Need more observations than columns: n=" + n + ", k=" + k);
        }
        if (Inference.isConstant(response)) {
            throw new InsufficientDataException("Response contains only " + (int) response[0]
                + "s; both classes are needed to estimate a logit model");
        }
        long start = System.nanoTime();
        // a singular X'X fails here rather than after the search
        RealMatrix XtXInverse = Matrices.inverse(design.gram(), "X'X");

        LogLikelihood nll = new LogLikelihood(design, response);
        double[] initial = initialGuess(k, options.getInitialValue());
        Minimum minimum = options.getMinimizer().create(options).minimize(nll, initial);
        double[] beta = minimum.getPoint();
        checkFinite(beta);

        List<ConvergenceWarning> warnings = warnings(minimum, nll, beta);
        for (ConvergenceWarning w : warnings) {
            logger.warn(w.getMessage());
        }

        RealMatrix covariance = covariance(options.getCovariance(), XtXInverse, response, nll, beta);
        double[] se = Inference.standardErrors(covariance);
        double[] z = Inference.statistics(beta, se);
        double[] p = Inference.normalPValues(z);

        double logLikelihood = -nll.value(beta);
        double nullLogLikelihood = nll.nullLogLikelihood();
        Map<String, Double> stats = new LinkedHashMap<>();
        stats.put("observations", (double) n);
        stats.put("log_likelihood", logLikelihood);
        stats.put("null_log_likelihood", nullLogLikelihood);
        stats.put("pseudo_r_squared", 1.0 - logLikelihood / nullLogLikelihood);
        stats.put("iterations", (double) minimum.getIterations());
        stats.put("evaluations", (double) minimum.getEvaluations());

        logger.debug("Logit fit n={} k={} in {} iterations, {} µs", n, k, minimum.getIterations(),
            (System.nanoTime() - start) / 1000);
        return new Estimate(RegressionType.LOGIT, beta, se, z, p, covariance, stats, warnings);
    }

    static double[] initialGuess(int k, double value) {
        double[] start = new double[k];
        Arrays.fill(start, value);
        return start;
    }

    static void checkBinary(double[] response, int n) {
        if (response == null || response.length != n) {
            throw new IllegalArgumentException("Response must have " + n + " values");
        }
        for (int i = 0; i < response.length; i++) {
            if (response[i] != 0 && response[i] != 1) {
                throw new IllegalArgumentException("Logit response must be 0 or 1; observation " + i
                    + " is " + response[i]);
            }
        }
    }

    static void checkFinite(double[] beta) {
        for (int j = 0; j < beta.length; j++) {
            if (!Double.isFinite(beta[j])) {
                throw new OptimizationFailedException("Minimizer returned non-finite coefficient " + j
                    + ": " + Arrays.toString(beta));
            }
        }
    }

    static List<ConvergenceWarning> warnings(Minimum minimum, LogLikelihood nll, double[] beta) {
        List<ConvergenceWarning> warnings = new ArrayList<>();
        if (!minimum.isConverged()) {
            warnings.add(new ConvergenceWarning(ConvergenceWarning.Kind.NOT_CONVERGED,
                "Maximum likelihood search did not converge after " + minimum.getIterations()
                    + " iterations; coefficients are the best point found"));
        }
        if (nll.separates(beta)) {
            warnings.add(new ConvergenceWarning(ConvergenceWarning.Kind.PERFECT_SEPARATION,
                "Perfect separation: every observation is classified correctly, the maximum likelihood"
                    + " estimate does not exist and coefficients grow without bound"));
        }
        return warnings;
    }

    static RealMatrix covariance(CovarianceType type, RealMatrix XtXInverse, double[] response,
                                 LogLikelihood nll, double[] beta) {
        switch (type) {
            case OBSERVED_INFORMATION:
                if (nll.separates(beta)) {
                    throw new SingularMatrixException("X'WX is singular: the data are perfectly separated,"
                        + " so the information matrix has no inverse at the returned point");
                }
                return Matrices.inverse(nll.hessian(beta), "X'WX");
            case RESPONSE_VARIANCE:
            default:
                return responseVarianceCovariance(XtXInverse, response);
        }
    }

    /** σ² = n·ȳ·(1 − ȳ); Cov ≈ σ²(X'X)⁻¹ */
    static RealMatrix responseVarianceCovariance(RealMatrix XtXInverse, double[] response) {
        double m = Inference.mean(response);
        double sigma2 = response.length * m * (1 - m);
        return XtXInverse.scalarMultiply(sigma2);
    }
}
