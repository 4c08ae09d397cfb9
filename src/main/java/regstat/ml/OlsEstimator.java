package regstat.ml;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordinary Least Squares with residual-based inference.
 * <p>
 * Closed-form solution (normal equation): β = (X'X)⁻¹X'y, with
 * σ² = (y − Xβ)'(y − Xβ) / (n − k) and Cov(β) = σ²(X'X)⁻¹.
 * p-values are two-sided: 2·P(T_{n−k} ≥ |t|).
 */
public class OlsEstimator implements Estimator {

    private static final Logger logger = LogManager.getLogger(OlsEstimator.class);

    // RSS relative to y'y below which the fit is exact up to rounding
    private static final double EXACT_FIT_TOLERANCE = 1e-20;

    @Override
    public Estimate fit(DesignMatrix design, double[] response) {
        int n = design.rows();
        int k = design.columns();
        if (response == null || response.length != n) {
            throw new IllegalArgumentException("Response must have " + n + " values");
        }
        int df = degreesOfFreedom(n, k);
        // with an intercept a constant response is fitted exactly
        if (design.hasIntercept() && Inference.isConstant(response)) {
            throw new InsufficientDataException("Response is constant; residual variance is zero");
        }
        long start = System.nanoTime();

        RealMatrix X = design.matrix();
        RealVector y = MatrixUtils.createRealVector(response);
        RealMatrix XtXInverse = Matrices.inverse(design.gram(), "X'X");

        double[] beta = coefficients(XtXInverse, X, y);
        double[] residuals = residuals(X, y, beta);
        double rss = sumOfSquares(residuals);
        if (rss <= EXACT_FIT_TOLERANCE * sumOfSquares(response)) {
            throw new InsufficientDataException("Residual variance is zero; the regressors fit the response exactly");
        }
        double sigma2 = rss / df;
        RealMatrix covariance = XtXInverse.scalarMultiply(sigma2);
        double[] se = Inference.standardErrors(covariance);
        double[] t = Inference.statistics(beta, se);
        double[] p = Inference.studentPValues(t, df);

        Map<String, Double> stats = new LinkedHashMap<>();
        double rSquared = rSquared(response, rss);
        stats.put("observations", (double) n);
        stats.put("df_residual", (double) df);
        stats.put("residual_variance", sigma2);
        stats.put("r_squared", rSquared);
        stats.put("adj_r_squared", adjustedRSquared(rSquared, n, df));

        logger.debug("OLS fit n={} k={} df={} in {} µs", n, k, df, (System.nanoTime() - start) / 1000);
        return new Estimate(RegressionType.OLS, beta, se, t, p, covariance, stats, Collections.emptyList());
    }

    /** df = n − k; must be positive. */
    static int degreesOfFreedom(int n, int k) {
        int df = n - k;
        if (df <= 0) {
            throw new InsufficientDataException("Degrees of freedom n - k = " + n + " - " + k + " = " + df
                + "; need more observations than columns");
        }
        return df;
    }

    /** β = (X'X)⁻¹ X' y */
    static double[] coefficients(RealMatrix XtXInverse, RealMatrix X, RealVector y) {
        return XtXInverse.operate(X.transpose().operate(y)).toArray();
    }

    static double[] residuals(RealMatrix X, RealVector y, double[] beta) {
        return y.subtract(X.operate(MatrixUtils.createRealVector(beta))).toArray();
    }

    static double sumOfSquares(double[] v) {
        double s = 0;
        for (double x : v) s += x * x;
        return s;
    }

    /** R² = 1 - SS_res / SS_tot, around the mean of y. */
    static double rSquared(double[] y, double rss) {
        double meanY = Inference.mean(y);
        double ssTot = 0;
        for (double v : y) ssTot += (v - meanY) * (v - meanY);
        return (ssTot > 0) ? 1.0 - (rss / ssTot) : 0;
    }

    static double adjustedRSquared(double rSquared, int n, int df) {
        return 1.0 - (1.0 - rSquared) * (n - 1) / df;
    }
}
