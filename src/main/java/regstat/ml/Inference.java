package regstat.ml;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Per-coefficient inference steps shared by the estimators. Each takes its inputs
 * explicitly so the steps can be checked one at a time.
 */
final class Inference {

    private Inference() {}

    /** √diag(Cov) */
    static double[] standardErrors(RealMatrix covariance) {
        double[] se = new double[covariance.getRowDimension()];
        for (int j = 0; j < se.length; j++) {
            se[j] = Math.sqrt(covariance.getEntry(j, j));
        }
        return se;
    }

    /** β̂ⱼ / seⱼ */
    static double[] statistics(double[] coefficients, double[] standardErrors) {
        if (coefficients.length != standardErrors.length) {
            throw new ShapeMismatchException(coefficients.length + " coefficients but "
                + standardErrors.length + " standard errors");
        }
        double[] out = new double[coefficients.length];
        for (int j = 0; j < out.length; j++) {
            out[j] = coefficients[j] / standardErrors[j];
        }
        return out;
    }

    /** Two-sided Student-t p-values: 2·P(T_df ≥ |t|). */
    static double[] studentPValues(double[] t, int df) {
        TDistribution dist = new TDistribution(df);
        double[] p = new double[t.length];
        for (int j = 0; j < t.length; j++) {
            p[j] = 2.0 * dist.cumulativeProbability(-Math.abs(t[j]));
        }
        return p;
    }

    /** Two-sided normal p-values: 2·(1 − Φ(|z|)). */
    static double[] normalPValues(double[] z) {
        NormalDistribution dist = new NormalDistribution(0, 1);
        double[] p = new double[z.length];
        for (int j = 0; j < z.length; j++) {
            p[j] = 2.0 * (1.0 - dist.cumulativeProbability(Math.abs(z[j])));
        }
        return p;
    }

    static double mean(double[] v) {
        double s = 0;
        for (double x : v) s += x;
        return s / v.length;
    }

    static boolean isConstant(double[] v) {
        for (double x : v) {
            if (x != v[0]) return false;
        }
        return true;
    }
}
