package regstat.ml;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Negative log-likelihood of the logistic model P(y=1|x) = σ(xβ) over fixed data:
 * <pre>
 *   NLL(β) = − Σᵢ [ yᵢ·log σ(xᵢβ) + (1 − yᵢ)·log(1 − σ(xᵢβ)) ]
 * </pre>
 * Probabilities are clamped to [ε, 1 − ε] before the logarithms so that saturated
 * predictions give a large finite penalty.
 */
public class LogLikelihood implements Objective {

    /** Clamp applied to σ(xβ) before taking logarithms. */
    public static final double EPSILON = 1e-12;

    private final double[][] x;
    private final double[] y;
    private final int k;

    public LogLikelihood(DesignMatrix design, double[] response) {
        if (response == null || response.length != design.rows()) {
            throw new IllegalArgumentException("Response must have " + design.rows() + " values");
        }
        this.x = design.matrix().getData();
        this.y = response.clone();
        this.k = design.columns();
    }

    /** Numerically stable logistic function. */
    public static double sigmoid(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }

    @Override
    public int dimension() { return k; }

    /** xᵢβ */
    public double linearPredictor(int i, double[] beta) {
        checkDimension(beta);
        double z = 0;
        for (int j = 0; j < k; j++) z += x[i][j] * beta[j];
        if (!Double.isFinite(z)) {
            throw new NumericDomainException("Linear predictor of observation " + i + " is " + z);
        }
        return z;
    }

    @Override
    public double value(double[] beta) {
        double nll = 0;
        for (int i = 0; i < y.length; i++) {
            double p = clamp(sigmoid(linearPredictor(i, beta)));
            nll -= y[i] * log(p) + (1 - y[i]) * log(1 - p);
        }
        if (!Double.isFinite(nll)) {
            throw new NumericDomainException("Negative log-likelihood evaluated to " + nll);
        }
        return nll;
    }

    /** X'(σ(Xβ) − y) */
    @Override
    public double[] gradient(double[] beta) {
        double[] g = new double[k];
        for (int i = 0; i < y.length; i++) {
            double r = sigmoid(linearPredictor(i, beta)) - y[i];
            for (int j = 0; j < k; j++) g[j] += x[i][j] * r;
        }
        return g;
    }

    /** Fisher information X'WX with W = diag(σ(1 − σ)). */
    @Override
    public RealMatrix hessian(double[] beta) {
        double[][] h = new double[k][k];
        for (int i = 0; i < y.length; i++) {
            double p = sigmoid(linearPredictor(i, beta));
            double w = p * (1 - p);
            for (int a = 0; a < k; a++) {
                for (int b = a; b < k; b++) h[a][b] += x[i][a] * x[i][b] * w;
            }
        }
        for (int a = 0; a < k; a++) {
            for (int b = 0; b < a; b++) h[a][b] = h[b][a];
        }
        return MatrixUtils.createRealMatrix(h);
    }

    /**
     * Log-likelihood of the intercept-only model, n·[ȳ·log ȳ + (1 − ȳ)·log(1 − ȳ)].
     */
    public double nullLogLikelihood() {
        double m = clamp(Inference.mean(y));
        return y.length * (m * log(m) + (1 - m) * log(1 - m));
    }

    /**
     * true if xᵢβ &gt; 0 exactly for the observations with yᵢ = 1 and xᵢβ &lt; 0 for the rest:
     * a separating hyperplane, so the likelihood has no finite maximizer.
     */
    public boolean separates(double[] beta) {
        for (int i = 0; i < y.length; i++) {
            double z = linearPredictor(i, beta);
            if (y[i] == 1 ? z <= 0 : z >= 0) return false;
        }
        return true;
    }

    private static double clamp(double p) {
        return Math.min(Math.max(p, EPSILON), 1 - EPSILON);
    }

    private static double log(double p) {
        if (!(p > 0)) {
            throw new NumericDomainException("log of non-positive probability " + p);
        }
        return Math.log(p);
    }

    private void checkDimension(double[] beta) {
        if (beta.length != k) {
            throw new IllegalArgumentException("Expected " + k + " coefficients, got " + beta.length);
        }
    }
}
