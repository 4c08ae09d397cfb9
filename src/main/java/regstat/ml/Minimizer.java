package regstat.ml;

/**
 * Unconstrained multivariate minimization.
 * <p>
 * Implementations return normally when their budget is exhausted, with
 * {@link Minimum#isConverged()} false and the best point they saw; they do not throw
 * for non-convergence.
 */
public interface Minimizer {

    Minimum minimize(Objective objective, double[] initialGuess);
}
