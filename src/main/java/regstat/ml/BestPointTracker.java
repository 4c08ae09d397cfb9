package regstat.ml;

import org.apache.commons.math3.analysis.MultivariateFunction;

/**
 * Objective wrapper remembering the lowest value evaluated, so a search cut short by
 * its budget can still hand back its best point.
 */
class BestPointTracker implements MultivariateFunction {

    private final Objective objective;
    private double[] bestPoint;
    private double bestValue = Double.POSITIVE_INFINITY;

    BestPointTracker(Objective objective, double[] initialGuess) {
        if (initialGuess.length != objective.dimension()) {
            throw new IllegalArgumentException("Initial guess has " + initialGuess.length
                + " values, objective expects " + objective.dimension());
        }
        this.objective = objective;
        this.bestPoint = initialGuess.clone();
    }

    @Override
    public double value(double[] point) {
        double v = objective.value(point);
        if (v < bestValue) {
            bestValue = v;
            bestPoint = point.clone();
        }
        return v;
    }

    double[] bestPoint() { return bestPoint.clone(); }

    double bestValue() {
        return Double.isInfinite(bestValue) ? objective.value(bestPoint) : bestValue;
    }
}
