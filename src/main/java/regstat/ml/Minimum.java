package regstat.ml;

/** Point returned by a {@link Minimizer}, with how the search ended. */
public class Minimum {

    private final double[] point;
    private final double value;
    private final boolean converged;
    private final int iterations;
    private final int evaluations;

    public Minimum(double[] point, double value, boolean converged, int iterations, int evaluations) {
        this.point = point.clone();
        this.value = value;
        this.converged = converged;
        this.iterations = iterations;
        this.evaluations = evaluations;
    }

    public double[] getPoint() { return point.clone(); }
    public double getValue() { return value; }

    /** false when the iteration or evaluation budget ran out first. */
    public boolean isConverged() { return converged; }

    public int getIterations() { return iterations; }
    public int getEvaluations() { return evaluations; }
}
