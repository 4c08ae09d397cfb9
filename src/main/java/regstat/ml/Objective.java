package regstat.ml;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Smooth scalar function of a coefficient vector, to be minimized.
 */
public interface Objective {

    /** Length of the points this objective accepts. */
    int dimension();

    double value(double[] point);

    double[] gradient(double[] point);

    /** Matrix of second derivatives at {@code point}. */
    RealMatrix hessian(double[] point);
}
