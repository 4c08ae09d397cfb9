package regstat.ml;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

final class Matrices {

    private Matrices() {}

    /**
     * (M)⁻¹ through an LU decomposition.
     *
     * @param what description used in the failure message, e.g. "X'X"
     * @throws SingularMatrixException if M is singular
     */
    static RealMatrix inverse(RealMatrix m, String what) {
        DecompositionSolver solver = new LUDecomposition(m).getSolver();
        if (!solver.isNonSingular()) {
            throw new SingularMatrixException(what + " is singular; cannot compute (" + what + ")⁻¹");
        }
        return solver.getInverse();
    }
}
