package regstat.ml;

import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunctionGradient;
import org.apache.commons.math3.optim.nonlinear.scalar.gradient.NonLinearConjugateGradientOptimizer;
import org.apache.commons.math3.optim.nonlinear.scalar.gradient.Preconditioner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Polak–Ribière nonlinear conjugate gradient, preconditioned by the objective's
 * curvature so that each direction is close to a Newton step.
 */
public class ConjugateGradientMinimizer implements Minimizer {

    private static final Logger logger = LogManager.getLogger(ConjugateGradientMinimizer.class);

    private static final double LINE_SEARCH_RELATIVE_TOLERANCE = 1e-10;
    private static final double LINE_SEARCH_ABSOLUTE_TOLERANCE = 1e-14;
    // a Newton-scaled direction has its minimum near a unit step
    private static final double INITIAL_BRACKETING_RANGE = 1.0;

    private final int maxIterations;
    private final int maxEvaluations;
    private final double relativeTolerance;
    private final double absoluteTolerance;

    public ConjugateGradientMinimizer(int maxIterations, int maxEvaluations,
                                      double relativeTolerance, double absoluteTolerance) {
        this.maxIterations = maxIterations;
        this.maxEvaluations = maxEvaluations;
        this.relativeTolerance = relativeTolerance;
        this.absoluteTolerance = absoluteTolerance;
    }

    @Override
    public Minimum minimize(Objective objective, double[] initialGuess) {
        BestPointTracker tracker = new BestPointTracker(objective, initialGuess);
        NonLinearConjugateGradientOptimizer opt = new NonLinearConjugateGradientOptimizer(
            NonLinearConjugateGradientOptimizer.Formula.POLAK_RIBIERE,
            new SimpleValueChecker(relativeTolerance, absoluteTolerance),
            LINE_SEARCH_RELATIVE_TOLERANCE,
            LINE_SEARCH_ABSOLUTE_TOLERANCE,
            INITIAL_BRACKETING_RANGE,
            new CurvaturePreconditioner(objective));
        try {
            PointValuePair result = opt.optimize(
                new MaxEval(maxEvaluations),
                new MaxIter(maxIterations),
                new ObjectiveFunction(tracker),
                new ObjectiveFunctionGradient(objective::gradient),
                GoalType.MINIMIZE,
                new InitialGuess(initialGuess)
            );
            logger.debug("Conjugate gradient converged after {} iterations, {} evaluations, value {}",
                opt.getIterations(), opt.getEvaluations(), result.getValue());
            return new Minimum(result.getPoint(), result.getValue(), true, opt.getIterations(), opt.getEvaluations());
        } catch (TooManyIterationsException | TooManyEvaluationsException e) {
            logger.debug("Conjugate gradient stopped without converging: {}", e.getMessage());
            return new Minimum(tracker.bestPoint(), tracker.bestValue(), false,
                opt.getIterations(), opt.getEvaluations());
        }
    }

    /**
     * Solves H·d = r for the search direction. Where the curvature is singular (e.g. a
     * saturated logistic fit) the plain steepest-descent direction r is used instead.
     */
    static class CurvaturePreconditioner implements Preconditioner {

        private final Objective objective;

        CurvaturePreconditioner(Objective objective) {
            this.objective = objective;
        }

        @Override
        public double[] precondition(double[] point, double[] r) {
            DecompositionSolver solver = new LUDecomposition(objective.hessian(point)).getSolver();
            if (!solver.isNonSingular()) {
                return r.clone();
            }
            double[] d = solver.solve(MatrixUtils.createRealVector(r)).toArray();
            for (double v : d) {
                if (!Double.isFinite(v)) return r.clone();
            }
            return d;
        }
    }
}
