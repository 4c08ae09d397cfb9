package regstat.ml;

import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.PowellOptimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Derivative-free minimization by Powell's conjugate direction method. Uses only
 * {@link Objective#value}; slower than {@link ConjugateGradientMinimizer} but a useful
 * cross-check.
 */
public class PowellMinimizer implements Minimizer {

    private static final Logger logger = LogManager.getLogger(PowellMinimizer.class);

    private final int maxIterations;
    private final int maxEvaluations;
    private final double relativeTolerance;
    private final double absoluteTolerance;

    public PowellMinimizer(int maxIterations, int maxEvaluations, double relativeTolerance, double absoluteTolerance) {
        this.maxIterations = maxIterations;
        this.maxEvaluations = maxEvaluations;
        this.relativeTolerance = relativeTolerance;
        this.absoluteTolerance = absoluteTolerance;
    }

    @Override
    public Minimum minimize(Objective objective, double[] initialGuess) {
        BestPointTracker tracker = new BestPointTracker(objective, initialGuess);
        PowellOptimizer opt = new PowellOptimizer(relativeTolerance, absoluteTolerance);
        try {
            PointValuePair result = opt.optimize(
                new MaxEval(maxEvaluations),
                new MaxIter(maxIterations),
                new ObjectiveFunction(tracker),
                GoalType.MINIMIZE,
                new InitialGuess(initialGuess)
            );
            logger.debug("Powell converged after {} iterations, {} evaluations", opt.getIterations(), opt.getEvaluations());
            return new Minimum(result.getPoint(), result.getValue(), true, opt.getIterations(), opt.getEvaluations());
        } catch (TooManyIterationsException | TooManyEvaluationsException e) {
            logger.debug("Powell stopped without converging: {}", e.getMessage());
            return new Minimum(tracker.bestPoint(), tracker.bestValue(), false,
                opt.getIterations(), opt.getEvaluations());
        }
    }
}
