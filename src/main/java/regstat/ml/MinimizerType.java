package regstat.ml;

public enum MinimizerType {

    CONJUGATE_GRADIENT {
        @Override
        Minimizer create(LogitOptions options) {
            return new ConjugateGradientMinimizer(options.getMaxIterations(), options.getMaxEvaluations(),
                options.getRelativeTolerance(), options.getAbsoluteTolerance());
        }
    },

    POWELL {
        @Override
        Minimizer create(LogitOptions options) {
            return new PowellMinimizer(options.getMaxIterations(), options.getMaxEvaluations(),
                options.getRelativeTolerance(), options.getAbsoluteTolerance());
        }
    };

    abstract Minimizer create(LogitOptions options);
}
