package regstat.ml;

import org.junit.jupiter.api.Test;
import regstat.SampleData;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class LogitEstimatorTest {

    // white ~ sex + age + educ + intercept, maximized by Newton-Raphson to machine precision
    private static final double[] BETA = {-1.5691191021049975, 0.006356392800282015, 0.11702144768502375, 1.5720712810461448};
    private static final double MIN_NLL = 27.637698318072562;

    private static DesignMatrix sampleDesign() {
        return DesignMatrix.of(SampleData.regressors(), true);
    }

    @Test
    public void testReferenceValues() {
        Estimate e = new LogitEstimator().fit(sampleDesign(), SampleData.white());

        assertThat(e.getType()).isEqualTo(RegressionType.LOGIT);
        assertThat(e.getWarnings()).isEmpty();
        assertThat(e.getCoefficients()).containsExactly(BETA, within(1e-3));
        // the response-variance covariance does not depend on β
        assertThat(e.getStandardErrors()).containsExactly(
            new double[]{0.5712973082032821, 0.0155170867292077, 0.07105759589719496, 1.238724823139705}, within(1e-9));
        assertThat(e.getStatistics()).containsExactly(
            new double[]{-2.746589349492725, 0.40963828527924784, 1.6468534603158906, 1.269104527235945}, within(1e-2));
        assertThat(e.getPValues()).containsExactly(
            new double[]{0.006021848086030124, 0.6820713078684544, 0.09958816980067065, 0.2044037858266876}, within(1e-3));

        assertThat(e.getFitStatistics().get("log_likelihood")).isCloseTo(-MIN_NLL, within(1e-6));
        assertThat(e.getFitStatistics().get("pseudo_r_squared")).isBetween(0.0, 1.0);
    }

    @Test
    public void testObservedInformationCovariance() {
        LogitOptions options = new LogitOptions().setCovariance(CovarianceType.OBSERVED_INFORMATION);
        Estimate e = new LogitEstimator(options).fit(sampleDesign(), SampleData.white());

        assertThat(e.getCoefficients()).containsExactly(BETA, within(1e-3));
        assertThat(e.getStandardErrors()).containsExactly(
            new double[]{0.842319775291881, 0.019256080371420133, 0.09713982343473042, 1.5575082965663845}, within(1e-3));
        assertThat(e.getPValues()).containsExactly(
            new double[]{0.06248275347566734, 0.7413259464869411, 0.22833065580759215, 0.31280672191866943}, within(1e-3));
    }

    @Test
    public void testObjectiveDecreasesFromInitialGuess() {
        DesignMatrix d = sampleDesign();
        LogLikelihood nll = new LogLikelihood(d, SampleData.white());
        double atStart = nll.value(LogitEstimator.initialGuess(d.columns(), 0.1));
        Estimate e = new LogitEstimator().fit(d, SampleData.white());

        assertThat(atStart).isCloseTo(55.10011559857142, within(1e-9));
        assertThat(nll.value(e.getCoefficients())).isLessThanOrEqualTo(atStart);
        assertThat(nll.value(e.getCoefficients())).isCloseTo(MIN_NLL, within(1e-6));
    }

    @Test
    public void testPowellReachesTheSameOptimum() {
        LogitOptions options = new LogitOptions().setMinimizer(MinimizerType.POWELL);
        DesignMatrix d = sampleDesign();
        Estimate e = new LogitEstimator(options).fit(d, SampleData.white());
        assertThat(new LogLikelihood(d, SampleData.white()).value(e.getCoefficients()))
            .isCloseTo(MIN_NLL, within(1e-3));
    }

    @Test
    public void testDeterministic() {
        Estimate a = new LogitEstimator().fit(sampleDesign(), SampleData.white());
        Estimate b = new LogitEstimator().fit(sampleDesign(), SampleData.white());
        assertThat(b.getCoefficients()).containsExactly(a.getCoefficients());
        assertThat(b.getStandardErrors()).containsExactly(a.getStandardErrors());
        assertThat(b.getPValues()).containsExactly(a.getPValues());
    }

    @Test
    public void testPerfectSeparationIsReported() {
        Map<String, double[]> x = new LinkedHashMap<>();
        x.put("x", new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10});
        double[] y = {0, 0, 0, 0, 0, 1, 1, 1, 1, 1};
        Estimate e = new LogitEstimator().fit(DesignMatrix.of(x, true), y);

        assertThat(e.isConverged()).isFalse();
        assertThat(e.getWarnings()).extracting(ConvergenceWarning::getKind)
            .contains(ConvergenceWarning.Kind.PERFECT_SEPARATION);
        assertThat(e.getCoefficients()[0]).isFinite().isGreaterThan(1.0);
    }

    @Test
    public void testSeparationWithObservedInformationIsNamed() {
        Map<String, double[]> x = new LinkedHashMap<>();
        x.put("x", new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10});
        double[] y = {0, 0, 0, 0, 0, 1, 1, 1, 1, 1};
        LogitOptions options = new LogitOptions().setCovariance(CovarianceType.OBSERVED_INFORMATION);
        assertThatThrownBy(() -> new LogitEstimator(options).fit(DesignMatrix.of(x, true), y))
            .isInstanceOf(SingularMatrixException.class)
            .hasMessageContaining("perfectly separated");
    }

    @Test
    public void testExhaustedBudgetIsAWarningNotAFailure() {
        LogitOptions options = new LogitOptions().setMaxIterations(1);
        DesignMatrix d = sampleDesign();
        Estimate e = new LogitEstimator(options).fit(d, SampleData.white());

        assertThat(e.getWarnings()).extracting(ConvergenceWarning::getKind)
            .containsExactly(ConvergenceWarning.Kind.NOT_CONVERGED);
        assertThat(Arrays.stream(e.getCoefficients()).boxed()).allSatisfy(c -> assertThat(c).isFinite());
        LogLikelihood nll = new LogLikelihood(d, SampleData.white());
        assertThat(nll.value(e.getCoefficients())).isLessThan(nll.value(LogitEstimator.initialGuess(4, 0.1)));
    }

    @Test
    public void testSingleClassResponse() {
        double[] ones = new double[101];
        Arrays.fill(ones, 1);
        assertThatThrownBy(() -> new LogitEstimator().fit(sampleDesign(), ones))
            .isInstanceOf(InsufficientDataException.class)
            .hasMessageContaining("both classes");
    }

    @Test
    public void testNonBinaryResponse() {
        double[] y = SampleData.white();
        y[3] = 2;
        assertThatThrownBy(() -> new LogitEstimator().fit(sampleDesign(), y))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testNonFiniteCoefficientsFail() {
        assertThatThrownBy(() -> LogitEstimator.checkFinite(new double[]{1, Double.NaN}))
            .isInstanceOf(OptimizationFailedException.class);
        LogitEstimator.checkFinite(new double[]{1, -2});
    }

    @Test
    public void testCollinearDesignIsSingular() {
        Map<String, double[]> x = new LinkedHashMap<>();
        x.put("a", new double[]{1, 2, 3, 4, 5, 6, 7, 8});
        x.put("twice_a", new double[]{2, 4, 6, 8, 10, 12, 14, 16});
        double[] y = {0, 1, 0, 0, 1, 1, 0, 1};
        assertThatThrownBy(() -> new LogitEstimator().fit(DesignMatrix.of(x, true), y))
            .isInstanceOf(SingularMatrixException.class);
    }
}
