package regstat.ml;

/** Inference for one regressor. The test statistic is a t-statistic for OLS, a z-statistic for Logit. */
public class InferenceRecord {

    private final double coefficient;
    private final double standardError;
    private final double testStatistic;
    private final double pValue;

    public InferenceRecord(double coefficient, double standardError, double testStatistic, double pValue) {
        this.coefficient = coefficient;
        this.standardError = standardError;
        this.testStatistic = testStatistic;
        this.pValue = pValue;
    }

    public double getCoefficient() { return coefficient; }
    public double getStandardError() { return standardError; }
    public double getTestStatistic() { return testStatistic; }
    public double getPValue() { return pValue; }

    @Override
    public String toString() {
        return String.format("InferenceRecord{coefficient=%.6f, standardError=%.6f, testStatistic=%.4f, pValue=%.4g}",
            coefficient, standardError, testStatistic, pValue);
    }
}
