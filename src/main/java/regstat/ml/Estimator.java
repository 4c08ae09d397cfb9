package regstat.ml;

/**
 * One regression family. Implementations are stateless between calls; everything a
 * fit produces is returned in the {@link Estimate}.
 */
public interface Estimator {

    /**
     * @param design design matrix X (n × k), intercept already appended if wanted
     * @param response y, length n
     */
    Estimate fit(DesignMatrix design, double[] response);
}
