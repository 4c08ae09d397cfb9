package regstat;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Synthetic 101-row data set shaped like a small survey: sex (1 = female), age in
 * years, years of education, and a 0/1 indicator for identifying as white.
 * <p>
 * The values are fixed but generated, not collected. {@code white} was drawn from a
 * logistic model in which sex matters and age does not, so estimates on it are only
 * comparable with results computed on this same data.
 */
public final class SampleData {

    private SampleData() {}

    private static final double[] SEX = {
            0, 1, 1, 0, 1, 1, 0, 0, 0, 1, 0, 0, 0, 0, 0, 1, 0, 1, 0, 0,
            1, 1, 1, 0, 1, 1, 0, 0, 1, 1, 1, 1, 1, 1, 0, 1, 0, 1, 1, 1,
            0, 1, 1, 1, 1, 1, 1, 0, 0, 0, 0, 1, 0, 1, 0, 0, 0, 0, 1, 0,
            1, 1, 0, 0, 0, 1, 0, 0, 1, 0, 1, 0, 0, 0, 0, 0, 1, 0, 0, 0,
            1, 1, 1, 0, 0, 1, 0, 1, 0, 1, 1, 0, 0, 1, 1, 0, 1, 1, 0, 0,
            0
    };

    private static final double[] AGE = {
            25, 36, 20, 52, 62, 67, 23, 28, 32, 76, 65, 64, 47, 46, 78, 35, 49, 32, 44, 40,
            24, 47, 54, 37, 30, 78, 32, 43, 25, 40, 34, 58, 29, 39, 49, 73, 75, 34, 35, 75,
            24, 71, 45, 68, 69, 73, 25, 31, 75, 52, 36, 75, 64, 22, 46, 47, 45, 36, 36, 57,
            74, 80, 21, 71, 62, 29, 72, 71, 63, 20, 68, 56, 24, 30, 76, 53, 46, 44, 80, 41,
            57, 41, 57, 76, 45, 70, 74, 50, 43, 38, 18, 31, 67, 21, 34, 67, 71, 53, 37, 19,
            62
    };

    private static final double[] EDUC = {
            8, 15, 14, 15, 15, 18, 17, 10, 6, 11, 16, 15, 7, 16, 10, 14, 7, 9, 12, 20,
            19, 20, 14, 12, 11, 6, 16, 15, 11, 11, 8, 15, 12, 13, 13, 19, 7, 6, 16, 9,
            20, 11, 11, 10, 11, 12, 6, 16, 15, 14, 10, 18, 12, 19, 10, 11, 6, 17, 11, 9,
            9, 16, 16, 10, 20, 11, 13, 14, 16, 11, 10, 18, 7, 10, 20, 11, 9, 6, 10, 7,
            18, 14, 11, 12, 16, 11, 15, 19, 19, 19, 17, 19, 15, 14, 14, 11, 14, 8, 13, 6,
            7
    };

    private static final double[] WHITE = {
            1, 1, 1, 1, 1, 1, 1, 1, 1, 0, 1, 1, 1, 1, 1, 1, 1, 0, 1, 1,
            1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 0, 1, 1, 1, 1, 1, 0,
            1, 1, 1, 1, 1, 0, 1, 1, 1, 1, 0, 1, 1, 1, 1, 0, 1, 1, 1, 1,
            1, 1, 1, 1, 1, 0, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1,
            1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 0, 1, 1, 1, 1, 1, 1, 1, 1, 1,
            1
    };

    /** Regressors sex, age, educ in that order. */
    public static Map<String, double[]> regressors() {
        Map<String, double[]> x = new LinkedHashMap<>();
        x.put("sex", SEX.clone());
        x.put("age", AGE.clone());
        x.put("educ", EDUC.clone());
        return x;
    }

    public static double[] white() { return WHITE.clone(); }

    public static double[] educ() { return EDUC.clone(); }

    public static double[] sex() { return SEX.clone(); }

    public static double[] age() { return AGE.clone(); }
}
