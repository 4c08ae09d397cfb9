package regstat;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import regstat.ml.LogitOptions;
import regstat.ml.RegressionException;
import regstat.ml.RegressionModel;
import regstat.ml.RegressionResults;
import regstat.ml.RegressionType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Demo: OLS (educ on sex and age) and Logit (white on sex, age and educ) on the bundled sample.
 * Run with: mvn exec:java
 * An optional argument selects the family ("ols" or "logit"); without it both are fitted.
 */
public class Main {

    private static final Logger logger = LogManager.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            if (args.length > 0 && args[0] != null && !args[0].trim().isEmpty()) {
                RegressionType type = RegressionType.parse(args[0]);
                print(type == RegressionType.OLS ? olsDemo() : logitDemo());
                return;
            }
            print(olsDemo());
            print(logitDemo());
        } catch (RegressionException e) {
            logger.error("Fit failed: {}", e.getMessage());
            System.exit(1);
        }
    }

    // --- Linear regression: years of education explained by sex and age
    static RegressionResults olsDemo() {
        Map<String, double[]> x = new LinkedHashMap<>();
        x.put("sex", SampleData.sex());
        x.put("age", SampleData.age());
        RegressionModel model = new RegressionModel(x, SampleData.educ(), true, RegressionType.OLS);
        return model.fit();
    }

    // --- Logistic regression: probability of identifying as white
    static RegressionResults logitDemo() {
        RegressionModel model = new RegressionModel(SampleData.regressors(), SampleData.white(), true,
            RegressionType.LOGIT, new LogitOptions());
        return model.fit();
    }

    private static void print(RegressionResults results) {
        System.out.println("=== " + results.getType() + " ===");
        System.out.println(results.summary());
    }
}
