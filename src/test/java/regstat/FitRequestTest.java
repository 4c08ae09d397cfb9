package regstat;

import org.junit.jupiter.api.Test;
import regstat.ml.CovarianceType;
import regstat.ml.InvalidConfigurationException;
import regstat.ml.RegressionModel;
import regstat.ml.RegressionType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FitRequestTest {

    private static final String BODY = "{"
        + "\"columns\": {\"x2\": [1, 2, 3, 4, 5], \"x1\": [2, 1, 4, 3, 6]},"
        + "\"response\": [1.5, 2.0, 3.9, 4.1, 6.2],"
        + "\"regressionType\": \"ols\","
        + "\"options\": {\"covariance\": \"observed_information\"}"
        + "}";

    @Test
    public void testParse() {
        FitRequest r = FitRequest.parse(BODY);
        assertThat(r.getColumns().keySet()).containsExactly("x2", "x1");
        assertThat(r.getColumns().get("x1")).containsExactly(2, 1, 4, 3, 6);
        assertThat(r.getResponse()).containsExactly(1.5, 2.0, 3.9, 4.1, 6.2);
        assertThat(r.getRegressionType()).isEqualTo("ols");
        assertThat(r.isCreateIntercept()).isTrue();
        assertThat(r.getOptions().getCovariance()).isEqualTo(CovarianceType.OBSERVED_INFORMATION);

        RegressionModel model = r.toModel();
        assertThat(model.getType()).isEqualTo(RegressionType.OLS);
        assertThat(model.getDesign().names()).containsExactly("x2", "x1", "intercept");
    }

    @Test
    public void testInterceptCanBeDisabled() {
        FitRequest r = FitRequest.parse(BODY.replace("\"regressionType\"", "\"createIntercept\": false, \"regressionType\""));
        assertThat(r.isCreateIntercept()).isFalse();
        assertThat(r.toModel().getDesign().names()).containsExactly("x2", "x1");
    }

    @Test
    public void testInterceptFlagMustBeBoolean() {
        for (String value : new String[]{"1", "\"yes\"", "{}", "[true]"}) {
            String body = BODY.replace("\"regressionType\"", "\"createIntercept\": " + value + ", \"regressionType\"");
            assertThatThrownBy(() -> FitRequest.parse(body))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("createIntercept");
        }
        String explicitNull = BODY.replace("\"regressionType\"", "\"createIntercept\": null, \"regressionType\"");
        assertThat(FitRequest.parse(explicitNull).isCreateIntercept()).isTrue();
    }

    @Test
    public void testOptionsMustBeAnObject() {
        String body = BODY.replace("{\"covariance\": \"observed_information\"}", "\"observed_information\"");
        assertThatThrownBy(() -> FitRequest.parse(body))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("options");
    }

    @Test
    public void testMalformedBodies() {
        assertThatThrownBy(() -> FitRequest.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FitRequest.parse("{not json")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FitRequest.parse("[1, 2]")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FitRequest.parse("{\"response\": [1]}"))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("columns");
        assertThatThrownBy(() -> FitRequest.parse(BODY.replace("[1.5,", "[\"a\",")))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("numbers");
    }

    @Test
    public void testUnknownRegressionType() {
        FitRequest r = FitRequest.parse(BODY.replace("\"ols\"", "\"probit\""));
        assertThatThrownBy(r::toModel).isInstanceOf(InvalidConfigurationException.class);
    }
}
