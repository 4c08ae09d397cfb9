package regstat;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;
import regstat.ml.LogitOptions;
import regstat.ml.RegressionModel;
import regstat.ml.RegressionType;

import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of {@code POST /api/fit}:
 * <pre>
 * {
 *   "columns": {"sex": [...], "age": [...]},
 *   "response": [...],
 *   "regressionType": "logit",
 *   "createIntercept": true,
 *   "options": {"covariance": "observed_information"}
 * }
 * </pre>
 * {@code createIntercept} defaults to true; {@code options} applies to logit only.
 */
public class FitRequest {

    private static final Gson GSON = new Gson();

    private final Map<String, double[]> columns;
    private final double[] response;
    private final String regressionType;
    private final boolean createIntercept;
    private final LogitOptions options;

    FitRequest(Map<String, double[]> columns, double[] response, String regressionType,
               boolean createIntercept, LogitOptions options) {
        this.columns = columns;
        this.response = response;
        this.regressionType = regressionType;
        this.createIntercept = createIntercept;
        this.options = options;
    }

    /**
     * @throws IllegalArgumentException when the body is not a JSON object of the expected shape
     */
    public static FitRequest parse(String body) {
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("Missing request body");
        }
        JsonObject req;
        try {
            JsonElement root = JsonParser.parseString(body);
            if (!root.isJsonObject()) throw new IllegalArgumentException("Request body must be a JSON object");
            req = root.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getMessage(), e);
        }

        JsonElement cols = req.get("columns");
        if (cols == null || !cols.isJsonObject() || cols.getAsJsonObject().size() == 0) {
            throw new IllegalArgumentException("Missing or invalid 'columns' object");
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> e : cols.getAsJsonObject().entrySet()) {
            columns.put(e.getKey(), numbers(e.getValue(), "columns." + e.getKey()));
        }
        double[] response = numbers(req.get("response"), "response");

        JsonElement type = req.get("regressionType");
        if (type == null || !type.isJsonPrimitive()) {
            throw new IllegalArgumentException("Missing 'regressionType' (ols or logit)");
        }
        JsonElement intercept = req.get("createIntercept");
        boolean createIntercept = true;
        if (intercept != null && !intercept.isJsonNull()) {
            if (!intercept.isJsonPrimitive() || !intercept.getAsJsonPrimitive().isBoolean()) {
                throw new IllegalArgumentException("'createIntercept' must be true or false, got " + intercept);
            }
            createIntercept = intercept.getAsBoolean();
        }

        LogitOptions options = new LogitOptions();
        JsonElement opts = req.get("options");
        if (opts != null && !opts.isJsonNull()) {
            if (!opts.isJsonObject()) {
                throw new IllegalArgumentException("'options' must be a JSON object, got " + opts);
            }
            Type mapType = new TypeToken<Map<String, Object>>() {}.getType();
            Map<String, Object> values = GSON.fromJson(opts, mapType);
            options = LogitOptions.fromMap(values);
        }
        return new FitRequest(columns, response, type.getAsString(), createIntercept, options);
    }

    private static double[] numbers(JsonElement value, String field) {
        if (value == null || !value.isJsonArray()) {
            throw new IllegalArgumentException("Missing or invalid '" + field + "' array");
        }
        JsonArray arr = value.getAsJsonArray();
        double[] out = new double[arr.size()];
        for (int i = 0; i < out.length; i++) {
            JsonElement v = arr.get(i);
            if (!v.isJsonPrimitive() || !v.getAsJsonPrimitive().isNumber()) {
                throw new IllegalArgumentException("All values of '" + field + "' must be numbers");
            }
            out[i] = v.getAsDouble();
        }
        return out;
    }

    /**
     * @throws regstat.ml.InvalidConfigurationException for an unknown regression type
     */
    public RegressionModel toModel() {
        return new RegressionModel(columns, response, createIntercept, RegressionType.parse(regressionType), options);
    }

    public Map<String, double[]> getColumns() { return columns; }
    public double[] getResponse() { return response; }
    public String getRegressionType() { return regressionType; }
    public boolean isCreateIntercept() { return createIntercept; }
    public LogitOptions getOptions() { return options; }
}
