package regstat.ml;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-variable view of an {@link Estimate}: a name → {@link InferenceRecord} mapping in
 * design-matrix column order, plus a text summary and a JSON rendering.
 */
public class RegressionResults {

    private static final Gson GSON = new GsonBuilder()
        .serializeSpecialFloatingPointValues()
        .setPrettyPrinting()
        .create();

    private final RegressionType type;
    private final Map<String, InferenceRecord> records;
    private final Map<String, Double> fitStatistics;
    private final List<ConvergenceWarning> warnings;

    RegressionResults(RegressionType type, Map<String, InferenceRecord> records,
                      Map<String, Double> fitStatistics, List<ConvergenceWarning> warnings) {
        this.type = type;
        this.records = Collections.unmodifiableMap(records);
        this.fitStatistics = fitStatistics;
        this.warnings = warnings;
    }

    /**
     * Pair each name with the values at the same index.
     *
     * @throws ShapeMismatchException unless all five sequences have the same length
     */
    public static RegressionResults assemble(RegressionType type, List<String> names,
                                             double[] coefficients, double[] standardErrors,
                                             double[] statistics, double[] pValues,
                                             Map<String, Double> fitStatistics,
                                             List<ConvergenceWarning> warnings) {
        int k = names.size();
        if (coefficients.length != k || standardErrors.length != k
            || statistics.length != k || pValues.length != k) {
            throw new ShapeMismatchException("Cannot align " + k + " names with " + coefficients.length
                + " coefficients, " + standardErrors.length + " standard errors, " + statistics.length
                + " statistics and " + pValues.length + " p-values");
        }
        Map<String, InferenceRecord> records = new LinkedHashMap<>();
        for (int j = 0; j < k; j++) {
            records.put(names.get(j),
                new InferenceRecord(coefficients[j], standardErrors[j], statistics[j], pValues[j]));
        }
        return new RegressionResults(type, records, fitStatistics, warnings);
    }

    public static RegressionResults assemble(List<String> names, Estimate estimate) {
        return assemble(estimate.getType(), names, estimate.getCoefficients(), estimate.getStandardErrors(),
            estimate.getStatistics(), estimate.getPValues(), estimate.getFitStatistics(), estimate.getWarnings());
    }

    public RegressionType getType() { return type; }

    /** Variable name → inference, in design-matrix column order. */
    public Map<String, InferenceRecord> getRecords() { return records; }

    public InferenceRecord get(String name) {
        InferenceRecord r = records.get(name);
        if (r == null) throw new IllegalArgumentException("No variable named '" + name + "'");
        return r;
    }

    public Map<String, Double> getFitStatistics() { return fitStatistics; }

    public List<ConvergenceWarning> getWarnings() { return warnings; }

    /**
     * Table with the columns Variable name, coefficient value, standard error, t- or
     * z-statistic and p-value, followed by the goodness-of-fit statistics and warnings.
     */
    public String summary() {
        int width = "Variable name".length();
        for (String name : records.keySet()) width = Math.max(width, name.length());
        String header = "%-" + width + "s  %18s  %16s  %14s  %12s%n";
        String row = "%-" + width + "s  %18.6f  %16.6f  %14.4f  %12.4g%n";

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%s regression results%n", type.name()));
        sb.append(String.format(header, "Variable name", "coefficient value", "standard error",
            type.statisticLabel(), "p-value"));
        for (Map.Entry<String, InferenceRecord> e : records.entrySet()) {
            InferenceRecord r = e.getValue();
            sb.append(String.format(row, e.getKey(), r.getCoefficient(), r.getStandardError(),
                r.getTestStatistic(), r.getPValue()));
        }
        for (Map.Entry<String, Double> e : fitStatistics.entrySet()) {
            sb.append(String.format("%s: %.6g%n", e.getKey(), e.getValue()));
        }
        for (ConvergenceWarning w : warnings) {
            sb.append("Warning: ").append(w.getMessage()).append(System.lineSeparator());
        }
        return sb.toString();
    }

    public JsonObject toJsonTree() {
        JsonObject out = new JsonObject();
        out.addProperty("regressionType", type.toString());
        JsonObject vars = new JsonObject();
        for (Map.Entry<String, InferenceRecord> e : records.entrySet()) {
            InferenceRecord r = e.getValue();
            JsonObject o = new JsonObject();
            o.addProperty("coefficient", r.getCoefficient());
            o.addProperty("standard_error", r.getStandardError());
            o.addProperty(type.statisticKey(), r.getTestStatistic());
            o.addProperty("p_value", r.getPValue());
            vars.add(e.getKey(), o);
        }
        out.add("results", vars);
        JsonObject stats = new JsonObject();
        for (Map.Entry<String, Double> e : fitStatistics.entrySet()) stats.addProperty(e.getKey(), e.getValue());
        out.add("fit", stats);
        JsonArray warn = new JsonArray();
        for (ConvergenceWarning w : warnings) warn.add(w.getMessage());
        out.add("warnings", warn);
        return out;
    }

    public String toJson() {
        return GSON.toJson(toJsonTree());
    }

    @Override
    public String toString() {
        return summary();
    }
}
