package regstat.ml;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Numeric design matrix X (rows = observations, columns = regressors) with the
 * ordered column names used to align coefficients downstream.
 * <p>
 * Column order is the insertion order of the regressors, followed by a column of
 * 1s named {@value #INTERCEPT} when an intercept is requested.
 */
public class DesignMatrix {

    public static final String INTERCEPT = "intercept";

    private final double[][] data;
    private final List<String> names;
    private final boolean intercept;

    private DesignMatrix(double[][] data, List<String> names, boolean intercept) {
        this.data = data;
        this.names = Collections.unmodifiableList(names);
        this.intercept = intercept;
    }

    /**
     * Build from named columns.
     *
     * @param columns regressor columns in the order they should appear (e.g. a {@link java.util.LinkedHashMap})
     * @param createIntercept append a constant column named {@value #INTERCEPT}
     */
    public static DesignMatrix of(Map<String, double[]> columns, boolean createIntercept) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("At least one regressor column is required");
        }
        List<String> names = new ArrayList<>(columns.keySet());
        int n = -1;
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            if (e.getValue() == null) {
                throw new IllegalArgumentException("Column '" + e.getKey() + "' is null");
            }
            if (n < 0) n = e.getValue().length;
            else if (e.getValue().length != n) {
                throw new IllegalArgumentException("Column '" + e.getKey() + "' has " + e.getValue().length
                    + " rows, expected " + n);
            }
        }
        double[][] rows = new double[n][names.size()];
        for (int j = 0; j < names.size(); j++) {
            double[] col = columns.get(names.get(j));
            for (int i = 0; i < n; i++) rows[i][j] = col[i];
        }
        return build(rows, names, createIntercept);
    }

    /**
     * Build from a row matrix plus column names.
     *
     * @param X rows = observations, columns = regressors (no intercept column)
     * @param names one name per column of X
     */
    public static DesignMatrix of(double[][] X, List<String> names, boolean createIntercept) {
        if (X == null || names == null) {
            throw new IllegalArgumentException("X and names must be non-null");
        }
        double[][] rows = new double[X.length][];
        for (int i = 0; i < X.length; i++) {
            if (X[i] == null || X[i].length != names.size()) {
                throw new IllegalArgumentException("Row " + i + " does not have " + names.size() + " values");
            }
            rows[i] = X[i].clone();
        }
        return build(rows, new ArrayList<>(names), createIntercept);
    }

    private static DesignMatrix build(double[][] rows, List<String> names, boolean createIntercept) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Design matrix must have at least one row");
        }
        if (names.isEmpty()) {
            throw new IllegalArgumentException("Design matrix must have at least one column");
        }
        for (int j = 0; j < names.size(); j++) {
            String name = names.get(j);
            if (name == null) throw new IllegalArgumentException("Column " + j + " has no name");
            if (names.indexOf(name) != j) throw new IllegalArgumentException("Duplicate column name '" + name + "'");
        }
        if (!createIntercept) {
            return new DesignMatrix(rows, names, false);
        }
        if (names.contains(INTERCEPT)) {
            throw new IllegalArgumentException("'" + INTERCEPT + "' is reserved for the constant column");
        }
        int k = names.size();
        double[][] design = new double[rows.length][k + 1];
        for (int i = 0; i < rows.length; i++) {
            System.arraycopy(rows[i], 0, design[i], 0, k);
            design[i][k] = 1.0;
        }
        names.add(INTERCEPT);
        return new DesignMatrix(design, names, true);
    }

    /** Number of observations n. */
    public int rows() { return data.length; }

    /** Number of columns k, intercept included. */
    public int columns() { return names.size(); }

    public List<String> names() { return names; }

    /** Column index of {@code name}, or -1. */
    public int indexOf(String name) { return names.indexOf(name); }

    public boolean hasIntercept() { return intercept; }

    public double[] column(int j) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) out[i] = data[i][j];
        return out;
    }

    public double[] row(int i) { return data[i].clone(); }

    public RealMatrix matrix() {
        return MatrixUtils.createRealMatrix(data);
    }

    /** X'X */
    public RealMatrix gram() {
        RealMatrix X = matrix();
        return X.transpose().multiply(X);
    }

    /**
     * Append the intercept to raw regressor rows the same way this matrix was built,
     * so that {@code row · β} lines up with the coefficient vector.
     */
    public double[][] align(double[][] raw) {
        int k = hasIntercept() ? columns() - 1 : columns();
        double[][] out = new double[raw.length][columns()];
        for (int i = 0; i < raw.length; i++) {
            if (raw[i] == null || raw[i].length != k) {
                throw new IllegalArgumentException("Row " + i + " must have " + k + " values");
            }
            System.arraycopy(raw[i], 0, out[i], 0, k);
            if (hasIntercept()) out[i][k] = 1.0;
        }
        return out;
    }
}
