package regstat.ml;

import java.util.Locale;

/** Regression family, with the labels its results are reported under. */
public enum RegressionType {

    OLS("t_stat", "t-statistic"),
    LOGIT("z_stat", "z-statistic");

    private final String statisticKey;
    private final String statisticLabel;

    RegressionType(String statisticKey, String statisticLabel) {
        this.statisticKey = statisticKey;
        this.statisticLabel = statisticLabel;
    }

    /** Key of the test statistic in JSON output: {@code t_stat} or {@code z_stat}. */
    public String statisticKey() { return statisticKey; }

    /** Column header of the test statistic in the summary table. */
    public String statisticLabel() { return statisticLabel; }

    /**
     * Parse "ols" / "logit", ignoring case and surrounding blanks.
     *
     * @throws InvalidConfigurationException for anything else; there is no default family
     */
    public static RegressionType parse(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (RegressionType t : values()) {
                if (t.name().toLowerCase(Locale.ROOT).equals(v)) return t;
            }
        }
        throw new InvalidConfigurationException("Unknown regression type '" + value + "'; expected 'ols' or 'logit'");
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
