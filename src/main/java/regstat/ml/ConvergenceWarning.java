package regstat.ml;

/**
 * Non-fatal report attached to an estimate whose coefficients are finite but whose
 * search did not end cleanly.
 */
public class ConvergenceWarning {

    public enum Kind {
        /** The minimizer ran out of iterations or evaluations. */
        NOT_CONVERGED,
        /** Every observation is classified correctly; the MLE does not exist. */
        PERFECT_SEPARATION
    }

    private final Kind kind;
    private final String message;

    public ConvergenceWarning(Kind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public Kind getKind() { return kind; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return "ConvergenceWarning{" + kind + ": " + message + "}";
    }
}
