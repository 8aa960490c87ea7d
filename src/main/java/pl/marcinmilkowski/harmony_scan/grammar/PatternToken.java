package pl.marcinmilkowski.harmony_scan.grammar;

/**
 * One compiled element of a progression pattern.
 *
 * Exact elements match a canonical token by string equality; wildcard elements
 * match any chord of their {@link TokenFamily} on the same degree head.
 */
public record PatternToken(
    String accidental,     // "", "b" or "#"
    String degree,         // I..VII in either case
    String exactSuffix,    // quality suffix as written, null when absent
    boolean wildcard,      // trailing '*'
    TokenFamily family     // selected family, null for exact elements
) {

    /**
     * Accidental plus degree, e.g. {@code bVII}.
     */
    public String head() {
        return accidental + degree;
    }

    /**
     * The canonical token an exact element must equal.
     */
    public String exactText() {
        return head() + (exactSuffix == null ? "" : exactSuffix);
    }

    @Override
    public String toString() {
        return exactText() + (wildcard ? "*" : "");
    }
}
