package pl.marcinmilkowski.harmony_scan.grammar;

/**
 * Thrown when a progression pattern contains a malformed token.
 */
public class PatternSyntaxException extends RuntimeException {

    private final String token;

    public PatternSyntaxException(String token, String message) {
        super(message);
        this.token = token;
    }

    /**
     * The offending pattern token, or null when the whole pattern is at fault.
     */
    public String getToken() {
        return token;
    }
}
