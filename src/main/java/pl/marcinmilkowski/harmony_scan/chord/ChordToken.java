package pl.marcinmilkowski.harmony_scan.chord;

/**
 * A chord of a piece after tokenization: where it sits, its canonical token and its literal.
 *
 * An empty token marks a chord that could not be analysed; it still occupies its position.
 */
public record ChordToken(
    int bar,          // Bar number of the chord
    String token,     // Canonical token, possibly empty
    String literal    // Normalized literal as written
) {

    public ChordToken {
        token = token == null ? "" : token;
        literal = literal == null ? "" : literal;
    }

    public boolean isEmpty() {
        return token.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("m %3d: %-8s (%s)", bar, token, literal);
    }
}
