package pl.marcinmilkowski.harmony_scan.query;

import java.util.List;

/**
 * One occurrence of a pattern in a piece.
 */
public record MatchHit(
    int startIndex,          // Position of the first matched chord in the piece's sequence
    int startBar,            // Bar of the first matched chord
    List<String> tokens,     // Matched canonical tokens, in order
    List<String> literals    // Their literals, in order
) {

    public MatchHit {
        tokens = List.copyOf(tokens);
        literals = List.copyOf(literals);
    }

    /** Tokens joined with single spaces. */
    public String tokenText() {
        return String.join(" ", tokens);
    }

    /** Literals joined with {@code " | "}. */
    public String literalText() {
        return String.join(" | ", literals);
    }

    @Override
    public String toString() {
        return "bar " + startBar + ": " + tokenText();
    }
}
