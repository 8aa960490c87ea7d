package pl.marcinmilkowski.harmony_scan.grammar;

import java.util.List;

/**
 * A compiled progression pattern: the text it came from and its elements in order.
 */
public record ProgressionPattern(String source, List<PatternToken> tokens) {

    public ProgressionPattern {
        tokens = List.copyOf(tokens);
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public PatternToken get(int index) {
        return tokens.get(index);
    }

    @Override
    public String toString() {
        return source;
    }
}
