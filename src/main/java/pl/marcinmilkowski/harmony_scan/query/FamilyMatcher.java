package pl.marcinmilkowski.harmony_scan.query;

import pl.marcinmilkowski.harmony_scan.chord.CanonicalTokens;
import pl.marcinmilkowski.harmony_scan.grammar.PatternToken;

/**
 * Decides whether a canonical token satisfies one pattern element.
 *
 * Wildcards affect only quality, never root or function: {@code I*} will not match {@code ii} or {@code V7}.
 */
public class FamilyMatcher {

    public boolean matches(PatternToken element, String candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return false;
        }
        if (!element.wildcard()) {
            return element.exactText().equals(candidate);
        }
        if (!element.head().equals(CanonicalTokens.degreeHead(candidate))) {
            return false;
        }
        return element.family().accepts(CanonicalTokens.qualityOf(candidate));
    }
}
