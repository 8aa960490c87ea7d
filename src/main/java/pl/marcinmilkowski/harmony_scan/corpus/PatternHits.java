package pl.marcinmilkowski.harmony_scan.corpus;

import pl.marcinmilkowski.harmony_scan.grammar.ProgressionPattern;
import pl.marcinmilkowski.harmony_scan.query.MatchHit;

import java.util.List;

/**
 * Hits of one pattern within one piece.
 */
public record PatternHits(ProgressionPattern pattern, List<MatchHit> hits) {

    public PatternHits {
        hits = List.copyOf(hits);
    }

    public int count() {
        return hits.size();
    }
}
