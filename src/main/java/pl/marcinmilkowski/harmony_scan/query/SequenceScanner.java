package pl.marcinmilkowski.harmony_scan.query;

import pl.marcinmilkowski.harmony_scan.chord.ChordToken;
import pl.marcinmilkowski.harmony_scan.grammar.ProgressionPattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Slides a pattern-sized window over a piece's chord sequence and reports every window that matches.
 *
 * Matching is adjacency based: no gaps, no reordering, unanalysed chords are not skipped.
 * Overlapping hits are all reported, left to right.
 */
public class SequenceScanner {

    private final FamilyMatcher matcher;

    public SequenceScanner(FamilyMatcher matcher) {
        this.matcher = matcher;
    }

    public SequenceScanner() {
        this(new FamilyMatcher());
    }

    public List<MatchHit> scan(List<ChordToken> sequence, ProgressionPattern pattern) {
        List<MatchHit> hits = new ArrayList<>();
        int n = pattern.size();
        if (n == 0) {
            return hits;
        }
        for (int i = 0; i + n <= sequence.size(); i++) {
            if (windowMatches(sequence, i, pattern)) {
                hits.add(toHit(sequence, i, n));
            }
        }
        return hits;
    }

    private boolean windowMatches(List<ChordToken> sequence, int start, ProgressionPattern pattern) {
        for (int j = 0; j < pattern.size(); j++) {
            if (!matcher.matches(pattern.get(j), sequence.get(start + j).token())) {
                return false;
            }
        }
        return true;
    }

    private static MatchHit toHit(List<ChordToken> sequence, int start, int length) {
        List<String> tokens = new ArrayList<>(length);
        List<String> literals = new ArrayList<>(length);
        for (ChordToken chord : sequence.subList(start, start + length)) {
            tokens.add(chord.token());
            literals.add(chord.literal());
        }
        return new MatchHit(start, sequence.get(start).bar(), tokens, literals);
    }
}
