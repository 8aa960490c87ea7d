package pl.marcinmilkowski.harmony_scan.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.harmony_scan.chord.ChordToken;
import pl.marcinmilkowski.harmony_scan.grammar.PatternParser;
import pl.marcinmilkowski.harmony_scan.grammar.ProgressionPattern;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SequenceScannerTest {

    private final PatternParser parser = new PatternParser();
    private final SequenceScanner scanner = new SequenceScanner();

    private static List<ChordToken> sequence(String... tokens) {
        List<ChordToken> out = new ArrayList<>();
        for (int i = 0; i < tokens.length; i++) {
            out.add(new ChordToken(i + 1, tokens[i], "lit" + (i + 1)));
        }
        return out;
    }

    @Test
    @DisplayName("Exact pattern matches at its start bar")
    void exactMatch() {
        List<MatchHit> hits = scanner.scan(sequence("ii-7", "V7", "Imaj7"), parser.parse("ii-7 V7 Imaj7"));

        assertEquals(1, hits.size());
        MatchHit hit = hits.get(0);
        assertEquals(0, hit.startIndex());
        assertEquals(1, hit.startBar());
        assertEquals("ii-7 V7 Imaj7", hit.tokenText());
        assertEquals("lit1 | lit2 | lit3", hit.literalText());
    }

    @Test
    @DisplayName("Exact and wildcard matching diverge on tensions")
    void exactVersusWildcard() {
        List<ChordToken> altered = sequence("ii-7", "V7(b9)", "Imaj7");
        assertTrue(scanner.scan(altered, parser.parse("ii-7 V7 Imaj7")).isEmpty());
        assertEquals(1, scanner.scan(altered, parser.parse("ii-7 V7* Imaj7")).size());
    }

    @Test
    @DisplayName("Overlapping windows are all reported")
    void overlappingHits() {
        ProgressionPattern pattern = parser.parse("I* I*");
        List<MatchHit> hits = scanner.scan(sequence("I", "I6", "Imaj7", "I69"), pattern);

        assertEquals(3, hits.size());
        assertEquals(List.of(0, 1, 2), hits.stream().map(MatchHit::startIndex).toList());
        assertEquals(List.of(1, 2, 3), hits.stream().map(MatchHit::startBar).toList());
    }

    @Test
    @DisplayName("Unanalysed chords break adjacency")
    void emptyTokenBreaksMatch() {
        List<MatchHit> hits = scanner.scan(sequence("ii-7", "", "V7", "I"), parser.parse("ii-7 V7"));
        assertTrue(hits.isEmpty());
    }

    @Test
    @DisplayName("Sequence shorter than the pattern yields nothing")
    void shortSequence() {
        assertTrue(scanner.scan(sequence("ii-7", "V7"), parser.parse("ii-7 V7 I*")).isEmpty());
        assertTrue(scanner.scan(List.of(), parser.parse("I*")).isEmpty());
    }

    @Test
    void emptyPatternYieldsNothing() {
        ProgressionPattern empty = new ProgressionPattern("", List.of());
        assertTrue(scanner.scan(sequence("I", "V7"), empty).isEmpty());
    }
}
