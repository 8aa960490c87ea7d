package pl.marcinmilkowski.harmony_scan.indexer;

import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.harmony_scan.chord.ChordToken;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChordTokenStreamTest {

    private static List<String> emitted(List<ChordToken> chords) throws IOException {
        List<String> out = new ArrayList<>();
        try (ChordTokenStream stream = new ChordTokenStream()) {
            stream.setTokens(chords);
            CharTermAttribute term = stream.getAttribute(CharTermAttribute.class);
            PositionIncrementAttribute posInc = stream.getAttribute(PositionIncrementAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                out.add(posInc.getPositionIncrement() + ":" + term);
            }
            stream.end();
        }
        return out;
    }

    @Test
    @DisplayName("Family terms are stacked on the chord's position")
    void stackedFamilyTerms() throws IOException {
        List<String> terms = emitted(List.of(
            new ChordToken(1, "ii-7", "Dm7"),
            new ChordToken(2, "V7(b9)", "G7b9"),
            new ChordToken(3, "Imaj7", "Cmaj7")));

        assertEquals(List.of(
            "1:ii-7", "0:*min:ii",
            "1:V7(b9)", "0:*dom:V",
            "1:Imaj7", "0:*maj:I"), terms);
    }

    @Test
    @DisplayName("Empty and family-less tokens still take one position")
    void placeholdersKeepPositions() throws IOException {
        List<String> terms = emitted(List.of(
            new ChordToken(1, "", "N.C."),
            new ChordToken(2, "viiø7", "Bm7b5"),
            new ChordToken(3, "bVI", "Ab")));

        assertEquals(List.of("1:_", "1:viiø7", "1:bVI", "0:*maj:bVI"), terms);
    }

    @Test
    void familyTermForUnresolvedToken() {
        assertTrue(ChordTokenStream.familyTerm("V9").isEmpty());
        assertTrue(ChordTokenStream.familyTerm("").isEmpty());
        assertEquals("*min:#iv", ChordTokenStream.familyTerm("#iv-6").orElseThrow());
    }
}
