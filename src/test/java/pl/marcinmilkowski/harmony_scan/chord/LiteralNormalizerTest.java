package pl.marcinmilkowski.harmony_scan.chord;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LiteralNormalizerTest {

    @Test
    @DisplayName("Root minus and plus become flat and sharp")
    void rootAccidentals() {
        assertEquals("Eb7", LiteralNormalizer.normalize("E-7"));
        assertEquals("F#", LiteralNormalizer.normalize("F+"));
        assertEquals("Eb/Bb", LiteralNormalizer.normalize("E-/B-"));
        assertEquals("Ab (add9)", LiteralNormalizer.normalize("A- (add9)"));
    }

    @Test
    @DisplayName("Minus that does not follow a root letter is left alone")
    void minusAfterQualityUntouched() {
        assertEquals("Cm-7", LiteralNormalizer.normalize("Cm-7"));
        assertEquals("ii-7", LiteralNormalizer.normalize("ii-7"));
        assertEquals("iv-6", LiteralNormalizer.normalize("iv-6"));
    }

    @Test
    @DisplayName("Suspension phrasings fold to sus4")
    void suspensionFolding() {
        assertEquals("C7 sus4", LiteralNormalizer.normalize("C7 add4 subtract3"));
        assertEquals("C7sus4", LiteralNormalizer.normalize("C7add4 no3"));
        assertEquals("Dsus4", LiteralNormalizer.normalize("Dadd11 no3"));
        assertEquals("Gsus4", LiteralNormalizer.normalize("Gsus 4"));
        assertEquals("D7sus4", LiteralNormalizer.normalize("D7sus4 sus4"));
    }

    @Test
    @DisplayName("Whitespace is trimmed and collapsed")
    void whitespace() {
        assertEquals("Cm7 b5", LiteralNormalizer.normalize("  Cm7   b5 "));
    }

    @Test
    @DisplayName("Null and empty input yield an empty literal")
    void emptyInput() {
        assertEquals("", LiteralNormalizer.normalize(null));
        assertEquals("", LiteralNormalizer.normalize(""));
        assertEquals("", LiteralNormalizer.normalize("   "));
    }

    @Test
    @DisplayName("Normalizing twice changes nothing")
    void idempotent() {
        for (String raw : List.of("E-7", "F+/A", "C7 add4 subtract3", "Gsus  4", "B- maj7", "N.C.")) {
            String once = LiteralNormalizer.normalize(raw);
            assertEquals(once, LiteralNormalizer.normalize(once), raw);
        }
    }
}
