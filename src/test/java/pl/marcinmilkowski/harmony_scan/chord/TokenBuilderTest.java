package pl.marcinmilkowski.harmony_scan.chord;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenBuilderTest {

    private final TokenBuilder builder = new TokenBuilder();

    @Test
    @DisplayName("Dominant sevenths always get an upper-case degree")
    void dominantForcesUpperCase() {
        assertEquals("V7", builder.buildToken("v", "7", Quality.DOMINANT_7, "D7sus4"));
        assertEquals("bVII7", builder.buildToken("bvii", "7", Quality.DOMINANT_7, "Bb7"));
    }

    @Test
    @DisplayName("Minor-type qualities get a lower-case degree")
    void minorQualitiesLowerCase() {
        assertEquals("i-6", builder.buildToken("i", "", Quality.MINOR_SIX, "Cm6"));
        assertEquals("ii-7", builder.buildToken("II", "7", Quality.MINOR_SEVEN, "Dm7"));
        assertEquals("viio7", builder.buildToken("vii", "o7", Quality.DIMINISHED_7, "Bdim7"));
        assertEquals("viiø7", builder.buildToken("VII", "", Quality.HALF_DIMINISHED_7, "Bm7b5"));
        assertEquals("ivmaj7", builder.buildToken("IV", "", Quality.MINOR_MAJ7, "FmMaj7"));
        assertEquals("vi", builder.buildToken("VI", "", Quality.MINOR_TRIAD, "Am"));
    }

    @Test
    @DisplayName("Major qualities keep a lower-case raw degree")
    void majorKeepsRawLowerCase() {
        assertEquals("Imaj7", builder.buildToken("I", "7", Quality.MAJOR_MAJ7, "Cmaj7"));
        assertEquals("I6", builder.buildToken("I", "", Quality.MAJOR_SIX, "C6"));
        assertEquals("bVI", builder.buildToken("bVI", "", Quality.MAJOR_PLAIN, "Ab"));
        assertEquals("iii", builder.buildToken("iii", "", Quality.MAJOR_PLAIN, "E"));
    }

    @Test
    @DisplayName("Six-nine follows the configured spelling")
    void sixNineStyle() {
        assertEquals("IV69", new TokenBuilder(SixNineStyle.COMPACT)
            .buildToken("IV", "", Quality.MAJOR_SIX_NINE, "F6/9"));
        assertEquals("IV6/9", new TokenBuilder(SixNineStyle.SLASHED)
            .buildToken("IV", "", Quality.MAJOR_SIX_NINE, "F69"));
    }

    @Test
    @DisplayName("Flat and sharp nines are appended as tensions")
    void tensions() {
        assertEquals("V7(b9)", builder.buildToken("V", "7", Quality.DOMINANT_7, "G7b9"));
        assertEquals("V7(#9)", builder.buildToken("V", "7", Quality.DOMINANT_7, "G7#9"));
        assertEquals("V7(b9,#9)", builder.buildToken("V", "7", Quality.DOMINANT_7, "G7#9b9"));
        assertEquals("V7(b9)", builder.buildToken("V", "7", Quality.DOMINANT_7, "G7(b9)"));
    }

    @Test
    @DisplayName("A root spelled Gb followed by 9 is not a flat-nine tension")
    void rootFlatIsNotTension() {
        assertEquals(List.of(), TokenBuilder.tensions("Gb9"));
        assertEquals("bII7", builder.buildToken("bII", "9", Quality.DOMINANT_7, "Gb9"));
        assertEquals(List.of("b9"), TokenBuilder.tensions("Gb7b9"));
    }

    @Test
    @DisplayName("Unresolved quality keeps the degree and a best-effort suffix")
    void unresolved() {
        assertEquals("V", builder.buildToken("V", "65", Quality.UNRESOLVED, ""));
        assertEquals("vi", builder.buildToken("vi", "", Quality.UNRESOLVED, ""));
        assertEquals("V9", builder.buildToken("V", "9", Quality.UNRESOLVED, ""));
        assertEquals("V+", builder.buildToken("V", "+ 43", Quality.UNRESOLVED, ""));
    }

    @Test
    @DisplayName("A head outside the numeral vocabulary yields the raw figure")
    void invalidHead() {
        assertEquals("Ger65", builder.buildToken("Ger", "65", Quality.UNRESOLVED, ""));
        assertEquals("", builder.buildToken("", "", Quality.UNRESOLVED, ""));
    }
}
