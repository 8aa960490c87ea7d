package pl.marcinmilkowski.harmony_scan.indexer;

import org.apache.lucene.util.BytesRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.harmony_scan.chord.ChordToken;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChordSequenceCodecTest {

    @Test
    @DisplayName("Literals longer than 64 KiB survive encoding")
    void longLiteral() throws IOException {
        String literal = "Cmaj7 ".repeat(12_000) + "ø";
        List<ChordToken> sequence = List.of(
            new ChordToken(1, "Imaj7", literal),
            new ChordToken(2, "", "N.C."));

        BytesRef encoded = ChordSequenceCodec.encode(sequence);
        assertTrue(encoded.length > 65_535);
        assertEquals(sequence, ChordSequenceCodec.decode(encoded));
    }

    @Test
    @DisplayName("Unknown version and truncated data are rejected")
    void corruptInput() {
        BytesRef encoded = ChordSequenceCodec.encode(List.of(new ChordToken(3, "V7", "G7")));

        byte[] wrongVersion = Arrays.copyOfRange(encoded.bytes, encoded.offset, encoded.offset + encoded.length);
        wrongVersion[0] = 9;
        assertThrows(IOException.class, () -> ChordSequenceCodec.decode(new BytesRef(wrongVersion)));

        BytesRef truncated = new BytesRef(encoded.bytes, encoded.offset, encoded.length - 2);
        assertThrows(IOException.class, () -> ChordSequenceCodec.decode(truncated));
    }
}
