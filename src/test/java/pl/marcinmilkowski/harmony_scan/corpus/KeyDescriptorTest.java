package pl.marcinmilkowski.harmony_scan.corpus;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyDescriptorTest {

    @Test
    void parsesKeyStrings() {
        assertEquals("C major", KeyDescriptor.parse("C").displayName());
        assertEquals("C minor", KeyDescriptor.parse("c").displayName());
        assertEquals("Eb major", KeyDescriptor.parse("Eb").displayName());
        assertEquals("Ab major", KeyDescriptor.parse("A-").displayName());
        assertEquals("F# minor", KeyDescriptor.parse("F# minor").displayName());
        assertEquals("Bb minor", KeyDescriptor.parse("b- Minor").displayName());
    }

    @Test
    void rendersAccidentals() {
        KeyDescriptor key = new KeyDescriptor("E-", null);
        assertEquals("Eb", key.tonicName());
        assertEquals("major", key.mode());
        assertEquals("C# major", new KeyDescriptor("C+", "major").toString());
    }

    @Test
    void rejectsUnrecognizedKeys() {
        assertThrows(IllegalArgumentException.class, () -> KeyDescriptor.parse(""));
        assertThrows(IllegalArgumentException.class, () -> KeyDescriptor.parse(null));
        assertThrows(IllegalArgumentException.class, () -> KeyDescriptor.parse("C sharp minor"));
        assertThrows(IllegalArgumentException.class, () -> new KeyDescriptor(" ", "major"));
    }
}
