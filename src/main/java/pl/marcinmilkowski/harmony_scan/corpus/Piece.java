package pl.marcinmilkowski.harmony_scan.corpus;

import pl.marcinmilkowski.harmony_scan.chord.ChordEvent;

import java.nio.file.Path;
import java.util.List;

/**
 * A piece of the corpus with its chord events, as delivered by a {@link PieceSource}.
 */
public record Piece(
    String title,               // Metadata title, or the file stem
    Path path,                  // Source file
    KeyDescriptor key,          // Resolved key
    List<ChordEvent> events     // Chord events in any order
) {

    public Piece {
        events = List.copyOf(events);
    }
}
