package pl.marcinmilkowski.harmony_scan.corpus;

import java.nio.file.Path;

/**
 * Supplies a parsed piece (chords, key, raw Roman-numeral analysis) for a corpus file.
 *
 * This is where score parsing, key resolution and harmonic analysis plug in.
 * Implementations must be safe to call from several threads.
 */
public interface PieceSource {

    /**
     * Read one piece.
     *
     * @throws PieceReadException if the file cannot be parsed or its key cannot be resolved
     */
    Piece read(Path path) throws PieceReadException;
}
